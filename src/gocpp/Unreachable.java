package gocpp;

/**
 * Thrown where a checked exception is declared but cannot occur, such as an IOException from an in-memory writer.
 */
public class Unreachable extends RuntimeException {
	public Unreachable(String operation, Throwable cause) {
		super(operation + " failed although it cannot fail", cause);
	}
}
