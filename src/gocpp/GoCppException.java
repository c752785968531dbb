package gocpp;

/**
 * A gocpp Exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class GoCppException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public GoCppException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
