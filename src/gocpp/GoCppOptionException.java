package gocpp;

/**
 * Raised when the command line or the JSON configuration file cannot be
 * turned into a usable set of options.
 */
public class GoCppOptionException extends Exception {

	private static final long serialVersionUID = 4125018730531902274L;

	public GoCppOptionException(String msg) {
		super(msg);
	}

}
