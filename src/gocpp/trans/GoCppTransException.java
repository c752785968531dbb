package gocpp.trans;

import gocpp.GoCppException;

/**
 * Exception during Go source to C++ source translation
 *
 */
public class GoCppTransException extends GoCppException {

	private static final long serialVersionUID = -1752641749710219477L;
	private static final String prefix = "Translation Error";

	public GoCppTransException(String msg) {
		super(prefix, msg);
	}

}
