package gocpp.errors;

import gocpp.util.SourceLocation;

public abstract class Context {

	/**
	 * @return the Go source line the context refers to
	 */
	public abstract SourceLocation getLocation();

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E;

}
