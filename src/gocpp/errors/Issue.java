package gocpp.errors;

import gocpp.Unreachable;
import gocpp.formatters.IndentingWriter;
import gocpp.formatters.IssueFormattingVisitor;
import gocpp.trans.GoCppTransException;
import gocpp.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem with the Go input or the environment. Issues are collected into an {@link IssueContext} rather than
 * thrown out of a pass, so that one run reports every line it could not translate.
 */
public abstract class Issue extends GoCppTransException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable("formatting an issue into a string", e);
		}
		return sw.getBuffer().toString();
	}

	/**
	 * @return the source line the issue was found on, or null for issues not tied to a line
	 */
	public SourceLocation getLocation() {
		return null;
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
