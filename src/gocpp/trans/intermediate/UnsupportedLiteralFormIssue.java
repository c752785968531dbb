package gocpp.trans.intermediate;

import gocpp.errors.Issue;
import gocpp.errors.IssueVisitor;

/**
 * A literal the translator has no C++ rendering for, such as a raw string literal spanning several lines.
 */
public class UnsupportedLiteralFormIssue extends Issue {

	private final String description;
	private final String sourceLine;

	public UnsupportedLiteralFormIssue(String description, String sourceLine) {
		this.description = description;
		this.sourceLine = sourceLine;
	}

	public String getDescription() {
		return description;
	}

	public String getSourceLine() {
		return sourceLine;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
