package gocpp.trans.intermediate;

import gocpp.errors.Issue;
import gocpp.errors.IssueVisitor;

public class UnsupportedFormatVerbIssue extends Issue {

	private final String verb;
	private final String sourceLine;

	public UnsupportedFormatVerbIssue(String verb, String sourceLine) {
		this.verb = verb;
		this.sourceLine = sourceLine;
	}

	public String getVerb() {
		return verb;
	}

	public String getSourceLine() {
		return sourceLine;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
