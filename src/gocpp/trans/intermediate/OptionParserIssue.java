package gocpp.trans.intermediate;

import gocpp.errors.Issue;
import gocpp.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private String description;

	public OptionParserIssue(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
