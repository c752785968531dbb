package gocpp.errors;

import gocpp.util.SourceLocation;

public class IssueWithContext extends Issue {
	private final Context context;
	private final Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	/**
	 * @return the innermost location, since a nested issue may point to a more precise line than its context
	 */
	@Override
	public SourceLocation getLocation() {
		SourceLocation inner = issue.getLocation();
		return inner != null ? inner : context.getLocation();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
