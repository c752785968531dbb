package gocpp.errors;

import gocpp.trans.intermediate.WhileTranslatingLine;
import gocpp.util.SourceLocation;

public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}

	/**
	 * Reports an issue found while translating the given line.
	 */
	public void errorAt(SourceLocation location, Issue err) {
		withContext(new WhileTranslatingLine(location)).error(err);
	}
}
