package gocpp.trans.intermediate;

import gocpp.errors.Issue;
import gocpp.errors.IssueVisitor;

/**
 * A var, const or type declaration whose shape matches none of the supported forms.
 */
public class UnrecognizedDeclarationIssue extends Issue {

	private final String declarationKind;
	private final String sourceLine;

	public UnrecognizedDeclarationIssue(String declarationKind, String sourceLine) {
		this.declarationKind = declarationKind;
		this.sourceLine = sourceLine;
	}

	/**
	 * @return "var", "const" or "type"
	 */
	public String getDeclarationKind() {
		return declarationKind;
	}

	public String getSourceLine() {
		return sourceLine;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
