package gocpp.trans.intermediate;

import gocpp.errors.Issue;
import gocpp.errors.IssueVisitor;

/**
 * The native compiler rejected the generated unit. Both the unit and the compiler's own diagnostics are kept so they
 * can be shown verbatim.
 */
public class ExternalCompilerFailureIssue extends Issue {

	private final String compiler;
	private final int exitStatus;
	private final String generatedSource;
	private final String diagnostics;

	public ExternalCompilerFailureIssue(String compiler, int exitStatus, String generatedSource, String diagnostics) {
		this.compiler = compiler;
		this.exitStatus = exitStatus;
		this.generatedSource = generatedSource;
		this.diagnostics = diagnostics;
	}

	public String getCompiler() {
		return compiler;
	}

	public int getExitStatus() {
		return exitStatus;
	}

	public String getGeneratedSource() {
		return generatedSource;
	}

	public String getDiagnostics() {
		return diagnostics;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
