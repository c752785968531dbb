package gocpp.formatters;

import gocpp.errors.IssueVisitor;
import gocpp.errors.IssueWithContext;
import gocpp.trans.intermediate.ExternalCompilerFailureIssue;
import gocpp.trans.intermediate.IOErrorIssue;
import gocpp.trans.intermediate.OptionParserIssue;
import gocpp.trans.intermediate.UnimplementedLoopFormIssue;
import gocpp.trans.intermediate.UnrecognizedDeclarationIssue;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.trans.intermediate.UnsupportedFormatVerbIssue;
import gocpp.trans.intermediate.UnsupportedLiteralFormIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeSourceLine(String sourceLine) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("> ");
			out.write(sourceLine);
		}
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(UnsupportedLiteralFormIssue unsupportedLiteralFormIssue) throws IOException {
		out.write("unsupported literal form: ");
		out.write(unsupportedLiteralFormIssue.getDescription());
		writeSourceLine(unsupportedLiteralFormIssue.getSourceLine());
		return null;
	}

	@Override
	public Void visit(UnrecognizedDeclarationIssue unrecognizedDeclarationIssue) throws IOException {
		out.write("unrecognized ");
		out.write(unrecognizedDeclarationIssue.getDeclarationKind());
		out.write(" declaration");
		writeSourceLine(unrecognizedDeclarationIssue.getSourceLine());
		return null;
	}

	@Override
	public Void visit(UnsupportedFormatVerbIssue unsupportedFormatVerbIssue) throws IOException {
		out.write("unsupported format verb ");
		out.write(unsupportedFormatVerbIssue.getVerb());
		out.write(" in formatted print call");
		writeSourceLine(unsupportedFormatVerbIssue.getSourceLine());
		return null;
	}

	@Override
	public Void visit(UnimplementedLoopFormIssue unimplementedLoopFormIssue) throws IOException {
		out.write("unimplemented loop form: ");
		out.write(unimplementedLoopFormIssue.getDescription());
		writeSourceLine(unimplementedLoopFormIssue.getSourceLine());
		return null;
	}

	@Override
	public Void visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws IOException {
		out.write("unsupported feature: ");
		out.write(unsupportedFeatureIssue.getDescription());
		writeSourceLine(unsupportedFeatureIssue.getSourceLine());
		return null;
	}

	@Override
	public Void visit(ExternalCompilerFailureIssue externalCompilerFailureIssue) throws IOException {
		out.write("failed to compile the generated C++ code with ");
		out.write(externalCompilerFailureIssue.getCompiler());
		out.write(" (exit status ");
		out.write(Integer.toString(externalCompilerFailureIssue.getExitStatus()));
		out.write("):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write(externalCompilerFailureIssue.getGeneratedSource().trim());
		}
		out.newLine();
		out.write("Errors:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write(externalCompilerFailureIssue.getDiagnostics().trim());
		}
		return null;
	}
}
