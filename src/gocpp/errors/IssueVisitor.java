package gocpp.errors;

import gocpp.trans.intermediate.ExternalCompilerFailureIssue;
import gocpp.trans.intermediate.IOErrorIssue;
import gocpp.trans.intermediate.OptionParserIssue;
import gocpp.trans.intermediate.UnimplementedLoopFormIssue;
import gocpp.trans.intermediate.UnrecognizedDeclarationIssue;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.trans.intermediate.UnsupportedFormatVerbIssue;
import gocpp.trans.intermediate.UnsupportedLiteralFormIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(UnsupportedLiteralFormIssue unsupportedLiteralFormIssue) throws E;
	public abstract T visit(UnrecognizedDeclarationIssue unrecognizedDeclarationIssue) throws E;
	public abstract T visit(UnsupportedFormatVerbIssue unsupportedFormatVerbIssue) throws E;
	public abstract T visit(UnimplementedLoopFormIssue unimplementedLoopFormIssue) throws E;
	public abstract T visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws E;
	public abstract T visit(ExternalCompilerFailureIssue externalCompilerFailureIssue) throws E;
}
