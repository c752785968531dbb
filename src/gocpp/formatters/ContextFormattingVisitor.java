package gocpp.formatters;

import gocpp.errors.ContextVisitor;
import gocpp.trans.intermediate.WhileTranslatingLine;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileTranslatingLine whileTranslatingLine) throws IOException {
		out.write("while translating line ");
		out.write(Integer.toString(whileTranslatingLine.getLocation().getLine()));
		out.write(" of ");
		out.write(whileTranslatingLine.getLocation().getFileName());
		return null;
	}

}
