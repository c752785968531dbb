package gocpp.errors;

import gocpp.trans.intermediate.WhileTranslatingLine;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileTranslatingLine whileTranslatingLine) throws E;

}
