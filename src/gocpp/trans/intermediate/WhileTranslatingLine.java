package gocpp.trans.intermediate;

import gocpp.errors.Context;
import gocpp.errors.ContextVisitor;
import gocpp.util.SourceLocation;

public class WhileTranslatingLine extends Context {

	private final SourceLocation location;

	public WhileTranslatingLine(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}
	
	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
