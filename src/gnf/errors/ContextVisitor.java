package gnf.errors;

import gnf.trans.WhileRewritingVariable;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileRewritingVariable whileRewritingVariable) throws E;

}
