package gnf.model.grammar;

public abstract class SymbolVisitor<T, E extends Throwable> {
	public abstract T visit(Terminal terminal) throws E;
	public abstract T visit(Variable variable) throws E;
}
