package gnf.model.grammar;

/**
 *
 * A grammar symbol, either a {@link Terminal} or a {@link Variable}.
 *
 * Symbols are immutable values: two symbols are equal when they are of the same
 * kind and carry the same name and order key. Only variables take part in the
 * total order used by the conversion passes; terminals carry {@link #NO_ORDER}.
 *
 */
public abstract class Symbol implements Comparable<Symbol> {
	public static final int NO_ORDER = -1;

	private final String name;

	public Symbol(String name) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("symbol names must be non-empty");
		}
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public abstract int getOrderKey();

	public abstract boolean isTerminal();

	public boolean isVariable() {
		return !isTerminal();
	}

	public abstract <T, E extends Throwable> T accept(SymbolVisitor<T, E> v) throws E;

	/**
	 * Terminals sort before variables, terminals by name and variables by order key, then name.
	 */
	@Override
	public int compareTo(Symbol o) {
		if (isTerminal() != o.isTerminal()) {
			return isTerminal() ? -1 : 1;
		}
		int byKey = Integer.compare(getOrderKey(), o.getOrderKey());
		if (byKey != 0) {
			return byKey;
		}
		return getName().compareTo(o.getName());
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		return name;
	}
}
