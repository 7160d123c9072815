package gnf.model.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The right-hand side of a production: an immutable sequence of symbols, compared structurally.
 */
public final class Body implements Iterable<Symbol> {

	private static final Body EMPTY = new Body(Collections.emptyList());

	private final List<Symbol> symbols;

	public Body(List<Symbol> symbols) {
		this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
	}

	public static Body of(Symbol... symbols) {
		return new Body(Arrays.asList(symbols));
	}

	public static Body empty() {
		return EMPTY;
	}

	public List<Symbol> getSymbols() {
		return symbols;
	}

	public int size() {
		return symbols.size();
	}

	public boolean isEmpty() {
		return symbols.isEmpty();
	}

	public Symbol get(int index) {
		return symbols.get(index);
	}

	/**
	 * @return the leading symbol, or null for the empty body
	 */
	public Symbol first() {
		return symbols.isEmpty() ? null : symbols.get(0);
	}

	public boolean startsWith(Symbol symbol) {
		return !symbols.isEmpty() && symbols.get(0).equals(symbol);
	}

	/**
	 * @return everything after the leading symbol
	 */
	public Body rest() {
		if (symbols.size() <= 1) {
			return EMPTY;
		}
		return new Body(symbols.subList(1, symbols.size()));
	}

	public Body concat(Body suffix) {
		if (suffix.isEmpty()) {
			return this;
		}
		if (isEmpty()) {
			return suffix;
		}
		List<Symbol> joined = new ArrayList<>(symbols.size() + suffix.size());
		joined.addAll(symbols);
		joined.addAll(suffix.symbols);
		return new Body(joined);
	}

	public Body append(Symbol symbol) {
		List<Symbol> joined = new ArrayList<>(symbols.size() + 1);
		joined.addAll(symbols);
		joined.add(symbol);
		return new Body(joined);
	}

	@Override
	public Iterator<Symbol> iterator() {
		return symbols.iterator();
	}

	@Override
	public int hashCode() {
		return symbols.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Body other = (Body) obj;
		return symbols.equals(other.symbols);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Symbol symbol : symbols) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append(symbol.getName());
		}
		return sb.toString();
	}
}
