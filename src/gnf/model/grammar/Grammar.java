package gnf.model.grammar;

import gnf.formatters.GrammarFormatter;
import gnf.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 *
 * Maps every head variable to its set of alternative production bodies.
 *
 * Production sets have set semantics (inserting a body twice keeps one copy) and enumerate in
 * insertion order, which keeps every pass over the grammar deterministic. A head, once declared,
 * is never removed: dropping all of its bodies leaves an empty set behind.
 *
 * A grammar is owned by exactly one conversion at a time. {@link #freeze()} turns it read-only
 * once a conversion hands it back.
 *
 */
public class Grammar {

	private final Map<Variable, Set<Body>> productions;
	private boolean frozen;

	public Grammar() {
		this.productions = new LinkedHashMap<>();
		this.frozen = false;
	}

	/**
	 * Makes sure head has an entry, possibly empty.
	 */
	public void declare(Variable head) {
		checkMutable();
		productions.computeIfAbsent(head, k -> new LinkedHashSet<>());
	}

	/**
	 * Adds body to the productions of head, declaring head if needed.
	 *
	 * @return false if the body was already present
	 */
	public boolean insert(Variable head, Body body) {
		checkMutable();
		return productions.computeIfAbsent(head, k -> new LinkedHashSet<>()).add(body);
	}

	/**
	 * Swaps the whole production set of head for the given bodies. Duplicates collapse.
	 */
	public void replaceBodies(Variable head, Collection<Body> bodies) {
		checkMutable();
		productions.put(head, new LinkedHashSet<>(bodies));
	}

	/**
	 * @return the bodies of head whose first symbol equals symbol, in enumeration order
	 */
	public List<Body> bodiesStartingWith(Variable head, Symbol symbol) {
		List<Body> result = new ArrayList<>();
		for (Body body : getBodies(head)) {
			if (body.startsWith(symbol)) {
				result.add(body);
			}
		}
		return result;
	}

	/**
	 * @return a read-only view of the productions of head, empty if head was never declared
	 */
	public Set<Body> getBodies(Variable head) {
		Set<Body> bodies = productions.get(head);
		if (bodies == null) {
			return Collections.emptySet();
		}
		return Collections.unmodifiableSet(bodies);
	}

	public boolean hasVariable(Variable variable) {
		return productions.containsKey(variable);
	}

	/**
	 * @return the declared heads in declaration order; a snapshot, safe to iterate while mutating
	 */
	public List<Variable> getVariables() {
		return Collections.unmodifiableList(new ArrayList<>(productions.keySet()));
	}

	public Variable findVariable(String name) {
		for (Variable variable : productions.keySet()) {
			if (variable.getName().equals(name)) {
				return variable;
			}
		}
		return null;
	}

	/**
	 * @return every variable occurring in some body, whether or not it has an entry
	 */
	public Set<Variable> getReferencedVariables() {
		Set<Variable> referenced = new LinkedHashSet<>();
		for (Set<Body> bodies : productions.values()) {
			for (Body body : bodies) {
				for (Symbol symbol : body) {
					if (symbol.isVariable()) {
						referenced.add((Variable) symbol);
					}
				}
			}
		}
		return referenced;
	}

	public List<Variable> getAuxiliaryVariables() {
		List<Variable> auxiliary = new ArrayList<>();
		for (Variable variable : productions.keySet()) {
			if (variable.isAuxiliary()) {
				auxiliary.add(variable);
			}
		}
		return auxiliary;
	}

	public int size() {
		return productions.size();
	}

	public int getProductionCount() {
		int count = 0;
		for (Set<Body> bodies : productions.values()) {
			count += bodies.size();
		}
		return count;
	}

	public Grammar copy() {
		Grammar copy = new Grammar();
		for (Map.Entry<Variable, Set<Body>> entry : productions.entrySet()) {
			copy.productions.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
		}
		return copy;
	}

	public void freeze() {
		frozen = true;
	}

	public boolean isFrozen() {
		return frozen;
	}

	private void checkMutable() {
		if (frozen) {
			throw new IllegalStateException("grammar is frozen");
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(productions);
	}

	/**
	 * Two grammars are equal when they declare the same heads with the same production sets,
	 * regardless of enumeration order.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Grammar other = (Grammar) obj;
		return productions.equals(other.productions);
	}

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			new GrammarFormatter(new IndentingWriter(out)).writeGrammar(this);
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}
}
