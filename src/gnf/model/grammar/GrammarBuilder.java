package gnf.model.grammar;

import java.util.Arrays;
import java.util.List;

public class GrammarBuilder {
	private GrammarBuilder() {}

	public static Terminal t(String name) {
		return new Terminal(name);
	}

	public static Variable v(String name, int orderKey) {
		return new Variable(name, orderKey);
	}

	public static Body body(Symbol... symbols) {
		return Body.of(symbols);
	}

	public static List<Body> bodies(Body... bodies) {
		return Arrays.asList(bodies);
	}

	public static List<Variable> order(Variable... variables) {
		return Arrays.asList(variables);
	}

	/**
	 * Adds head -> body_1 | ... | body_n to grammar.
	 */
	public static Grammar rule(Grammar grammar, Variable head, Body... bodies) {
		grammar.declare(head);
		for (Body body : bodies) {
			grammar.insert(head, body);
		}
		return grammar;
	}
}
