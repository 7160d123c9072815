package gnf.model.grammar;

/**
 * A grammar together with the variable its language is generated from.
 */
public class GrammarDefinition {
	private final Grammar grammar;
	private final Variable start;

	public GrammarDefinition(Grammar grammar, Variable start) {
		this.grammar = grammar;
		this.start = start;
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public Variable getStart() {
		return start;
	}
}
