package gnf.trans;

import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;

import java.util.List;

public class GnfConversionResult {
	private final Grammar grammar;
	private final List<Variable> order;
	private final List<Variable> auxiliaryVariables;
	private final long substitutionSteps;

	public GnfConversionResult(Grammar grammar, List<Variable> order, List<Variable> auxiliaryVariables,
	                           long substitutionSteps) {
		this.grammar = grammar;
		this.order = order;
		this.auxiliaryVariables = auxiliaryVariables;
		this.substitutionSteps = substitutionSteps;
	}

	/**
	 * @return the converted grammar; frozen
	 */
	public Grammar getGrammar() {
		return grammar;
	}

	/**
	 * @return the order A_1 .. A_m the original variables were processed in
	 */
	public List<Variable> getOrder() {
		return order;
	}

	/**
	 * @return the auxiliary variables introduced by the conversion, in creation order
	 */
	public List<Variable> getAuxiliaryVariables() {
		return auxiliaryVariables;
	}

	public long getSubstitutionSteps() {
		return substitutionSteps;
	}
}
