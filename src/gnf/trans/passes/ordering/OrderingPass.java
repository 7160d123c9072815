package gnf.trans.passes.ordering;

import gnf.errors.IssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixes the total order A_1 < ... < A_m over the original variables of a grammar. Auxiliary
 * variables never take part in it. The resulting list is never modified afterwards.
 */
public class OrderingPass {
	private OrderingPass() {}

	/**
	 * Orders the heads of grammar by ascending order key.
	 */
	public static List<Variable> perform(IssueContext ctx, Grammar grammar) {
		List<Variable> ordered = new ArrayList<>();
		for (Variable variable : grammar.getVariables()) {
			if (!variable.isAuxiliary()) {
				ordered.add(variable);
			}
		}
		ordered.sort(Comparator.comparingInt(Variable::getOrderKey));

		Map<Integer, Variable> byKey = new HashMap<>();
		for (Variable variable : ordered) {
			if (byKey.putIfAbsent(variable.getOrderKey(), variable) != null) {
				ctx.error(new InvalidOrderingIssue(variable, InvalidOrderingIssue.Problem.SHARED_ORDER_KEY));
			}
		}
		return Collections.unmodifiableList(ordered);
	}

	/**
	 * Checks that a caller-supplied order is a permutation of the original heads of grammar.
	 */
	public static List<Variable> perform(IssueContext ctx, Grammar grammar, List<Variable> order) {
		Set<Variable> seen = new HashSet<>();
		for (Variable variable : order) {
			if (variable.isAuxiliary()) {
				ctx.error(new InvalidOrderingIssue(variable, InvalidOrderingIssue.Problem.AUXILIARY));
			} else if (!seen.add(variable)) {
				ctx.error(new InvalidOrderingIssue(variable, InvalidOrderingIssue.Problem.DUPLICATE));
			} else if (!grammar.hasVariable(variable)) {
				ctx.error(new InvalidOrderingIssue(variable, InvalidOrderingIssue.Problem.UNKNOWN));
			}
		}
		for (Variable variable : grammar.getVariables()) {
			if (!variable.isAuxiliary() && !seen.contains(variable)) {
				ctx.error(new InvalidOrderingIssue(variable, InvalidOrderingIssue.Problem.MISSING));
			}
		}
		return Collections.unmodifiableList(new ArrayList<>(order));
	}
}
