package gnf.trans.passes.substitution;

import gnf.InternalConverterError;
import gnf.errors.IssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Symbol;
import gnf.model.grammar.Variable;
import gnf.trans.WhileRewritingVariable;
import gnf.trans.passes.validation.UndefinedVariableIssue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 *
 * Expands leading variables until every body starts with a terminal.
 *
 * Original variables are rewritten from A_m down to A_1: each of them can only start with
 * higher-ranked variables, which are already done. Auxiliary variables follow in an order where
 * every auxiliary variable comes after the auxiliary variables its bodies start with; that order
 * is checked to exist before anything is rewritten.
 *
 */
public class BackSubstitutionPass {
	private static final Logger logger = Logger.getLogger(BackSubstitutionPass.class.getName());

	private BackSubstitutionPass() {}

	public static Grammar perform(IssueContext ctx, Grammar grammar, List<Variable> order,
	                              List<Variable> auxiliaries, Substitution substitution) {
		Set<Variable> done = new HashSet<>();
		for (int i = order.size() - 1; i >= 0; --i) {
			rewrite(ctx, grammar, order.get(i), done, substitution);
		}

		List<Variable> auxiliaryOrder = orderAuxiliaries(ctx, grammar, auxiliaries);
		if (auxiliaryOrder == null) {
			return grammar;
		}
		for (Variable auxiliary : auxiliaryOrder) {
			rewrite(ctx, grammar, auxiliary, done, substitution);
		}
		return grammar;
	}

	/**
	 * Sorts auxiliaries so that each one comes after every auxiliary its bodies start with,
	 * keeping creation order wherever the dependencies allow it.
	 *
	 * @return the processing order, or null if the dependencies are cyclic
	 */
	static List<Variable> orderAuxiliaries(IssueContext ctx, Grammar grammar, List<Variable> auxiliaries) {
		Set<Variable> auxiliarySet = new HashSet<>(auxiliaries);
		Map<Variable, Set<Variable>> dependencies = new HashMap<>();
		for (Variable auxiliary : auxiliaries) {
			Set<Variable> leading = new LinkedHashSet<>();
			for (Body body : grammar.getBodies(auxiliary)) {
				Symbol first = body.first();
				if (first != null && auxiliarySet.contains(first)) {
					leading.add((Variable) first);
				}
			}
			dependencies.put(auxiliary, leading);
		}

		List<Variable> result = new ArrayList<>();
		Set<Variable> finished = new HashSet<>();
		List<Variable> path = new ArrayList<>();
		for (Variable auxiliary : auxiliaries) {
			if (!visit(ctx, auxiliary, dependencies, finished, path, result)) {
				return null;
			}
		}
		return result;
	}

	private static boolean visit(IssueContext ctx, Variable variable, Map<Variable, Set<Variable>> dependencies,
	                             Set<Variable> finished, List<Variable> path, List<Variable> result) {
		if (finished.contains(variable)) {
			return true;
		}
		int onPath = path.indexOf(variable);
		if (onPath != -1) {
			List<Variable> cycle = new ArrayList<>(path.subList(onPath, path.size()));
			cycle.add(variable);
			ctx.error(new CyclicAuxiliaryDependencyIssue(cycle));
			return false;
		}
		path.add(variable);
		for (Variable dependency : dependencies.get(variable)) {
			if (!visit(ctx, dependency, dependencies, finished, path, result)) {
				return false;
			}
		}
		path.remove(path.size() - 1);
		finished.add(variable);
		result.add(variable);
		return true;
	}

	private static void rewrite(IssueContext ctx, Grammar grammar, Variable target, Set<Variable> done,
	                            Substitution substitution) {
		IssueContext nested = ctx.withContext(
				new WhileRewritingVariable(target, WhileRewritingVariable.Phase.BACK_SUBSTITUTION));
		while (true) {
			Set<Variable> leading = new LinkedHashSet<>();
			for (Body body : grammar.getBodies(target)) {
				Symbol first = body.first();
				if (first != null && first.isVariable()) {
					leading.add((Variable) first);
				}
			}
			if (leading.isEmpty()) {
				break;
			}
			for (Variable variable : leading) {
				if (!grammar.hasVariable(variable)) {
					dropUndefined(nested, grammar, target, variable);
				} else if (!done.contains(variable)) {
					throw new InternalConverterError(
							target + " starts with " + variable + ", which has not been rewritten yet");
				} else {
					substitution.substitute(grammar, target, variable);
				}
			}
		}
		done.add(target);
	}

	private static void dropUndefined(IssueContext ctx, Grammar grammar, Variable target, Variable undefined) {
		List<Body> kept = new ArrayList<>();
		for (Body body : grammar.getBodies(target)) {
			if (body.startsWith(undefined)) {
				logger.warning("dropping " + target + " -> " + body + ": " + undefined + " has no productions");
				ctx.error(new UndefinedVariableIssue(target, body, undefined));
			} else {
				kept.add(body);
			}
		}
		grammar.replaceBodies(target, kept);
	}
}
