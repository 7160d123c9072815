package gnf.trans.passes.substitution;

import gnf.errors.IssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import gnf.trans.WhileRewritingVariable;
import gnf.trans.passes.recursion.AuxiliaryVariableGenerator;
import gnf.trans.passes.recursion.LeftRecursionEliminationPass;

import java.util.List;
import java.util.logging.Logger;

/**
 *
 * Makes every original variable reference only higher-ranked variables in leading position.
 *
 * For i = 1..m and j = 1..i-1, every body of A_i starting with A_j is expanded with the bodies
 * of A_j until none is left. A_i is then freed of left recursion before A_{i+1} is looked at, so
 * that A_i never starts with some A_k, k &lt;= i, by the time it is used as a substitution source.
 *
 */
public class ForwardSubstitutionPass {
	private static final Logger logger = Logger.getLogger(ForwardSubstitutionPass.class.getName());

	private ForwardSubstitutionPass() {}

	public static Grammar perform(IssueContext ctx, Grammar grammar, List<Variable> order,
	                              AuxiliaryVariableGenerator generator, Substitution substitution) {
		for (int i = 0; i < order.size(); ++i) {
			Variable target = order.get(i);
			for (int j = 0; j < i; ++j) {
				Variable source = order.get(j);
				while (substitution.substitute(grammar, target, source)) {
					logger.finer("substituted " + source + " into " + target);
				}
			}
			LeftRecursionEliminationPass.perform(
					ctx.withContext(new WhileRewritingVariable(target, WhileRewritingVariable.Phase.LEFT_RECURSION_ELIMINATION)),
					grammar, target, generator);
			if (ctx.hasErrors()) {
				return grammar;
			}
		}
		return grammar;
	}
}
