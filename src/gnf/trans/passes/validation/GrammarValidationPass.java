package gnf.trans.passes.validation;

import gnf.errors.IssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import gnf.trans.passes.recursion.UnreducibleVariableIssue;

/**
 * Checks the preconditions of the conversion: no empty bodies, and no declared variable without
 * productions.
 */
public class GrammarValidationPass {
	private GrammarValidationPass() {}

	public static void perform(IssueContext ctx, Grammar grammar) {
		for (Variable head : grammar.getVariables()) {
			if (grammar.getBodies(head).isEmpty()) {
				ctx.error(new UnreducibleVariableIssue(head));
			}
			for (Body body : grammar.getBodies(head)) {
				if (body.isEmpty()) {
					ctx.error(new EmptyBodyIssue(head));
				}
			}
		}
	}
}
