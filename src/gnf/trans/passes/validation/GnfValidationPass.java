package gnf.trans.passes.validation;

import gnf.errors.IssueContext;
import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Symbol;
import gnf.model.grammar.Variable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 *
 * Checks that a grammar is in Greibach normal form.
 *
 * Every body must be a terminal followed by zero or more variables, and every variable that
 * occurs in a body must have an entry of its own. Each offending body is reported once per
 * reason.
 *
 */
public class GnfValidationPass {
	private GnfValidationPass() {}

	public static void perform(IssueContext ctx, Grammar grammar) {
		for (Variable head : grammar.getVariables()) {
			for (Body body : grammar.getBodies(head)) {
				if (body.isEmpty()) {
					ctx.error(new GnfViolationIssue(head, body, GnfViolationIssue.Reason.EMPTY_BODY));
					continue;
				}
				if (!body.first().isTerminal()) {
					ctx.error(new GnfViolationIssue(head, body, GnfViolationIssue.Reason.LEADING_VARIABLE));
				}
				for (Symbol symbol : body.rest()) {
					if (symbol.isTerminal()) {
						ctx.error(new GnfViolationIssue(head, body, GnfViolationIssue.Reason.NON_LEADING_TERMINAL));
						break;
					}
				}
				Set<Variable> undefined = new LinkedHashSet<>();
				for (Symbol symbol : body) {
					if (symbol.isVariable() && !grammar.hasVariable((Variable) symbol)) {
						undefined.add((Variable) symbol);
					}
				}
				for (Variable variable : undefined) {
					ctx.error(new UndefinedVariableIssue(head, body, variable));
				}
			}
		}
	}

	public static boolean isGreibachNormalForm(Grammar grammar) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		perform(ctx, grammar);
		return !ctx.hasErrors();
	}
}
