package gnf.trans.passes.lifting;

import gnf.errors.IssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Symbol;
import gnf.model.grammar.Terminal;
import gnf.model.grammar.Variable;
import gnf.trans.WhileRewritingVariable;
import gnf.trans.passes.recursion.AuxiliaryVariableGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces every terminal after the leading symbol of a body with an auxiliary variable that
 * derives exactly that terminal. One variable is created per distinct terminal.
 */
public class TerminalLiftingPass {
	private TerminalLiftingPass() {}

	public static Grammar perform(IssueContext ctx, Grammar grammar, AuxiliaryVariableGenerator generator) {
		Map<Terminal, Variable> lifted = new LinkedHashMap<>();
		for (Variable head : grammar.getVariables()) {
			IssueContext nested = ctx.withContext(
					new WhileRewritingVariable(head, WhileRewritingVariable.Phase.TERMINAL_LIFTING));
			boolean changed = false;
			Set<Body> rewritten = new LinkedHashSet<>();
			for (Body body : grammar.getBodies(head)) {
				if (body.isEmpty()) {
					rewritten.add(body);
					continue;
				}
				List<Symbol> symbols = new ArrayList<>(body.size());
				symbols.add(body.first());
				for (Symbol symbol : body.rest()) {
					if (symbol.isTerminal()) {
						Terminal terminal = (Terminal) symbol;
						Variable replacement = lifted.get(terminal);
						if (replacement == null) {
							replacement = generator.terminalVariable(nested, terminal);
							if (replacement == null) {
								return grammar;
							}
							grammar.insert(replacement, Body.of(terminal));
							lifted.put(terminal, replacement);
						}
						symbols.add(replacement);
						changed = true;
					} else {
						symbols.add(symbol);
					}
				}
				rewritten.add(new Body(symbols));
			}
			if (changed) {
				grammar.replaceBodies(head, rewritten);
			}
		}
		return grammar;
	}
}
