package gnf.trans;

import gnf.errors.Context;
import gnf.errors.ContextVisitor;
import gnf.model.grammar.Variable;

public class WhileRewritingVariable extends Context {

	public enum Phase {
		FORWARD_SUBSTITUTION("forward substitution"),
		LEFT_RECURSION_ELIMINATION("left-recursion elimination"),
		BACK_SUBSTITUTION("back substitution"),
		TERMINAL_LIFTING("terminal lifting");

		private final String description;

		Phase(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Variable variable;
	private final Phase phase;

	public WhileRewritingVariable(Variable variable, Phase phase) {
		this.variable = variable;
		this.phase = phase;
	}

	public Variable getVariable() {
		return variable;
	}

	public Phase getPhase() {
		return phase;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
