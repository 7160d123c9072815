package gnf.trans.passes.ordering;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;
import gnf.model.grammar.Variable;

public class InvalidOrderingIssue extends Issue {

	public enum Problem {
		DUPLICATE("appears more than once in the ordering"),
		MISSING("has productions but is missing from the ordering"),
		UNKNOWN("is ordered but has no productions"),
		AUXILIARY("is an auxiliary variable and cannot be ordered"),
		SHARED_ORDER_KEY("shares its order key with another variable");

		private final String description;

		Problem(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Variable variable;
	private final Problem problem;

	public InvalidOrderingIssue(Variable variable, Problem problem) {
		this.variable = variable;
		this.problem = problem;
	}

	public Variable getVariable() {
		return variable;
	}

	public Problem getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
