package gnf.trans.passes.recursion;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;
import gnf.model.grammar.Variable;

/**
 * A variable left without any production that could start a terminal string. Either it only
 * ever recurses into itself or it was declared without productions.
 */
public class UnreducibleVariableIssue extends Issue {

	private final Variable variable;

	public UnreducibleVariableIssue(Variable variable) {
		this.variable = variable;
	}

	public Variable getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
