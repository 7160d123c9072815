package gnf.trans.passes.validation;

import gnf.errors.IssueVisitor;
import gnf.model.grammar.Body;
import gnf.model.grammar.Variable;

public class UndefinedVariableIssue extends MalformedGrammarIssue {

	private final Variable undefined;

	public UndefinedVariableIssue(Variable head, Body body, Variable undefined) {
		super(head, body);
		this.undefined = undefined;
	}

	public Variable getUndefined() {
		return undefined;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
