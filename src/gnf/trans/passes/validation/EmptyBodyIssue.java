package gnf.trans.passes.validation;

import gnf.errors.IssueVisitor;
import gnf.model.grammar.Body;
import gnf.model.grammar.Variable;

public class EmptyBodyIssue extends MalformedGrammarIssue {

	public EmptyBodyIssue(Variable head) {
		super(head, Body.empty());
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
