package gnf.trans.passes.validation;

import gnf.errors.Issue;
import gnf.model.grammar.Body;
import gnf.model.grammar.Variable;

/**
 * A production that cannot take part in the conversion at all: the offending head and body are
 * kept so the caller can find it in its input.
 */
public abstract class MalformedGrammarIssue extends Issue {

	private final Variable head;
	private final Body body;

	public MalformedGrammarIssue(Variable head, Body body) {
		this.head = head;
		this.body = body;
	}

	public Variable getHead() {
		return head;
	}

	public Body getBody() {
		return body;
	}

}
