package gnf.trans.passes.validation;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;
import gnf.model.grammar.Body;
import gnf.model.grammar.Variable;

public class GnfViolationIssue extends Issue {

	public enum Reason {
		EMPTY_BODY("the body is empty"),
		LEADING_VARIABLE("the body starts with a variable"),
		NON_LEADING_TERMINAL("a terminal follows the leading symbol");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Variable head;
	private final Body body;
	private final Reason reason;

	public GnfViolationIssue(Variable head, Body body, Reason reason) {
		this.head = head;
		this.body = body;
		this.reason = reason;
	}

	public Variable getHead() {
		return head;
	}

	public Body getBody() {
		return body;
	}

	public Reason getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
