package gnf.trans.passes.parse.json;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;

public class JsonGrammarIssue extends Issue {

	private final String reason;

	public JsonGrammarIssue(String reason) {
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
