package gnf.trans.passes.recursion;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;
import gnf.model.grammar.Variable;

public class NameCollisionIssue extends Issue {

	private final String candidateName;
	private final int candidateOrderKey;
	private final Variable existing;

	public NameCollisionIssue(String candidateName, int candidateOrderKey, Variable existing) {
		this.candidateName = candidateName;
		this.candidateOrderKey = candidateOrderKey;
		this.existing = existing;
	}

	public String getCandidateName() {
		return candidateName;
	}

	public int getCandidateOrderKey() {
		return candidateOrderKey;
	}

	public Variable getExisting() {
		return existing;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
