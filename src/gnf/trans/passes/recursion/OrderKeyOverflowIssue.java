package gnf.trans.passes.recursion;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;

public class OrderKeyOverflowIssue extends Issue {

	private final String candidateName;
	private final int largestOrderKey;

	public OrderKeyOverflowIssue(String candidateName, int largestOrderKey) {
		this.candidateName = candidateName;
		this.largestOrderKey = largestOrderKey;
	}

	public String getCandidateName() {
		return candidateName;
	}

	public int getLargestOrderKey() {
		return largestOrderKey;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
