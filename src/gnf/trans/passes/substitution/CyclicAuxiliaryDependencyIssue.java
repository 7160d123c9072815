package gnf.trans.passes.substitution;

import gnf.errors.Issue;
import gnf.errors.IssueVisitor;
import gnf.model.grammar.Variable;

import java.util.Collections;
import java.util.List;

public class CyclicAuxiliaryDependencyIssue extends Issue {

	private final List<Variable> cycle;

	public CyclicAuxiliaryDependencyIssue(List<Variable> cycle) {
		this.cycle = Collections.unmodifiableList(cycle);
	}

	/**
	 * @return the variables on the cycle, the first one repeated at the end
	 */
	public List<Variable> getCycle() {
		return cycle;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
