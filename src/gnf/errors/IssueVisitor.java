package gnf.errors;

import gnf.trans.IOErrorIssue;
import gnf.trans.passes.ordering.InvalidOrderingIssue;
import gnf.trans.passes.parse.json.JsonGrammarIssue;
import gnf.trans.passes.parse.option.OptionParserIssue;
import gnf.trans.passes.recursion.NameCollisionIssue;
import gnf.trans.passes.recursion.OrderKeyOverflowIssue;
import gnf.trans.passes.recursion.UnreducibleVariableIssue;
import gnf.trans.passes.substitution.CyclicAuxiliaryDependencyIssue;
import gnf.trans.passes.validation.EmptyBodyIssue;
import gnf.trans.passes.validation.GnfViolationIssue;
import gnf.trans.passes.validation.UndefinedVariableIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(JsonGrammarIssue jsonGrammarIssue) throws E;
	public abstract T visit(EmptyBodyIssue emptyBodyIssue) throws E;
	public abstract T visit(UndefinedVariableIssue undefinedVariableIssue) throws E;
	public abstract T visit(UnreducibleVariableIssue unreducibleVariableIssue) throws E;
	public abstract T visit(NameCollisionIssue nameCollisionIssue) throws E;
	public abstract T visit(OrderKeyOverflowIssue orderKeyOverflowIssue) throws E;
	public abstract T visit(CyclicAuxiliaryDependencyIssue cyclicAuxiliaryDependencyIssue) throws E;
	public abstract T visit(InvalidOrderingIssue invalidOrderingIssue) throws E;
	public abstract T visit(GnfViolationIssue gnfViolationIssue) throws E;
}
