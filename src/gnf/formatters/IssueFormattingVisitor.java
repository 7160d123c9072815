package gnf.formatters;

import gnf.errors.IssueVisitor;
import gnf.errors.IssueWithContext;
import gnf.model.grammar.Variable;
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

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(JsonGrammarIssue jsonGrammarIssue) throws IOException {
		out.write("error reading grammar: ");
		out.write(jsonGrammarIssue.getReason());
		return null;
	}

	@Override
	public Void visit(EmptyBodyIssue emptyBodyIssue) throws IOException {
		out.write("malformed grammar: ");
		new GrammarFormatter(out).writeProduction(emptyBodyIssue.getHead(), emptyBodyIssue.getBody());
		out.write(" has an empty body; epsilon productions must be removed before conversion");
		return null;
	}

	@Override
	public Void visit(UndefinedVariableIssue undefinedVariableIssue) throws IOException {
		out.write("malformed grammar: variable ");
		out.write(undefinedVariableIssue.getUndefined().getName());
		out.write(" referenced by ");
		new GrammarFormatter(out).writeProduction(undefinedVariableIssue.getHead(), undefinedVariableIssue.getBody());
		out.write(" has no productions");
		return null;
	}

	@Override
	public Void visit(UnreducibleVariableIssue unreducibleVariableIssue) throws IOException {
		out.write("variable ");
		out.write(unreducibleVariableIssue.getVariable().getName());
		out.write(" derives no terminal string");
		return null;
	}

	@Override
	public Void visit(NameCollisionIssue nameCollisionIssue) throws IOException {
		out.write("auxiliary variable ");
		out.write(nameCollisionIssue.getCandidateName());
		out.write(" (order key ");
		out.write(Integer.toString(nameCollisionIssue.getCandidateOrderKey()));
		out.write(") collides with existing variable ");
		out.write(nameCollisionIssue.getExisting().getName());
		out.write(" (order key ");
		out.write(Integer.toString(nameCollisionIssue.getExisting().getOrderKey()));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(OrderKeyOverflowIssue orderKeyOverflowIssue) throws IOException {
		out.write("no order key left for auxiliary variable ");
		out.write(orderKeyOverflowIssue.getCandidateName());
		out.write(": the grammar already uses order key ");
		out.write(Integer.toString(orderKeyOverflowIssue.getLargestOrderKey()));
		return null;
	}

	@Override
	public Void visit(CyclicAuxiliaryDependencyIssue cyclicAuxiliaryDependencyIssue) throws IOException {
		out.write("auxiliary variables depend on each other cyclically: ");
		FormattingTools.writeSeparated(
				out, cyclicAuxiliaryDependencyIssue.getCycle(), " -> ", (Variable v) -> out.write(v.getName()));
		return null;
	}

	@Override
	public Void visit(InvalidOrderingIssue invalidOrderingIssue) throws IOException {
		out.write("invalid variable ordering: ");
		out.write(invalidOrderingIssue.getVariable().getName());
		out.write(" ");
		out.write(invalidOrderingIssue.getProblem().getDescription());
		return null;
	}

	@Override
	public Void visit(GnfViolationIssue gnfViolationIssue) throws IOException {
		new GrammarFormatter(out).writeProduction(gnfViolationIssue.getHead(), gnfViolationIssue.getBody());
		out.write(" is not in Greibach normal form: ");
		out.write(gnfViolationIssue.getReason().getDescription());
		return null;
	}
}
