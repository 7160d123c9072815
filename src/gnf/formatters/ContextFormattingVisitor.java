package gnf.formatters;

import gnf.errors.ContextVisitor;
import gnf.trans.WhileRewritingVariable;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileRewritingVariable whileRewritingVariable) throws IOException {
		out.write("while rewriting ");
		whileRewritingVariable.getVariable().accept(new SymbolFormattingVisitor(out));
		out.write(" during ");
		out.write(whileRewritingVariable.getPhase().getDescription());
		return null;
	}

}
