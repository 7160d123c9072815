package gnf.formatters;

import gnf.model.grammar.SymbolVisitor;
import gnf.model.grammar.Terminal;
import gnf.model.grammar.Variable;

import java.io.IOException;

public class SymbolFormattingVisitor extends SymbolVisitor<Void, IOException> {

	private final IndentingWriter out;

	public SymbolFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(Terminal terminal) throws IOException {
		out.write(terminal.getName());
		return null;
	}

	@Override
	public Void visit(Variable variable) throws IOException {
		out.write(variable.getName());
		return null;
	}

}
