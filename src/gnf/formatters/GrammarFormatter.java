package gnf.formatters;

import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;

import java.io.IOException;
import java.util.Collection;

/**
 * Renders grammars as one line per head, {@code head -> body1 | body2 | ...}, with the symbols of
 * a body separated by single spaces.
 */
public class GrammarFormatter {

	public static final String ARROW = " ->";
	public static final String ALTERNATIVE = " | ";
	public static final String EMPTY_BODY = "ε";

	private final IndentingWriter out;
	private final SymbolFormattingVisitor symbols;

	public GrammarFormatter(IndentingWriter out) {
		this.out = out;
		this.symbols = new SymbolFormattingVisitor(out);
	}

	public void writeGrammar(Grammar grammar) throws IOException {
		boolean isFirst = true;
		for (Variable head : grammar.getVariables()) {
			if (!isFirst) {
				out.newLine();
			}
			isFirst = false;
			writeProductions(head, grammar.getBodies(head));
		}
	}

	public void writeProductions(Variable head, Collection<Body> bodies) throws IOException {
		head.accept(symbols);
		out.write(ARROW);
		if (!bodies.isEmpty()) {
			out.write(" ");
			FormattingTools.writeSeparated(out, bodies, ALTERNATIVE, this::writeBody);
		}
	}

	public void writeProduction(Variable head, Body body) throws IOException {
		head.accept(symbols);
		out.write(ARROW);
		out.write(" ");
		writeBody(body);
	}

	public void writeBody(Body body) throws IOException {
		if (body.isEmpty()) {
			out.write(EMPTY_BODY);
			return;
		}
		FormattingTools.writeSeparated(out, body, " ", symbol -> symbol.accept(symbols));
	}

}
