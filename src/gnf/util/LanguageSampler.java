package gnf.util;

import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Symbol;
import gnf.model.grammar.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 *
 * Enumerates every terminal string of bounded length that a variable derives.
 *
 * Sentential forms are expanded at their leftmost variable. Since no production has an empty
 * body, each symbol of a form yields at least one terminal, so any form longer than the bound can
 * be discarded. Visited forms are remembered, which keeps unit cycles from looping.
 *
 * Strings are returned with their terminals separated by single spaces.
 *
 */
public class LanguageSampler {

	public static final long DEFAULT_BUDGET = 5_000_000;

	private final Grammar grammar;
	private final int maxLength;
	private final long budget;

	public LanguageSampler(Grammar grammar, int maxLength) {
		this(grammar, maxLength, DEFAULT_BUDGET);
	}

	public LanguageSampler(Grammar grammar, int maxLength, long budget) {
		this.grammar = grammar;
		this.maxLength = maxLength;
		this.budget = budget;
	}

	/**
	 * @throws IllegalStateException if more than budget sentential forms had to be expanded
	 */
	public Set<String> sample(Variable start) {
		Set<String> language = new TreeSet<>();
		Set<List<Symbol>> visited = new HashSet<>();
		Deque<List<Symbol>> pending = new ArrayDeque<>();
		List<Symbol> initial = new ArrayList<>();
		initial.add(start);
		pending.add(initial);
		visited.add(initial);
		long expanded = 0;

		while (!pending.isEmpty()) {
			List<Symbol> form = pending.poll();
			int leftmost = leftmostVariable(form);
			if (leftmost == -1) {
				language.add(render(form));
				continue;
			}
			if (++expanded > budget) {
				throw new IllegalStateException(
						"gave up sampling after expanding " + budget + " sentential forms");
			}
			Variable variable = (Variable) form.get(leftmost);
			for (Body body : grammar.getBodies(variable)) {
				if (form.size() - 1 + body.size() > maxLength) {
					continue;
				}
				List<Symbol> next = new ArrayList<>(form.size() - 1 + body.size());
				next.addAll(form.subList(0, leftmost));
				next.addAll(body.getSymbols());
				next.addAll(form.subList(leftmost + 1, form.size()));
				if (!next.isEmpty() && visited.add(next)) {
					pending.add(next);
				}
			}
		}
		return language;
	}

	private static int leftmostVariable(List<Symbol> form) {
		for (int i = 0; i < form.size(); ++i) {
			if (form.get(i).isVariable()) {
				return i;
			}
		}
		return -1;
	}

	private static String render(List<Symbol> form) {
		StringBuilder sb = new StringBuilder();
		for (Symbol symbol : form) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append(symbol.getName());
		}
		return sb.toString();
	}
}
