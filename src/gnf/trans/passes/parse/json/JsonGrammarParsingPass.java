package gnf.trans.passes.parse.json;

import gnf.errors.IssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.GrammarDefinition;
import gnf.model.grammar.Symbol;
import gnf.model.grammar.Terminal;
import gnf.model.grammar.Variable;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 *
 * Reads a grammar from its JSON description:
 *
 * <pre>
 * { "start": "S",
 *   "variables": ["S", "A"],
 *   "productions": { "S": [["a", "A"], ["b"]], "A": [["a"]] } }
 * </pre>
 *
 * Names listed under "variables" are variables, ordered by their position in that list; every
 * other name is a terminal. "start" defaults to the first variable.
 *
 */
public class JsonGrammarParsingPass {
	public static final String START_FIELD = "start";
	public static final String VARIABLES_FIELD = "variables";
	public static final String PRODUCTIONS_FIELD = "productions";

	private JsonGrammarParsingPass() {}

	/**
	 * @return the grammar and its start variable, or null if an issue was reported
	 */
	public static GrammarDefinition perform(IssueContext ctx, String source) {
		try {
			return parse(ctx, new JSONObject(source));
		} catch (JSONException e) {
			ctx.error(new JsonGrammarIssue(e.getMessage()));
			return null;
		}
	}

	private static GrammarDefinition parse(IssueContext ctx, JSONObject root) {
		JSONArray variableNames = root.optJSONArray(VARIABLES_FIELD);
		if (variableNames == null || variableNames.isEmpty()) {
			ctx.error(new JsonGrammarIssue("\"" + VARIABLES_FIELD + "\" must be a non-empty array of names"));
			return null;
		}
		JSONObject productions = root.optJSONObject(PRODUCTIONS_FIELD);
		if (productions == null) {
			ctx.error(new JsonGrammarIssue("\"" + PRODUCTIONS_FIELD + "\" must be an object"));
			return null;
		}

		Map<String, Variable> variables = new LinkedHashMap<>();
		Grammar grammar = new Grammar();
		for (int i = 0; i < variableNames.length(); ++i) {
			String name = variableNames.getString(i);
			if (name.isEmpty()) {
				ctx.error(new JsonGrammarIssue("variable names must be non-empty"));
				continue;
			}
			if (variables.containsKey(name)) {
				ctx.error(new JsonGrammarIssue("variable " + name + " is declared more than once"));
				continue;
			}
			Variable variable = new Variable(name, i + 1);
			variables.put(name, variable);
			grammar.declare(variable);
		}

		for (String name : productions.keySet()) {
			if (!variables.containsKey(name)) {
				ctx.error(new JsonGrammarIssue("productions given for undeclared variable " + name));
			}
		}

		for (Variable head : variables.values()) {
			JSONArray alternatives = productions.optJSONArray(head.getName());
			if (alternatives == null) {
				continue;
			}
			for (int i = 0; i < alternatives.length(); ++i) {
				JSONArray symbolNames = alternatives.getJSONArray(i);
				List<Symbol> symbols = new ArrayList<>(symbolNames.length());
				for (int j = 0; j < symbolNames.length(); ++j) {
					String name = symbolNames.getString(j);
					if (name.isEmpty()) {
						ctx.error(new JsonGrammarIssue(
								"body " + i + " of " + head.getName() + " contains an empty symbol name"));
						symbols = null;
						break;
					}
					Variable variable = variables.get(name);
					symbols.add(variable != null ? variable : new Terminal(name));
				}
				if (symbols != null) {
					grammar.insert(head, new Body(symbols));
				}
			}
		}

		if (variables.isEmpty()) {
			return null;
		}
		Variable start = variables.values().iterator().next();
		if (root.has(START_FIELD)) {
			String startName = root.getString(START_FIELD);
			start = variables.get(startName);
			if (start == null) {
				ctx.error(new JsonGrammarIssue("start symbol " + startName + " is not a declared variable"));
				return null;
			}
		}
		if (ctx.hasErrors()) {
			return null;
		}
		return new GrammarDefinition(grammar, start);
	}
}
