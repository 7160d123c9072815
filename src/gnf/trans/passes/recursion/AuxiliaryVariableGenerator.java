package gnf.trans.passes.recursion;

import gnf.errors.IssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Terminal;
import gnf.model.grammar.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 *
 * Creates the auxiliary variables of one conversion run.
 *
 * Names follow {@code Z_<head>_<n>} for left-recursion elimination and {@code X_<terminal>_<n>}
 * for lifted terminals, where n counts the candidates this generator tried, starting at 1. A
 * candidate whose name is already taken is skipped for the next n. Order keys continue above the
 * largest key in the grammar; running out of keys is reported as an {@link OrderKeyOverflowIssue}.
 *
 */
public class AuxiliaryVariableGenerator {

	private final Grammar grammar;
	private final List<Variable> created;
	private int sequence;
	private int lastOrderKey;

	public AuxiliaryVariableGenerator(Grammar grammar) {
		this.grammar = grammar;
		this.created = new ArrayList<>();
		this.sequence = 0;
		int maxKey = 0;
		for (Variable variable : knownVariables()) {
			maxKey = Math.max(maxKey, variable.getOrderKey());
		}
		this.lastOrderKey = maxKey;
	}

	public Variable recursionVariable(IssueContext ctx, Variable head) {
		return fresh(ctx, "Z_" + head.getName());
	}

	public Variable terminalVariable(IssueContext ctx, Terminal terminal) {
		return fresh(ctx, "X_" + terminal.getName());
	}

	/**
	 * @return the variables created so far, in creation order
	 */
	public List<Variable> getCreatedVariables() {
		return Collections.unmodifiableList(new ArrayList<>(created));
	}

	private Variable fresh(IssueContext ctx, String prefix) {
		Set<Variable> known = knownVariables();
		Set<String> existingNames = new HashSet<>();
		for (Variable variable : known) {
			existingNames.add(variable.getName());
		}
		String name;
		do {
			++sequence;
			name = prefix + "_" + sequence;
		} while (existingNames.contains(name));

		int orderKey;
		try {
			orderKey = Math.addExact(lastOrderKey, 1);
		} catch (ArithmeticException e) {
			ctx.error(new OrderKeyOverflowIssue(name, lastOrderKey));
			return null;
		}
		// keys are handed out above every key seen at construction
		for (Variable existing : known) {
			if (existing.getOrderKey() == orderKey) {
				ctx.error(new NameCollisionIssue(name, orderKey, existing));
				return null;
			}
		}
		lastOrderKey = orderKey;

		Variable variable = new Variable(name, orderKey, true);
		grammar.declare(variable);
		created.add(variable);
		return variable;
	}

	private Set<Variable> knownVariables() {
		Set<Variable> known = new LinkedHashSet<>(grammar.getVariables());
		known.addAll(grammar.getReferencedVariables());
		return known;
	}

}
