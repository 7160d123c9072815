package gnf.trans.passes.recursion;

import gnf.errors.IssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 *
 * Removes direct left recursion from a single variable.
 *
 * The bodies of A are split into recursive ones, {@code A α}, and the rest, β. A fresh auxiliary
 * variable Z then takes over the recursion:
 *
 * <pre>
 *     A -> β | β Z
 *     Z -> α | α Z
 * </pre>
 *
 * A body consisting of A alone derives nothing new and is dropped.
 *
 */
public class LeftRecursionEliminationPass {
	private static final Logger logger = Logger.getLogger(LeftRecursionEliminationPass.class.getName());

	private LeftRecursionEliminationPass() {}

	/**
	 * @return the auxiliary variable introduced for head, or null if none was needed or an issue
	 * was reported
	 */
	public static Variable perform(IssueContext ctx, Grammar grammar, Variable head,
	                               AuxiliaryVariableGenerator generator) {
		List<Body> recursive = new ArrayList<>();
		List<Body> nonRecursive = new ArrayList<>();
		boolean droppedCycle = false;
		for (Body body : grammar.getBodies(head)) {
			if (body.startsWith(head)) {
				Body alpha = body.rest();
				if (alpha.isEmpty()) {
					logger.fine("dropping unit cycle " + head + " -> " + head);
					droppedCycle = true;
				} else {
					recursive.add(alpha);
				}
			} else {
				nonRecursive.add(body);
			}
		}

		if (recursive.isEmpty() && !droppedCycle) {
			return null;
		}
		if (nonRecursive.isEmpty()) {
			grammar.replaceBodies(head, nonRecursive);
			ctx.error(new UnreducibleVariableIssue(head));
			return null;
		}
		if (recursive.isEmpty()) {
			grammar.replaceBodies(head, nonRecursive);
			return null;
		}

		Variable z = generator.recursionVariable(ctx, head);
		if (z == null) {
			return null;
		}

		Set<Body> headBodies = new LinkedHashSet<>(nonRecursive);
		for (Body beta : nonRecursive) {
			headBodies.add(beta.append(z));
		}
		Set<Body> zBodies = new LinkedHashSet<>(recursive);
		for (Body alpha : recursive) {
			zBodies.add(alpha.append(z));
		}
		grammar.replaceBodies(head, headBodies);
		grammar.replaceBodies(z, zBodies);
		logger.fine("introduced " + z + " to remove left recursion from " + head);
		return z;
	}
}
