package gnf.trans.passes.substitution;

import gnf.InternalConverterError;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 *
 * Splices the alternatives of one variable into the bodies of another.
 *
 * Substituting source into target replaces every body {@code source γ} of target with
 * {@code β γ} for each body β of source. The replacement bodies take the position of the body
 * they came from, so enumeration order stays deterministic.
 *
 * One instance is shared by all passes of a conversion and counts the bodies it expanded.
 *
 */
public class Substitution {

	private long steps;

	public Substitution() {
		this.steps = 0;
	}

	/**
	 * @return true if some body of target started with source and was replaced
	 */
	public boolean substitute(Grammar grammar, Variable target, Variable source) {
		if (target.equals(source)) {
			throw new InternalConverterError("refusing to substitute " + target + " into itself");
		}
		if (grammar.bodiesStartingWith(target, source).isEmpty()) {
			return false;
		}
		List<Body> alternatives = new ArrayList<>(grammar.getBodies(source));
		Set<Body> rewritten = new LinkedHashSet<>();
		for (Body body : grammar.getBodies(target)) {
			if (body.startsWith(source)) {
				Body rest = body.rest();
				for (Body alternative : alternatives) {
					rewritten.add(alternative.concat(rest));
				}
				++steps;
			} else {
				rewritten.add(body);
			}
		}
		grammar.replaceBodies(target, rewritten);
		return true;
	}

	/**
	 * @return the number of bodies expanded so far
	 */
	public long getSteps() {
		return steps;
	}

}
