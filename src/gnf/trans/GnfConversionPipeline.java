package gnf.trans;

import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import gnf.trans.passes.lifting.TerminalLiftingPass;
import gnf.trans.passes.ordering.OrderingPass;
import gnf.trans.passes.recursion.AuxiliaryVariableGenerator;
import gnf.trans.passes.substitution.BackSubstitutionPass;
import gnf.trans.passes.substitution.ForwardSubstitutionPass;
import gnf.trans.passes.substitution.Substitution;
import gnf.trans.passes.validation.GnfValidationPass;
import gnf.trans.passes.validation.GrammarValidationPass;

import java.util.List;
import java.util.logging.Logger;

/**
 *
 * Converts an epsilon-free context-free grammar into Greibach normal form.
 *
 * The caller's grammar is copied once; the copy is threaded through every pass and handed back
 * frozen. Issues are collected in the given context and abort the conversion at the end of the
 * phase that raised them, so a partially rewritten grammar is never returned.
 *
 */
public class GnfConversionPipeline {
	private static final Logger logger = Logger.getLogger(GnfConversionPipeline.class.getName());

	private GnfConversionPipeline() {}

	public static GnfConversionResult perform(TopLevelIssueContext ctx, Grammar input) throws GnfTransException {
		return perform(ctx, input, null, new Substitution());
	}

	public static GnfConversionResult perform(TopLevelIssueContext ctx, Grammar input, List<Variable> order)
			throws GnfTransException {
		return perform(ctx, input, order, new Substitution());
	}

	/**
	 * @param order the total order over the variables of input, or null to order them by order key
	 */
	public static GnfConversionResult perform(TopLevelIssueContext ctx, Grammar input, List<Variable> order,
	                                          Substitution substitution) throws GnfTransException {
		Grammar grammar = input.copy();

		logger.fine("Validating input grammar");
		GrammarValidationPass.perform(ctx, grammar);
		checkErrors(ctx);

		logger.fine("Ordering variables");
		List<Variable> ordered = order == null
				? OrderingPass.perform(ctx, grammar)
				: OrderingPass.perform(ctx, grammar, order);
		checkErrors(ctx);

		AuxiliaryVariableGenerator generator = new AuxiliaryVariableGenerator(grammar);

		logger.fine("Forward substitution over " + ordered.size() + " variable(s)");
		grammar = ForwardSubstitutionPass.perform(ctx, grammar, ordered, generator, substitution);
		checkErrors(ctx);

		logger.fine("Back substitution");
		grammar = BackSubstitutionPass.perform(
				ctx, grammar, ordered, generator.getCreatedVariables(), substitution);
		checkErrors(ctx);

		logger.fine("Lifting non-leading terminals");
		grammar = TerminalLiftingPass.perform(ctx, grammar, generator);
		checkErrors(ctx);

		logger.fine("Validating result");
		GnfValidationPass.perform(ctx, grammar);
		checkErrors(ctx);

		grammar.freeze();
		logger.fine("Converted grammar has " + grammar.size() + " variable(s) and "
				+ grammar.getProductionCount() + " production(s)");
		return new GnfConversionResult(
				grammar, ordered, generator.getCreatedVariables(), substitution.getSteps());
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws GnfTransException {
		if (ctx.hasErrors()) {
			throw new GnfTransException(ctx.format());
		}
	}
}
