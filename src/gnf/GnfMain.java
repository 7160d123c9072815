package gnf;

import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.GrammarDefinition;
import gnf.trans.GnfConversionPipeline;
import gnf.trans.GnfConversionResult;
import gnf.trans.GnfTransException;
import gnf.trans.IOErrorIssue;
import gnf.trans.passes.parse.json.JsonGrammarParsingPass;
import gnf.trans.passes.parse.option.OptionParsingPass;
import gnf.trans.passes.validation.GnfValidationPass;
import gnf.util.LanguageSampler;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.logging.Logger;

public class GnfMain {
	private final String[] cmdArgs;
	private static Logger logger;

	public GnfMain(String[] args) {
		cmdArgs = args;
		// Get the top Logger instance
		logger = Logger.getLogger("gnf");
	}

	// Creates a GnfMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new GnfMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
	}

	private GrammarDefinition readGrammar(TopLevelIssueContext ctx, String path) throws GnfTransException {
		logger.info("Reading grammar from \"" + path + "\"");
		String source;
		try {
			source = FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			checkErrors(ctx);
			return null;
		}
		GrammarDefinition definition = JsonGrammarParsingPass.perform(ctx, source);
		checkErrors(ctx);
		return definition;
	}

	private void checkGnf(TopLevelIssueContext ctx, Grammar grammar) throws GnfTransException {
		logger.info("Checking for Greibach normal form");
		GnfValidationPass.perform(ctx, grammar);
		checkErrors(ctx);
		logger.info("Grammar is in Greibach normal form");
	}

	boolean compareLanguages(GrammarDefinition input, Grammar output, int length, long budget) {
		logger.info("Comparing languages up to length " + length);
		Set<String> expected;
		Set<String> actual;
		try {
			expected = new LanguageSampler(input.getGrammar(), length, budget).sample(input.getStart());
			actual = new LanguageSampler(output, length, budget).sample(input.getStart());
		} catch (IllegalStateException e) {
			logger.warning("could not compare languages up to length " + length + ": " + e.getMessage());
			return false;
		}
		if (!expected.equals(actual)) {
			logger.warning("Languages differ up to length " + length + ": expected " + expected + ", got " + actual);
			return false;
		}
		logger.info("Both grammars derive the same " + expected.size() + " string(s) up to length " + length);
		return true;
	}

	private void writeGrammar(GnfOptions opts, Grammar grammar) throws IOException {
		String rendered = grammar.toString();
		if (opts.output == null) {
			System.out.println(rendered);
		} else {
			logger.info("Writing grammar to \"" + opts.output + "\"");
			FileUtils.writeStringToFile(
					new File(opts.output), rendered + System.lineSeparator(), StandardCharsets.UTF_8);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			GnfOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}

			GrammarDefinition definition = readGrammar(ctx, opts.inputFilePath);

			if (opts.check) {
				checkGnf(ctx, definition.getGrammar());
				return true;
			}

			logger.info("Converting to Greibach normal form");
			GnfConversionResult result = GnfConversionPipeline.perform(ctx, definition.getGrammar());
			logger.info("Introduced " + result.getAuxiliaryVariables().size() + " auxiliary variable(s)");
			writeGrammar(opts, result.getGrammar());

			if (opts.sample > 0) {
				return compareLanguages(definition, result.getGrammar(), opts.sample, LanguageSampler.DEFAULT_BUDGET);
			}
		} catch (GnfTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMsg());
			return false;
		} catch (IOException e) {
			logger.severe("could not write output: " + e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws GnfTransException {
		if (ctx.hasErrors()) {
			throw new GnfTransException(ctx.format());
		}
	}
}
