package gnf;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

public class GnfOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean quiet = false;

	/**
	 * Be verbose, print the progress of every pass. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean verbose = false;

	@Option("-o File to write the converted grammar to instead of standard output")
	public String output;

	@Option("Only check whether the grammar already is in Greibach normal form")
	public boolean check = false;

	@Option("Compare input and output languages on all strings up to this length")
	public int sample = 0;

	public String inputFilePath;

	private final Options plumeOptions;
	private final String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public GnfOptions(String[] args) {
		plumeOptions = new Options("gnf [options] grammar.json", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	public void parse() throws GnfOptionException {
		if (version) {
			System.out.println("gnf version " + VERSION);
			System.exit(0);
		}

		if (help) {
			printHelp();
			System.exit(0);
		}

		if (remainingArgs.length != 1) {
			throw new GnfOptionException("expected exactly one grammar file, got " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (sample < 0) {
			throw new GnfOptionException("sample length must not be negative");
		}
		if (check && output != null) {
			throw new GnfOptionException("--check does not produce a grammar to write");
		}
	}
}
