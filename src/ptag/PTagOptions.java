package ptag;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

public class PTagOptions {
	public static final String VERSION = "0.1.0";

	public boolean version = false;
	public boolean help = false;
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	public boolean logLvlVerbose = false;

	/**
	 * Print the substitutions and adjunctions of every parse instead of the derived trees.
	 */
	public boolean derivations = false;

	public boolean demo = false;
	public String grammarFilePath;
	public List<String> tokens = new ArrayList<>();

	private final JSAP jsap;
	private final String[] args;

	public PTagOptions(String[] args) {
		this.args = args;
		this.jsap = new JSAP();
		try {
			jsap.registerParameter(new Switch("version", JSAP.NO_SHORTFLAG, "version",
					"print the version and exit"));
			jsap.registerParameter(new Switch("help", 'h', "help",
					"print this help message"));
			jsap.registerParameter(new Switch("quiet", 'q', "quiet",
					"reduce printing during execution"));
			jsap.registerParameter(new Switch("verbose", 'v', "verbose",
					"print detailed information during execution"));
			jsap.registerParameter(new Switch("derivations", 'd', "derivations",
					"print the operations that built each parse instead of the parse trees"));
			jsap.registerParameter(new Switch("demo", JSAP.NO_SHORTFLAG, "demo",
					"use the built-in sample grammar; without tokens, parse \"" + DemoGrammar.SENTENCE + "\""));
			jsap.registerParameter(new FlaggedOption("grammar",
					StringStringParser.getParser(),
					JSAP.NO_DEFAULT,
					false,
					'g',
					"grammar",
					"path to a JSON grammar file"));
			jsap.registerParameter(new UnflaggedOption("tokens",
					StringStringParser.getParser(),
					JSAP.NO_DEFAULT,
					false,
					true,
					"the sentence to parse, one token per argument"));
		} catch (JSAPException e) {
			throw new Unreachable(e);
		}
	}

	public void printHelp() {
		System.err.println("Usage: ptag " + jsap.getUsage());
		System.err.println();
		System.err.println(jsap.getHelp());
	}

	public void parse() throws PTagOptionException {
		JSAPResult config = jsap.parse(args);
		if (!config.success()) {
			StringBuilder message = new StringBuilder();
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext(); ) {
				if (message.length() > 0) {
					message.append("; ");
				}
				message.append(errs.next());
			}
			throw new PTagOptionException(message.toString());
		}

		version = config.getBoolean("version");
		help = config.getBoolean("help");
		logLvlQuiet = config.getBoolean("quiet");
		logLvlVerbose = config.getBoolean("verbose");
		derivations = config.getBoolean("derivations");
		demo = config.getBoolean("demo");
		grammarFilePath = config.getString("grammar");
		tokens = new ArrayList<>(Arrays.asList(config.getStringArray("tokens")));

		if (version || help) {
			return;
		}
		if (logLvlQuiet && logLvlVerbose) {
			throw new PTagOptionException("-q and -v cannot be used together");
		}
		if (demo == (grammarFilePath != null)) {
			throw new PTagOptionException("exactly one of -g and --demo is required");
		}
		if (demo && tokens.isEmpty()) {
			tokens = new ArrayList<>(DemoGrammar.sentence());
		}
		if (tokens.isEmpty()) {
			throw new PTagOptionException("no tokens to parse");
		}
	}
}
