package ptag;

import ptag.automaton.ParseReport;
import ptag.automaton.TagParser;
import ptag.errors.TopLevelIssueContext;
import ptag.formatters.DerivationFormatter;
import ptag.formatters.IndentingWriter;
import ptag.model.grammar.TreeAdjoiningGrammar;
import ptag.model.tree.InternalNode;
import ptag.passes.option.OptionParsingPass;
import ptag.passes.parse.GrammarParsingPass;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class PTagMain {
	private final String[] cmdArgs;
	private final PrintStream stdout;
	private static Logger logger;

	public PTagMain(String[] args) {
		this(args, System.out);
	}

	public PTagMain(String[] args, PrintStream stdout) {
		cmdArgs = args;
		this.stdout = stdout;
		logger = Logger.getLogger("PTagMain");
	}

	public static void main(String[] args) {
		if (new PTagMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			PTagOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}
			if (opts.version) {
				stdout.println("PTag version " + PTagOptions.VERSION);
				return true;
			}
			if (opts.help) {
				opts.printHelp();
				return true;
			}

			TreeAdjoiningGrammar grammar;
			if (opts.demo) {
				logger.info("Using the sample grammar");
				grammar = DemoGrammar.grammar();
			} else {
				logger.info("Loading grammar from \"" + opts.grammarFilePath + "\"");
				grammar = GrammarParsingPass.perform(ctx, Paths.get(opts.grammarFilePath));
				checkErrors(ctx);
			}
			logger.info("Grammar has " + grammar.getInitialTrees().size() + " initial and "
					+ grammar.getAuxiliaryTrees().size() + " auxiliary tree(s)");

			logger.info("Parsing " + opts.tokens);
			ParseReport report = new TagParser(grammar).run(opts.tokens);
			logger.info("Found " + report.getAccepted().size() + " parse(s) after exploring "
					+ report.getExplored() + " configuration(s)");

			Writer writer = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
			IndentingWriter out = new IndentingWriter(writer);
			if (opts.derivations) {
				new DerivationFormatter(out).format(report.getDerivations());
			} else {
				for (InternalNode tree : report.getTrees()) {
					out.write(tree.toString());
					out.newLine();
				}
			}
			out.flush();
		} catch (PTagException | IOException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws PTagLoadException {
		if (ctx.hasErrors()) {
			throw new PTagLoadException(ctx.format());
		}
	}
}
