package ptag.passes.option;

import ptag.PTagOptionException;
import ptag.PTagOptions;
import ptag.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static PTagOptions perform(IssueContext ctx, Logger logger, String[] args) {
		PTagOptions opts = new PTagOptions(args);
		try {
			opts.parse();
		} catch (PTagOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		// the automaton logs under its own names, so the shared root handlers must pass FINE records too
		Logger root = Logger.getLogger("");
		root.setLevel(level);
		for (Handler handler : root.getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
