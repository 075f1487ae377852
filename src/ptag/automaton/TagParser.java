package ptag.automaton;

import ptag.model.grammar.TreeAdjoiningGrammar;
import ptag.model.tree.InternalNode;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Explores every configuration reachable from the initial ones, depth first, and collects the
 * accepting ones. Accepted configurations are not expanded any further.
 */
public class TagParser {

	private static final Logger logger = Logger.getLogger("TagParser");

	private final Bepda automaton;

	public TagParser(TreeAdjoiningGrammar grammar) {
		this.automaton = new Bepda(grammar);
	}

	public ParseReport run(List<String> tokens) {
		Deque<ParserConfiguration> agenda = new ArrayDeque<>();
		List<ParserConfiguration> seeds = automaton.initialise(tokens);
		logger.fine("starting search of " + tokens + " from " + seeds.size() + " initial configuration(s)");
		for (ParserConfiguration seed : seeds) {
			agenda.push(seed);
		}

		List<ParserConfiguration> accepted = new ArrayList<>();
		int explored = 0;
		while (!agenda.isEmpty()) {
			ParserConfiguration current = agenda.pop();
			++explored;
			List<ParserConfiguration> finished = automaton.finish(current);
			if (!finished.isEmpty()) {
				accepted.addAll(finished);
				continue;
			}
			for (Transition transition : automaton.transitions()) {
				for (ParserConfiguration next : transition.apply(current)) {
					agenda.push(next);
				}
			}
		}

		logger.fine("explored " + explored + " configuration(s), accepted " + accepted.size());
		return new ParseReport(accepted, explored);
	}

	/**
	 * @return the derived tree of every parse of tokens; empty if tokens are not in the language
	 */
	public List<InternalNode> parse(List<String> tokens) {
		return run(tokens).getTrees();
	}

	public List<Derivation> derive(List<String> tokens) {
		return run(tokens).getDerivations();
	}
}
