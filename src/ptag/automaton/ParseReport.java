package ptag.automaton;

import ptag.model.tree.InternalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of one search: every accepted configuration, in the order it was found, and how
 * many configurations were expanded to find them.
 */
public final class ParseReport {

	private final List<ParserConfiguration> accepted;
	private final int explored;

	public ParseReport(List<ParserConfiguration> accepted, int explored) {
		this.accepted = Collections.unmodifiableList(new ArrayList<>(accepted));
		this.explored = explored;
	}

	public List<ParserConfiguration> getAccepted() {
		return accepted;
	}

	public int getExplored() {
		return explored;
	}

	public boolean isEmpty() {
		return accepted.isEmpty();
	}

	public List<InternalNode> getTrees() {
		List<InternalNode> trees = new ArrayList<>();
		for (ParserConfiguration configuration : accepted) {
			trees.add(configuration.getTreeStack().get(0));
		}
		return trees;
	}

	public List<Derivation> getDerivations() {
		List<Derivation> derivations = new ArrayList<>();
		for (ParserConfiguration configuration : accepted) {
			derivations.add(new Derivation(configuration.getOperationLog(), configuration.getTreeStack().get(0)));
		}
		return derivations;
	}
}
