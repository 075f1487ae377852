package ptag;

import ptag.model.grammar.TreeAdjoiningGrammar;
import ptag.model.tree.InternalNode;

import java.util.Arrays;
import java.util.List;

import static ptag.model.tree.TreeBuilder.*;

/**
 * A small English grammar with prepositional phrase attachment and determiners as adjuncts.
 */
public class DemoGrammar {
	private DemoGrammar() {}

	public static final String SENTENCE = "I had a map on my desk";

	public static List<InternalNode> initialTrees() {
		return Arrays.asList(
				tree("S",
						frontier("NP"),
						tree("VP",
								tree("VP", tree("V", "had"), frontier("NP")),
								frontier("PP"))),
				tree("NP", tree("N", "I")),
				tree("NP", tree("N", "map")),
				tree("NP", tree("N", "desk")),
				tree("PP", tree("P", "on"), frontier("NP")));
	}

	public static List<InternalNode> auxiliaryTrees() {
		return Arrays.asList(
				tree("NP", tree("D", "my"), foot("NP")),
				tree("NP", tree("D", "a"), foot("NP")));
	}

	public static TreeAdjoiningGrammar grammar() {
		return new TreeAdjoiningGrammar("S", initialTrees(), auxiliaryTrees());
	}

	public static List<String> sentence() {
		return tokens(SENTENCE);
	}
}
