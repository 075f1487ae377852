package ptag.model.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static helpers for writing trees in code, meant to be imported with {@code import static}.
 */
public class TreeBuilder {
	private TreeBuilder() {}

	public static InternalNode tree(String label, TreeNode... children) {
		return new InternalNode(label, Arrays.asList(children));
	}

	/**
	 * A preterminal: a node with a single terminal child, e.g. {@code (N map)}.
	 */
	public static InternalNode tree(String label, String terminal) {
		return tree(label, word(terminal));
	}

	public static InternalNode frontier(String label) {
		return new InternalNode(label, new ArrayList<>());
	}

	public static InternalNode foot(String label) {
		return frontier(label + TreeNode.FOOT_MARKER);
	}

	public static TerminalLeaf word(String terminal) {
		return new TerminalLeaf(terminal);
	}

	public static List<String> tokens(String sentence) {
		return Arrays.asList(sentence.trim().split("\\s+"));
	}
}
