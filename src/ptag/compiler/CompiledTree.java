package ptag.compiler;

import ptag.model.tree.TreePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The rules of one elementary tree, indexed by the same positions as the tree's nodes.
 */
public final class CompiledTree {

	private final CompiledNode root;
	private final List<DottedRule> rules;

	public CompiledTree(CompiledNode root) {
		this.root = root;
		List<DottedRule> flattened = new ArrayList<>();
		flatten(root, flattened);
		this.rules = Collections.unmodifiableList(flattened);
	}

	private static void flatten(CompiledNode node, List<DottedRule> into) {
		into.add(node.getRule());
		for (CompiledNode child : node.getChildren()) {
			flatten(child, into);
		}
	}

	public DottedRule getRootRule() {
		return root.getRule();
	}

	/**
	 * @return the rules in depth-first order, one per node
	 */
	public List<DottedRule> toList() {
		return rules;
	}

	public int size() {
		return rules.size();
	}

	public Optional<CompiledNode> nodeAt(TreePath path) {
		if (!path.isWellFormed()) {
			return Optional.empty();
		}
		CompiledNode current = root;
		for (int depth = 1; depth < path.size(); ++depth) {
			int childIndex = path.get(depth);
			if (childIndex > current.getChildren().size()) {
				return Optional.empty();
			}
			current = current.getChildren().get(childIndex - 1);
		}
		return Optional.of(current);
	}
}
