package ptag.rewrite;

import ptag.model.tree.InternalNode;
import ptag.model.tree.TerminalLeaf;
import ptag.model.tree.TreeNode;
import ptag.model.tree.TreeNodeVisitor;
import ptag.model.tree.TreePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The two TAG rewrite operations. Trees are never modified; every successful rewrite
 * returns a new tree that shares the untouched subtrees with its inputs.
 */
public class TreeRewriter {
	private TreeRewriter() {}

	/**
	 * Replaces the frontier node at position in tree with fragment. The frontier node's label,
	 * ignoring a trailing foot marker, must equal the label of fragment's root.
	 */
	public static RewriteResult substitute(InternalNode tree, InternalNode fragment, TreePath position) {
		if (!position.isWellFormed()) {
			return RewriteResult.failure(RewriteFailure.Kind.MALFORMED_POSITION, position,
					"positions start at the root marker 0");
		}
		if (position.size() == 1) {
			return replaceFrontier(tree, fragment, position);
		}
		return rewriteBelow(tree, position, 1, target -> replaceFrontier(target, fragment, position));
	}

	/**
	 * Splices auxTree in at position: the subtree at position is excised, auxTree takes its
	 * place and the excised subtree is re-attached at auxTree's foot.
	 */
	public static RewriteResult adjoin(InternalNode tree, InternalNode auxTree, TreePath position) {
		if (!position.isWellFormed()) {
			return RewriteResult.failure(RewriteFailure.Kind.MALFORMED_POSITION, position,
					"positions start at the root marker 0");
		}
		Optional<TreePath> foot = footPosition(auxTree);
		if (!foot.isPresent()) {
			return RewriteResult.failure(RewriteFailure.Kind.MISSING_FOOT, position,
					"no foot node labelled " + auxTree.getLabel() + TreeNode.FOOT_MARKER);
		}
		if (position.isRoot()) {
			return substitute(auxTree, tree, foot.get());
		}
		return rewriteBelow(tree, position, 1, target -> {
			if (!labelsMatch(target.getLabel(), auxTree.getLabel())) {
				return RewriteResult.failure(RewriteFailure.Kind.LABEL_MISMATCH, position,
						"cannot adjoin " + auxTree.getLabel() + " at " + target.getLabel());
			}
			return substitute(auxTree, target, foot.get());
		});
	}

	/**
	 * Finds the foot of auxTree, the frontier node labelled with auxTree's root label plus the foot marker.
	 *
	 * @return the root-relative position of the foot, or empty if auxTree has none
	 */
	public static Optional<TreePath> footPosition(InternalNode auxTree) {
		return footBelow(auxTree, auxTree.getLabel(), TreePath.root());
	}

	private static Optional<TreePath> footBelow(InternalNode node, String rootLabel, TreePath path) {
		List<TreeNode> children = node.getChildren();
		for (int i = 0; i < children.size(); ++i) {
			TreePath childPath = path.append(i + 1);
			Optional<TreePath> found = children.get(i).accept(new TreeNodeVisitor<Optional<TreePath>, RuntimeException>() {
				@Override
				public Optional<TreePath> visit(InternalNode internalNode) {
					if (internalNode.isFootOf(rootLabel)) {
						return Optional.of(childPath);
					}
					return footBelow(internalNode, rootLabel, childPath);
				}

				@Override
				public Optional<TreePath> visit(TerminalLeaf terminalLeaf) {
					return Optional.empty();
				}
			});
			if (found.isPresent()) {
				return found;
			}
		}
		return Optional.empty();
	}

	private interface TargetRewrite {
		RewriteResult apply(InternalNode target);
	}

	private static RewriteResult rewriteBelow(InternalNode node, TreePath position, int depth, TargetRewrite rewrite) {
		int childIndex = position.get(depth);
		if (childIndex > node.getChildren().size()) {
			return RewriteResult.failure(RewriteFailure.Kind.BAD_POSITION, position,
					node.getLabel() + " has no child " + childIndex);
		}
		boolean isTarget = depth == position.size() - 1;
		RewriteResult rewritten = node.getChildren().get(childIndex - 1).accept(
				new TreeNodeVisitor<RewriteResult, RuntimeException>() {
					@Override
					public RewriteResult visit(InternalNode internalNode) {
						if (isTarget) {
							return rewrite.apply(internalNode);
						}
						return rewriteBelow(internalNode, position, depth + 1, rewrite);
					}

					@Override
					public RewriteResult visit(TerminalLeaf terminalLeaf) {
						return RewriteResult.failure(RewriteFailure.Kind.BAD_TREE, position,
								"terminal " + terminalLeaf.getLabel() + " cannot be rewritten");
					}
				});
		if (!rewritten.isSuccess()) {
			return rewritten;
		}
		return RewriteResult.success(node.withChild(childIndex - 1, rewritten.getSuccess()));
	}

	private static RewriteResult replaceFrontier(InternalNode target, InternalNode fragment, TreePath position) {
		if (!target.isFrontier()) {
			return RewriteResult.failure(RewriteFailure.Kind.BAD_POSITION, position,
					target.getLabel() + " is not a frontier node");
		}
		if (!labelsMatch(target.getLabel(), fragment.getLabel())) {
			return RewriteResult.failure(RewriteFailure.Kind.LABEL_MISMATCH, position,
					"cannot substitute " + fragment.getLabel() + " for " + target.getLabel());
		}
		return RewriteResult.success(fragment);
	}

	private static boolean labelsMatch(String siteLabel, String rootLabel) {
		return siteLabel.equals(rootLabel) || TreeNode.unmarked(siteLabel).equals(rootLabel);
	}

	/**
	 * @return the subtree at position, if the position resolves
	 */
	public static Optional<TreeNode> subtreeAt(InternalNode tree, TreePath position) {
		if (!position.isWellFormed()) {
			return Optional.empty();
		}
		TreeNode current = tree;
		for (int depth = 1; depth < position.size(); ++depth) {
			int childIndex = position.get(depth);
			List<TreeNode> children = current.accept(new TreeNodeVisitor<List<TreeNode>, RuntimeException>() {
				@Override
				public List<TreeNode> visit(InternalNode internalNode) {
					return internalNode.getChildren();
				}

				@Override
				public List<TreeNode> visit(TerminalLeaf terminalLeaf) {
					return new ArrayList<>();
				}
			});
			if (childIndex > children.size()) {
				return Optional.empty();
			}
			current = children.get(childIndex - 1);
		}
		return Optional.of(current);
	}
}
