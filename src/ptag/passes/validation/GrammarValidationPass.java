package ptag.passes.validation;

import ptag.errors.IssueContext;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;
import ptag.model.tree.TerminalLeaf;
import ptag.model.tree.TreeNode;
import ptag.model.tree.TreeNodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a set of elementary trees before they are compiled into a grammar:
 *   * some initial tree is rooted in the start symbol
 *   * every auxiliary tree has exactly one foot, labelled like its root plus the foot marker
 *   * no foot markers appear anywhere else
 *   * no tree is a unit tree: one that has no terminal and no leaf besides a single
 *     substitution site or its foot
 */
public class GrammarValidationPass {
	private GrammarValidationPass() {}

	public static void perform(IssueContext ctx, String startSymbol, List<InternalNode> initialTrees,
	                           List<InternalNode> auxiliaryTrees) {
		boolean startDefined = false;
		for (int i = 0; i < initialTrees.size(); ++i) {
			InternalNode tree = initialTrees.get(i);
			if (tree.getLabel().equals(startSymbol)) {
				startDefined = true;
			}
			for (InternalNode marked : markedNodes(tree)) {
				ctx.error(new MisplacedFootIssue(TreeOrigin.INITIAL, i, tree, marked.getLabel()));
			}
			checkProductive(ctx, TreeOrigin.INITIAL, i, tree);
		}
		if (!startDefined) {
			ctx.error(new UndefinedStartSymbolIssue(startSymbol));
		}

		for (int i = 0; i < auxiliaryTrees.size(); ++i) {
			InternalNode tree = auxiliaryTrees.get(i);
			int feet = 0;
			if (tree.getLabel().endsWith(TreeNode.FOOT_MARKER)) {
				ctx.error(new MisplacedFootIssue(TreeOrigin.AUXILIARY, i, tree, tree.getLabel()));
			}
			for (InternalNode marked : markedNodes(tree)) {
				if (marked.isFootOf(tree.getLabel())) {
					++feet;
				} else {
					ctx.error(new MisplacedFootIssue(TreeOrigin.AUXILIARY, i, tree, marked.getLabel()));
				}
			}
			if (feet == 0) {
				ctx.error(new MissingFootIssue(i, tree));
			} else if (feet > 1) {
				ctx.error(new MultipleFootIssue(i, tree, feet));
			}
			checkProductive(ctx, TreeOrigin.AUXILIARY, i, tree);
		}
	}

	// using any other tree consumes input or adds to the unconsumed frontier count
	private static void checkProductive(IssueContext ctx, TreeOrigin origin, int index, InternalNode tree) {
		if (countTerminals(tree) == 0 && tree.countLeaves() <= 1) {
			ctx.error(new UnitTreeIssue(origin, index, tree));
		}
	}

	/**
	 * @return every node below the root whose label carries the foot marker, in depth-first order
	 */
	private static List<InternalNode> markedNodes(InternalNode root) {
		List<InternalNode> found = new ArrayList<>();
		for (TreeNode child : root.getChildren()) {
			child.accept(new TreeNodeVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(InternalNode internalNode) {
					if (internalNode.getLabel().endsWith(TreeNode.FOOT_MARKER)) {
						found.add(internalNode);
					}
					for (TreeNode grandChild : internalNode.getChildren()) {
						grandChild.accept(this);
					}
					return null;
				}

				@Override
				public Void visit(TerminalLeaf terminalLeaf) {
					return null;
				}
			});
		}
		return found;
	}

	private static int countTerminals(TreeNode node) {
		return node.accept(new TreeNodeVisitor<Integer, RuntimeException>() {
			@Override
			public Integer visit(InternalNode internalNode) {
				int sum = 0;
				for (TreeNode child : internalNode.getChildren()) {
					sum += child.accept(this);
				}
				return sum;
			}

			@Override
			public Integer visit(TerminalLeaf terminalLeaf) {
				return 1;
			}
		});
	}
}
