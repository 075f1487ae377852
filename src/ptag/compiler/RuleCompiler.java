package ptag.compiler;

import ptag.model.tree.InternalNode;
import ptag.model.tree.TerminalLeaf;
import ptag.model.tree.TreeNode;
import ptag.model.tree.TreeNodeVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Compiles elementary trees into dotted rules, one per node, so that the automaton can track
 * progress through a tree with a rule, a dot and a node position.
 */
public class RuleCompiler {
	private RuleCompiler() {}

	public static CompiledTree treeToRules(InternalNode root) {
		return new CompiledTree(compile(root));
	}

	private static CompiledNode compile(TreeNode node) {
		return node.accept(new TreeNodeVisitor<CompiledNode, RuntimeException>() {
			@Override
			public CompiledNode visit(InternalNode internalNode) {
				if (internalNode.isFrontier()) {
					return new CompiledNode(
							new DottedRule(RuleKind.FRONTIER, internalNode.getLabel(),
									Collections.singletonList(internalNode.getLabel())),
							Collections.emptyList());
				}
				List<String> rhs = new ArrayList<>();
				List<CompiledNode> children = new ArrayList<>();
				for (TreeNode child : internalNode.getChildren()) {
					rhs.add(child.getLabel());
					children.add(compile(child));
				}
				return new CompiledNode(new DottedRule(RuleKind.INTERNAL, internalNode.getLabel(), rhs), children);
			}

			@Override
			public CompiledNode visit(TerminalLeaf terminalLeaf) {
				return new CompiledNode(
						new DottedRule(RuleKind.TERMINAL, terminalLeaf.getLabel(),
								Collections.singletonList(terminalLeaf.getLabel())),
						Collections.emptyList());
			}
		});
	}

	/**
	 * Looks up the rule for the symbol after ref's dot.
	 *
	 * @return the child's rule with the dot at 0 and the child's position, or
	 * {@link TreeRuleRef#NO_RULE} if ref's node has nothing after the dot
	 */
	public static TreeRuleRef getRuleAtPath(TreeRuleRef ref, CompiledTree rules) {
		if (ref.isNoRule()) {
			return TreeRuleRef.NO_RULE;
		}
		Optional<CompiledNode> node = rules.nodeAt(ref.getPath());
		if (!node.isPresent()) {
			return TreeRuleRef.NO_RULE;
		}
		List<CompiledNode> children = node.get().getChildren();
		int dot = ref.getRule().getDotPosition();
		if (dot >= children.size()) {
			return TreeRuleRef.NO_RULE;
		}
		return new TreeRuleRef(children.get(dot).getRule(), ref.getOrigin(), ref.getTreeIndex(),
				ref.getPath().append(dot + 1));
	}
}
