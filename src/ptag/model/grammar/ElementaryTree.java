package ptag.model.grammar;

import ptag.compiler.CompiledTree;
import ptag.compiler.RuleCompiler;
import ptag.compiler.TreeRuleRef;
import ptag.model.tree.InternalNode;
import ptag.model.tree.TreePath;

/**
 * An initial or auxiliary tree of a grammar, together with its compiled rules.
 */
public final class ElementaryTree {

	private final TreeOrigin origin;
	private final int index;
	private final InternalNode tree;
	private final CompiledTree rules;
	private final int leafCount;

	public ElementaryTree(TreeOrigin origin, int index, InternalNode tree) {
		this.origin = origin;
		this.index = index;
		this.tree = tree;
		this.rules = RuleCompiler.treeToRules(tree);
		this.leafCount = tree.countLeaves();
	}

	public TreeOrigin getOrigin() {
		return origin;
	}

	public int getIndex() {
		return index;
	}

	public InternalNode getTree() {
		return tree;
	}

	public String getRootLabel() {
		return tree.getLabel();
	}

	public CompiledTree getRules() {
		return rules;
	}

	public int getLeafCount() {
		return leafCount;
	}

	/**
	 * @return a reference to the rule of the root node, dot at 0
	 */
	public TreeRuleRef rootRule() {
		return new TreeRuleRef(rules.getRootRule(), origin, index, TreePath.root());
	}

	@Override
	public String toString() {
		return (origin == TreeOrigin.INITIAL ? "initial" : "auxiliary") + " tree #" + index + " " + tree;
	}
}
