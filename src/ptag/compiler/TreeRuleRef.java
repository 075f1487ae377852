package ptag.compiler;

import ptag.automaton.StackSymbol;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.TreePath;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;

/**
 * A dotted rule together with the elementary tree it was compiled from and the position of
 * its left-hand side in that tree.
 */
public final class TreeRuleRef implements StackSymbol {

	public static final TreeRuleRef NO_RULE = new TreeRuleRef(DottedRule.noRule(), TreeOrigin.NONE, 0,
			TreePath.of(Collections.emptyList()));

	private final DottedRule rule;
	private final TreeOrigin origin;
	private final int treeIndex;
	private final TreePath path;

	public TreeRuleRef(DottedRule rule, TreeOrigin origin, int treeIndex, TreePath path) {
		this.rule = rule;
		this.origin = origin;
		this.treeIndex = treeIndex;
		this.path = path;
	}

	public DottedRule getRule() {
		return rule;
	}

	public TreeOrigin getOrigin() {
		return origin;
	}

	public int getTreeIndex() {
		return treeIndex;
	}

	public TreePath getPath() {
		return path;
	}

	public boolean isNoRule() {
		return origin == TreeOrigin.NONE || rule.isNoRule();
	}

	public TreeRuleRef withRule(DottedRule newRule) {
		return new TreeRuleRef(newRule, origin, treeIndex, path);
	}

	/**
	 * @return true if both refer to the same node of the same elementary tree, whatever their dots
	 */
	public boolean sameNode(TreeRuleRef other) {
		return origin == other.origin && treeIndex == other.treeIndex && path.equals(other.path);
	}

	@Override
	public Optional<TreeRuleRef> asTreeRule() {
		return Optional.of(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TreeRuleRef that = (TreeRuleRef) o;
		return treeIndex == that.treeIndex &&
				origin == that.origin &&
				rule.equals(that.rule) &&
				path.equals(that.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rule, origin, treeIndex, path);
	}

	@Override
	public String toString() {
		return "[" + rule + "] " + origin + "#" + treeIndex + "@" + path;
	}
}
