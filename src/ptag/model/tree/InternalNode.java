package ptag.model.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class InternalNode extends TreeNode {

	private final String label;
	private final List<TreeNode> children;

	public InternalNode(String label, List<TreeNode> children) {
		this.label = label;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	@Override
	public String getLabel() {
		return label;
	}

	public List<TreeNode> getChildren() {
		return children;
	}

	/**
	 * A childless internal node sits on the frontier, where it is either a substitution site or a foot.
	 */
	public boolean isFrontier() {
		return children.isEmpty();
	}

	public boolean isFoot() {
		return isFrontier() && label.endsWith(FOOT_MARKER);
	}

	/**
	 * @return true if this is the foot node of a tree rooted in rootLabel
	 */
	public boolean isFootOf(String rootLabel) {
		return isFoot() && label.equals(rootLabel + FOOT_MARKER);
	}

	public InternalNode withChild(int index, TreeNode child) {
		List<TreeNode> newChildren = new ArrayList<>(children);
		newChildren.set(index, child);
		return new InternalNode(label, newChildren);
	}

	@Override
	public int countLeaves() {
		if (children.isEmpty()) {
			return 1;
		}
		int sum = 0;
		for (TreeNode child : children) {
			sum += child.countLeaves();
		}
		return sum;
	}

	@Override
	public <T, E extends Throwable> T accept(TreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + label.hashCode();
		result = prime * result + children.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		InternalNode other = (InternalNode) obj;
		return label.equals(other.label) && children.equals(other.children);
	}

}
