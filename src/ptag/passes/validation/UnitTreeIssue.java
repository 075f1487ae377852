package ptag.passes.validation;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;

import java.util.Objects;

/**
 * A tree without a terminal whose only leaf is a substitution site or the foot. Using it neither
 * consumes input nor opens a new frontier node, so it could be chained without bound.
 */
public class UnitTreeIssue extends Issue {

	private final TreeOrigin origin;
	private final int index;
	private final InternalNode tree;

	public UnitTreeIssue(TreeOrigin origin, int index, InternalNode tree) {
		this.origin = origin;
		this.index = index;
		this.tree = tree;
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

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		UnitTreeIssue other = (UnitTreeIssue) obj;
		return origin == other.origin && index == other.index && tree.equals(other.tree);
	}

	@Override
	public int hashCode() {
		return Objects.hash(origin, index, tree);
	}
}
