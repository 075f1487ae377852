package ptag.passes.validation;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;
import ptag.model.tree.InternalNode;

public class MultipleFootIssue extends Issue {

	private final int index;
	private final InternalNode tree;
	private final int footCount;

	public MultipleFootIssue(int index, InternalNode tree, int footCount) {
		this.index = index;
		this.tree = tree;
		this.footCount = footCount;
	}

	public int getIndex() {
		return index;
	}

	public InternalNode getTree() {
		return tree;
	}

	public int getFootCount() {
		return footCount;
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
		MultipleFootIssue other = (MultipleFootIssue) obj;
		return index == other.index && footCount == other.footCount && tree.equals(other.tree);
	}

	@Override
	public int hashCode() {
		return (31 * index + footCount) * 31 + tree.hashCode();
	}
}
