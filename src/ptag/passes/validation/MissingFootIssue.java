package ptag.passes.validation;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;
import ptag.model.tree.InternalNode;

public class MissingFootIssue extends Issue {

	private final int index;
	private final InternalNode tree;

	public MissingFootIssue(int index, InternalNode tree) {
		this.index = index;
		this.tree = tree;
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
		MissingFootIssue other = (MissingFootIssue) obj;
		return index == other.index && tree.equals(other.tree);
	}

	@Override
	public int hashCode() {
		return 31 * index + tree.hashCode();
	}
}
