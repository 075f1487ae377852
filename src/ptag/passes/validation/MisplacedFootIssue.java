package ptag.passes.validation;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;

import java.util.Objects;

/**
 * A foot marker where no foot may be: in an initial tree, on a node with children, or on a
 * frontier node whose label differs from its auxiliary tree's root.
 */
public class MisplacedFootIssue extends Issue {

	private final TreeOrigin origin;
	private final int index;
	private final InternalNode tree;
	private final String label;

	public MisplacedFootIssue(TreeOrigin origin, int index, InternalNode tree, String label) {
		this.origin = origin;
		this.index = index;
		this.tree = tree;
		this.label = label;
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

	public String getLabel() {
		return label;
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
		MisplacedFootIssue other = (MisplacedFootIssue) obj;
		return origin == other.origin && index == other.index && tree.equals(other.tree)
				&& label.equals(other.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(origin, index, tree, label);
	}
}
