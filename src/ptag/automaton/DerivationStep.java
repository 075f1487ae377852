package ptag.automaton;

import ptag.model.tree.InternalNode;
import ptag.model.tree.TreePath;

import java.util.Objects;

/**
 * One substitution or adjunction performed while a parse was built: inserted was placed into
 * target at position, giving result.
 */
public final class DerivationStep {

	private final InternalNode target;
	private final InternalNode inserted;
	private final OperationKind kind;
	private final TreePath position;
	private final InternalNode result;

	public DerivationStep(InternalNode target, InternalNode inserted, OperationKind kind, TreePath position,
	                      InternalNode result) {
		this.target = target;
		this.inserted = inserted;
		this.kind = kind;
		this.position = position;
		this.result = result;
	}

	public InternalNode getTarget() {
		return target;
	}

	public InternalNode getInserted() {
		return inserted;
	}

	public OperationKind getKind() {
		return kind;
	}

	public TreePath getPosition() {
		return position;
	}

	public InternalNode getResult() {
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DerivationStep that = (DerivationStep) o;
		return kind == that.kind &&
				target.equals(that.target) &&
				inserted.equals(that.inserted) &&
				position.equals(that.position) &&
				result.equals(that.result);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, inserted, kind, position, result);
	}

	@Override
	public String toString() {
		return kind.getCode() + " " + inserted + " into " + target + " at " + position;
	}
}
