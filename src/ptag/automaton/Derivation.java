package ptag.automaton;

import ptag.model.tree.InternalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * How one parse was built: the substitutions and adjunctions in the order they were performed,
 * and the derived tree they produce.
 */
public final class Derivation {

	private final List<DerivationStep> steps;
	private final InternalNode result;

	public Derivation(List<DerivationStep> steps, InternalNode result) {
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
		this.result = result;
	}

	public List<DerivationStep> getSteps() {
		return steps;
	}

	public InternalNode getResult() {
		return result;
	}

	public long count(OperationKind kind) {
		return steps.stream().filter(step -> step.getKind() == kind).count();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Derivation that = (Derivation) o;
		return steps.equals(that.steps) && result.equals(that.result);
	}

	@Override
	public int hashCode() {
		return Objects.hash(steps, result);
	}

	@Override
	public String toString() {
		return "Derivation{steps=" + steps + ", result=" + result + "}";
	}
}
