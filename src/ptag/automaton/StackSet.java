package ptag.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The embedded pushdown store: a list of inner stacks. The outermost (last) inner stack is the
 * active one, and the symbol at its head is the top of the store.
 *
 * Instances are immutable; every operation returns a copy.
 */
public final class StackSet {

	private final List<List<StackSymbol>> stacks;

	private StackSet(List<List<StackSymbol>> stacks) {
		this.stacks = stacks;
	}

	public static StackSet of(List<List<StackSymbol>> stacks) {
		List<List<StackSymbol>> frozen = new ArrayList<>();
		for (List<StackSymbol> inner : stacks) {
			frozen.add(Collections.unmodifiableList(new ArrayList<>(inner)));
		}
		return new StackSet(Collections.unmodifiableList(frozen));
	}

	/**
	 * @return the store of a parse that has not started: a single inner stack holding the start sentinel
	 */
	public static StackSet initial() {
		return of(Collections.singletonList(Collections.singletonList(Sentinel.START)));
	}

	/**
	 * @return a deep mutable copy of the inner stacks
	 */
	public List<List<StackSymbol>> copy() {
		List<List<StackSymbol>> copied = new ArrayList<>();
		for (List<StackSymbol> inner : stacks) {
			copied.add(new ArrayList<>(inner));
		}
		return copied;
	}

	/**
	 * Appends symbols to the outermost inner stack.
	 */
	public StackSet push(List<StackSymbol> symbols) {
		List<List<StackSymbol>> copied = copy();
		copied.get(copied.size() - 1).addAll(symbols);
		return of(copied);
	}

	/**
	 * Opens a new outermost inner stack holding only symbol.
	 */
	public StackSet wrap(StackSymbol symbol) {
		List<List<StackSymbol>> copied = copy();
		copied.add(new ArrayList<>(Collections.singletonList(symbol)));
		return of(copied);
	}

	/**
	 * Drops the outermost inner stack.
	 */
	public StackSet popOuter() {
		List<List<StackSymbol>> copied = copy();
		copied.remove(copied.size() - 1);
		return of(copied);
	}

	/**
	 * Drops the outermost inner stack, then swaps find for replacement in the one that is left outermost.
	 */
	public StackSet unwrapOuter(List<StackSymbol> find, List<StackSymbol> replacement) {
		return popOuter().swap(find, replacement);
	}

	/**
	 * Replaces the first occurrence of the sequence find in the outermost inner stack with
	 * replacement. Returns an equal copy if find does not occur.
	 */
	public StackSet swap(List<StackSymbol> find, List<StackSymbol> replacement) {
		List<List<StackSymbol>> copied = copy();
		List<StackSymbol> outer = copied.get(copied.size() - 1);
		for (int i = 0; i + find.size() <= outer.size(); ++i) {
			if (outer.subList(i, i + find.size()).equals(find)) {
				List<StackSymbol> window = outer.subList(i, i + find.size());
				window.clear();
				window.addAll(replacement);
				break;
			}
		}
		return of(copied);
	}

	public int depth() {
		return stacks.size();
	}

	public List<StackSymbol> get(int index) {
		return stacks.get(index);
	}

	/**
	 * @return the head of the outermost inner stack
	 */
	public Optional<StackSymbol> top() {
		return headOf(stacks.size() - 1);
	}

	/**
	 * @return the head of the inner stack just below the outermost one
	 */
	public Optional<StackSymbol> belowTop() {
		return headOf(stacks.size() - 2);
	}

	private Optional<StackSymbol> headOf(int index) {
		if (index < 0 || index >= stacks.size() || stacks.get(index).isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(stacks.get(index).get(0));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return stacks.equals(((StackSet) o).stacks);
	}

	@Override
	public int hashCode() {
		return stacks.hashCode();
	}

	@Override
	public String toString() {
		return stacks.toString();
	}
}
