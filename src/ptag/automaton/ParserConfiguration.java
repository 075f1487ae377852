package ptag.automaton;

import ptag.compiler.TreeRuleRef;
import ptag.model.tree.InternalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The complete state of one branch of the search. Configurations are never modified: the
 * {@code with*} methods return copies that differ in one component.
 */
public final class ParserConfiguration {

	private final StackSet stacks;
	private final List<InternalNode> treeStack;
	private final List<InternalNode> treeQueue;
	private final List<TreeRuleRef> pendingAdjunctions;
	private final List<String> remainingInput;
	private final int unconsumedFrontierCount;
	private final List<DerivationStep> operationLog;

	public ParserConfiguration(StackSet stacks, List<InternalNode> treeStack, List<InternalNode> treeQueue,
	                           List<TreeRuleRef> pendingAdjunctions, List<String> remainingInput,
	                           int unconsumedFrontierCount, List<DerivationStep> operationLog) {
		this.stacks = stacks;
		this.treeStack = freeze(treeStack);
		this.treeQueue = freeze(treeQueue);
		this.pendingAdjunctions = freeze(pendingAdjunctions);
		this.remainingInput = freeze(remainingInput);
		this.unconsumedFrontierCount = unconsumedFrontierCount;
		this.operationLog = freeze(operationLog);
	}

	private static <T> List<T> freeze(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<>(list));
	}

	/**
	 * @return the configuration before any elementary tree has been chosen
	 */
	public static ParserConfiguration start(List<String> input) {
		return new ParserConfiguration(StackSet.initial(), Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), input, 0, Collections.emptyList());
	}

	public StackSet getStacks() {
		return stacks;
	}

	/**
	 * @return the trees being traversed, the one entered most recently first
	 */
	public List<InternalNode> getTreeStack() {
		return treeStack;
	}

	/**
	 * @return trees interrupted by an adjunction, waiting for the auxiliary tree to be finished
	 */
	public List<InternalNode> getTreeQueue() {
		return treeQueue;
	}

	public List<TreeRuleRef> getPendingAdjunctions() {
		return pendingAdjunctions;
	}

	public List<String> getRemainingInput() {
		return remainingInput;
	}

	/**
	 * @return a lower bound on the number of terminals still to be consumed
	 */
	public int getUnconsumedFrontierCount() {
		return unconsumedFrontierCount;
	}

	public List<DerivationStep> getOperationLog() {
		return operationLog;
	}

	public ParserConfiguration withStacks(StackSet newStacks) {
		return new ParserConfiguration(newStacks, treeStack, treeQueue, pendingAdjunctions, remainingInput,
				unconsumedFrontierCount, operationLog);
	}

	public ParserConfiguration withTreeStack(List<InternalNode> newTreeStack) {
		return new ParserConfiguration(stacks, newTreeStack, treeQueue, pendingAdjunctions, remainingInput,
				unconsumedFrontierCount, operationLog);
	}

	public ParserConfiguration withTreeQueue(List<InternalNode> newTreeQueue) {
		return new ParserConfiguration(stacks, treeStack, newTreeQueue, pendingAdjunctions, remainingInput,
				unconsumedFrontierCount, operationLog);
	}

	public ParserConfiguration withPendingAdjunctions(List<TreeRuleRef> newPendingAdjunctions) {
		return new ParserConfiguration(stacks, treeStack, treeQueue, newPendingAdjunctions, remainingInput,
				unconsumedFrontierCount, operationLog);
	}

	public ParserConfiguration withRemainingInput(List<String> newRemainingInput) {
		return new ParserConfiguration(stacks, treeStack, treeQueue, pendingAdjunctions, newRemainingInput,
				unconsumedFrontierCount, operationLog);
	}

	public ParserConfiguration withUnconsumedFrontierCount(int newCount) {
		return new ParserConfiguration(stacks, treeStack, treeQueue, pendingAdjunctions, remainingInput,
				newCount, operationLog);
	}

	public ParserConfiguration withStep(DerivationStep step) {
		List<DerivationStep> newLog = new ArrayList<>(operationLog);
		newLog.add(step);
		return new ParserConfiguration(stacks, treeStack, treeQueue, pendingAdjunctions, remainingInput,
				unconsumedFrontierCount, newLog);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ParserConfiguration that = (ParserConfiguration) o;
		return unconsumedFrontierCount == that.unconsumedFrontierCount &&
				stacks.equals(that.stacks) &&
				treeStack.equals(that.treeStack) &&
				treeQueue.equals(that.treeQueue) &&
				pendingAdjunctions.equals(that.pendingAdjunctions) &&
				remainingInput.equals(that.remainingInput) &&
				operationLog.equals(that.operationLog);
	}

	@Override
	public int hashCode() {
		return Objects.hash(stacks, treeStack, treeQueue, pendingAdjunctions, remainingInput,
				unconsumedFrontierCount, operationLog);
	}

	@Override
	public String toString() {
		return "ParserConfiguration{stacks=" + stacks +
				", treeStack=" + treeStack +
				", treeQueue=" + treeQueue +
				", pending=" + pendingAdjunctions +
				", input=" + remainingInput +
				", unconsumed=" + unconsumedFrontierCount +
				", steps=" + operationLog.size() + "}";
	}
}
