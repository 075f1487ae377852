package ptag.automaton;

import ptag.compiler.DottedRule;
import ptag.compiler.RuleCompiler;
import ptag.compiler.RuleKind;
import ptag.compiler.TreeRuleRef;
import ptag.model.grammar.ElementaryTree;
import ptag.model.grammar.TreeAdjoiningGrammar;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;
import ptag.model.tree.TreeNode;
import ptag.model.tree.TreePath;
import ptag.rewrite.RewriteResult;
import ptag.rewrite.TreeRewriter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The bottom-up embedded push-down automaton that recognises a TAG.
 *
 * Every elementary tree is traversed depth-first through its compiled rules. Substitution
 * starts an initial tree on top of the current inner stack; adjunction suspends the current
 * node on the pending adjunctions stack, traverses the auxiliary tree in a new inner stack and
 * resumes the suspended node when the foot is reached. The derived tree is assembled
 * bottom-up: the innermost substitution or adjunction is materialised first.
 *
 * Each operator maps a configuration to its successors. An operator whose precondition does
 * not hold returns no successors; this is the only way a branch of the search is pruned.
 */
public class Bepda {

	private static final Logger logger = Logger.getLogger("Bepda");

	private final TreeAdjoiningGrammar grammar;
	private final List<Transition> transitions;

	public Bepda(TreeAdjoiningGrammar grammar) {
		this.grammar = grammar;
		this.transitions = Collections.unmodifiableList(Arrays.<Transition>asList(
				this::adjoinCall,
				this::call,
				this::substitutionCall,
				this::scan,
				this::footCall,
				this::ret,
				this::adjoinReturn,
				this::substitutionReturn,
				this::footReturn));
	}

	/**
	 * @return every operator that produces successor configurations, in the order the driver applies them
	 */
	public List<Transition> transitions() {
		return transitions;
	}

	/**
	 * Starts one parse per initial tree rooted in the start symbol, provided the tree does
	 * not have more leaves than there are tokens.
	 */
	public List<ParserConfiguration> initialise(List<String> input) {
		ParserConfiguration start = ParserConfiguration.start(input);
		List<ParserConfiguration> result = new ArrayList<>();
		for (ElementaryTree tree : grammar.getInitialTrees()) {
			if (!tree.getRootLabel().equals(grammar.getStartSymbol()) || tree.getLeafCount() > input.size()) {
				continue;
			}
			result.add(start
					.withStacks(start.getStacks().wrap(tree.rootRule()))
					.withTreeStack(Collections.singletonList(tree.getTree()))
					.withUnconsumedFrontierCount(tree.getLeafCount()));
		}
		return result;
	}

	/**
	 * Accepts a configuration in which only the start sentinel and a completely recognised
	 * start tree remain, with no input and no pending adjunctions left. The successor holds
	 * the finish sentinel alone.
	 */
	public List<ParserConfiguration> finish(ParserConfiguration configuration) {
		StackSet stacks = configuration.getStacks();
		if (stacks.depth() != 2 || stacks.get(0).isEmpty() || stacks.get(0).get(0) != Sentinel.START) {
			return Collections.emptyList();
		}
		if (!configuration.getRemainingInput().isEmpty() || !configuration.getPendingAdjunctions().isEmpty()) {
			return Collections.emptyList();
		}
		Optional<TreeRuleRef> top = stacks.top().flatMap(StackSymbol::asTreeRule);
		if (!top.isPresent()) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		if (!r.getPath().isRoot() || !r.getRule().isComplete()
				|| !r.getRule().getLhs().equals(grammar.getStartSymbol())) {
			return Collections.emptyList();
		}
		return Collections.singletonList(configuration.withStacks(stacks.unwrapOuter(
				Collections.singletonList(Sentinel.START), Collections.singletonList(Sentinel.FINISH))));
	}

	public boolean isAccepting(ParserConfiguration configuration) {
		return !finish(configuration).isEmpty();
	}

	/**
	 * Descends into the node after the dot of the top rule.
	 */
	public List<ParserConfiguration> call(ParserConfiguration configuration) {
		Optional<TreeRuleRef> top = topRule(configuration);
		if (!top.isPresent() || configuration.getRemainingInput().isEmpty() || top.get().getRule().isComplete()) {
			return Collections.emptyList();
		}
		TreeRuleRef next = ruleAfterDot(top.get());
		if (next.isNoRule()) {
			return Collections.emptyList();
		}
		return Collections.singletonList(configuration.withStacks(configuration.getStacks().wrap(next)));
	}

	/**
	 * Pops a completed child rule and moves the dot of its parent past it.
	 */
	public List<ParserConfiguration> ret(ParserConfiguration configuration) {
		return returnTransition(configuration, ReturnMode.PLAIN);
	}

	/**
	 * Pops the completed top rule and shifts the rule below it, unless that rule is already
	 * complete (as after an adjunction, which completes the interrupted rule up front).
	 *
	 * In {@link ReturnMode#PLAIN} the top rule must be the node after the dot of the rule below;
	 * in {@link ReturnMode#RESUMING} the two belong to different trees and the caller has checked them.
	 */
	public List<ParserConfiguration> returnTransition(ParserConfiguration configuration, ReturnMode mode) {
		StackSet stacks = configuration.getStacks();
		Optional<TreeRuleRef> top = stacks.top().flatMap(StackSymbol::asTreeRule);
		Optional<TreeRuleRef> below = stacks.belowTop().flatMap(StackSymbol::asTreeRule);
		if (!top.isPresent() || !below.isPresent() || !top.get().getRule().isComplete()) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		TreeRuleRef p = below.get();
		if (mode == ReturnMode.PLAIN) {
			TreeRuleRef expected = ruleAfterDot(p);
			if (expected.isNoRule() || !expected.sameNode(r)) {
				return Collections.emptyList();
			}
		}
		DottedRule shifted = p.getRule().isComplete() ? p.getRule() : p.getRule().shift();
		StackSet newStacks = stacks.unwrapOuter(
				Collections.singletonList(p), Collections.singletonList(p.withRule(shifted)));
		return Collections.singletonList(configuration.withStacks(newStacks));
	}

	/**
	 * Consumes the next token if the top rule is the matching terminal.
	 */
	public List<ParserConfiguration> scan(ParserConfiguration configuration) {
		Optional<TreeRuleRef> top = topRule(configuration);
		List<String> input = configuration.getRemainingInput();
		if (!top.isPresent() || input.isEmpty()) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		DottedRule rule = r.getRule();
		if (rule.getKind() != RuleKind.TERMINAL || rule.isComplete() || !rule.getLhs().equals(input.get(0))) {
			return Collections.emptyList();
		}
		StackSet newStacks = configuration.getStacks().swap(
				Collections.singletonList(r), Collections.singletonList(r.withRule(rule.shift())));
		return Collections.singletonList(configuration
				.withStacks(newStacks)
				.withRemainingInput(input.subList(1, input.size()))
				.withUnconsumedFrontierCount(configuration.getUnconsumedFrontierCount() - 1));
	}

	/**
	 * Interrupts an inner node that has not been entered yet and starts every auxiliary tree
	 * that can adjoin there. The interrupted node is completed in place, remembered on the
	 * pending adjunctions stack, and its tree waits in the tree queue.
	 */
	public List<ParserConfiguration> adjoinCall(ParserConfiguration configuration) {
		Optional<TreeRuleRef> top = topRule(configuration);
		List<String> input = configuration.getRemainingInput();
		if (!top.isPresent() || input.isEmpty() || configuration.getTreeStack().isEmpty()) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		if (r.getRule().getKind() != RuleKind.INTERNAL || r.getRule().getDotPosition() != 0) {
			return Collections.emptyList();
		}
		List<ParserConfiguration> result = new ArrayList<>();
		for (ElementaryTree aux : grammar.getAuxiliaryTrees()) {
			int unconsumed = configuration.getUnconsumedFrontierCount() + aux.getLeafCount() - 1;
			if (!aux.getRootLabel().equals(r.getRule().getLhs()) || unconsumed > input.size()) {
				continue;
			}
			StackSet newStacks = configuration.getStacks()
					.popOuter()
					.wrap(r.withRule(r.getRule().complete()))
					.wrap(aux.rootRule());
			List<InternalNode> treeStack = configuration.getTreeStack();
			result.add(configuration
					.withStacks(newStacks)
					.withPendingAdjunctions(prepend(r, configuration.getPendingAdjunctions()))
					.withTreeStack(prepend(aux.getTree(), rest(treeStack)))
					.withTreeQueue(append(configuration.getTreeQueue(), treeStack.get(0)))
					.withUnconsumedFrontierCount(unconsumed));
		}
		return result;
	}

	/**
	 * Finishes an auxiliary tree: pops its completed root and adjoins the derived auxiliary
	 * tree into the tree waiting at the end of the tree queue.
	 */
	public List<ParserConfiguration> adjoinReturn(ParserConfiguration configuration) {
		StackSet stacks = configuration.getStacks();
		Optional<TreeRuleRef> top = stacks.top().flatMap(StackSymbol::asTreeRule);
		Optional<TreeRuleRef> below = stacks.belowTop().flatMap(StackSymbol::asTreeRule);
		if (!top.isPresent() || !below.isPresent() || configuration.getTreeQueue().isEmpty()
				|| configuration.getTreeStack().isEmpty()) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		TreeRuleRef p = below.get();
		if (r.getOrigin() != TreeOrigin.AUXILIARY || !r.getRule().isComplete() || !r.getPath().isRoot()
				|| !p.getRule().isComplete()) {
			return Collections.emptyList();
		}
		List<ParserConfiguration> returned = returnTransition(configuration, ReturnMode.RESUMING);
		if (returned.isEmpty()) {
			return returned;
		}

		List<InternalNode> treeQueue = configuration.getTreeQueue();
		List<InternalNode> treeStack = configuration.getTreeStack();
		InternalNode target = last(treeQueue);
		InternalNode auxTree = treeStack.get(0);
		TreePath position = p.getPath();
		RewriteResult adjoined = TreeRewriter.adjoin(target, auxTree, position);
		if (!adjoined.isSuccess()) {
			logger.fine("discarding adjunction: " + adjoined.getFailure());
			return Collections.emptyList();
		}
		DerivationStep step = new DerivationStep(target, auxTree, OperationKind.ADJUNCTION, position,
				adjoined.getSuccess());

		List<ParserConfiguration> result = new ArrayList<>();
		for (ParserConfiguration next : returned) {
			result.add(next
					.withTreeStack(prepend(adjoined.getSuccess(), rest(treeStack)))
					.withTreeQueue(withoutLast(treeQueue))
					.withStep(step));
		}
		return result;
	}

	/**
	 * Reaching the foot of an auxiliary tree resumes the most recently interrupted node, and
	 * its tree moves from the tree queue back onto the tree stack.
	 */
	public List<ParserConfiguration> footCall(ParserConfiguration configuration) {
		Optional<TreeRuleRef> top = topRule(configuration);
		if (!top.isPresent() || configuration.getTreeQueue().isEmpty()
				|| configuration.getPendingAdjunctions().isEmpty() || configuration.getRemainingInput().isEmpty()) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		if (!isUnconsumedFoot(r)) {
			return Collections.emptyList();
		}
		List<TreeRuleRef> pending = configuration.getPendingAdjunctions();
		List<InternalNode> treeQueue = configuration.getTreeQueue();
		return Collections.singletonList(configuration
				.withStacks(configuration.getStacks().wrap(pending.get(0)))
				.withTreeStack(prepend(last(treeQueue), configuration.getTreeStack()))
				.withTreeQueue(withoutLast(treeQueue))
				.withPendingAdjunctions(rest(pending)));
	}

	/**
	 * Completing the resumed node completes the foot; the resumed tree goes back to the tree
	 * queue until the auxiliary tree is finished.
	 */
	public List<ParserConfiguration> footReturn(ParserConfiguration configuration) {
		StackSet stacks = configuration.getStacks();
		Optional<TreeRuleRef> top = stacks.top().flatMap(StackSymbol::asTreeRule);
		Optional<TreeRuleRef> below = stacks.belowTop().flatMap(StackSymbol::asTreeRule);
		if (!top.isPresent() || !below.isPresent() || configuration.getTreeStack().isEmpty()) {
			return Collections.emptyList();
		}
		if (!isUnconsumedFoot(below.get()) || !top.get().getRule().isComplete()) {
			return Collections.emptyList();
		}
		List<InternalNode> treeStack = configuration.getTreeStack();
		List<ParserConfiguration> result = new ArrayList<>();
		for (ParserConfiguration next : returnTransition(configuration, ReturnMode.RESUMING)) {
			result.add(next
					.withTreeStack(rest(treeStack))
					.withTreeQueue(append(configuration.getTreeQueue(), treeStack.get(0))));
		}
		return result;
	}

	/**
	 * Starts every initial tree that can be substituted at the frontier node on top.
	 */
	public List<ParserConfiguration> substitutionCall(ParserConfiguration configuration) {
		Optional<TreeRuleRef> top = topRule(configuration);
		if (!top.isPresent()) {
			return Collections.emptyList();
		}
		DottedRule rule = top.get().getRule();
		if (rule.getKind() != RuleKind.FRONTIER || rule.isFoot() || rule.isComplete()) {
			return Collections.emptyList();
		}
		List<String> input = configuration.getRemainingInput();
		List<ParserConfiguration> result = new ArrayList<>();
		for (ElementaryTree initial : grammar.getInitialTrees()) {
			int unconsumed = configuration.getUnconsumedFrontierCount() + initial.getLeafCount() - 1;
			if (!initial.getRootLabel().equals(rule.getLhs()) || unconsumed > input.size()) {
				continue;
			}
			result.add(configuration
					.withStacks(configuration.getStacks().wrap(initial.rootRule()))
					.withTreeStack(prepend(initial.getTree(), configuration.getTreeStack()))
					.withUnconsumedFrontierCount(unconsumed));
		}
		return result;
	}

	/**
	 * Finishes a substituted initial tree: pops its completed root and substitutes the derived
	 * tree at the frontier node below it.
	 */
	public List<ParserConfiguration> substitutionReturn(ParserConfiguration configuration) {
		StackSet stacks = configuration.getStacks();
		Optional<TreeRuleRef> top = stacks.top().flatMap(StackSymbol::asTreeRule);
		Optional<TreeRuleRef> below = stacks.belowTop().flatMap(StackSymbol::asTreeRule);
		List<InternalNode> treeStack = configuration.getTreeStack();
		if (!top.isPresent() || !below.isPresent() || treeStack.size() < 2) {
			return Collections.emptyList();
		}
		TreeRuleRef r = top.get();
		TreeRuleRef p = below.get();
		DottedRule site = p.getRule();
		if (r.getOrigin() != TreeOrigin.INITIAL || !r.getRule().isComplete() || !r.getPath().isRoot()
				|| site.getKind() != RuleKind.FRONTIER || site.isComplete()
				|| !r.getRule().getLhs().equals(site.getLhs())) {
			return Collections.emptyList();
		}
		List<ParserConfiguration> returned = returnTransition(configuration, ReturnMode.RESUMING);
		if (returned.isEmpty()) {
			return returned;
		}

		InternalNode target = treeStack.get(1);
		InternalNode inserted = treeStack.get(0);
		TreePath position = p.getPath();
		RewriteResult substituted = TreeRewriter.substitute(target, inserted, position);
		if (!substituted.isSuccess()) {
			logger.fine("discarding substitution: " + substituted.getFailure());
			return Collections.emptyList();
		}
		DerivationStep step = new DerivationStep(target, inserted, OperationKind.SUBSTITUTION, position,
				substituted.getSuccess());

		List<ParserConfiguration> result = new ArrayList<>();
		for (ParserConfiguration next : returned) {
			result.add(next
					.withTreeStack(prepend(substituted.getSuccess(), treeStack.subList(2, treeStack.size())))
					.withStep(step));
		}
		return result;
	}

	private Optional<TreeRuleRef> topRule(ParserConfiguration configuration) {
		return configuration.getStacks().top().flatMap(StackSymbol::asTreeRule);
	}

	private TreeRuleRef ruleAfterDot(TreeRuleRef ref) {
		if (ref.isNoRule()) {
			return TreeRuleRef.NO_RULE;
		}
		return RuleCompiler.getRuleAtPath(ref, grammar.getTree(ref.getOrigin(), ref.getTreeIndex()).getRules());
	}

	/**
	 * @return true if ref is the foot rule of its own auxiliary tree and the foot has not been recognised yet
	 */
	private boolean isUnconsumedFoot(TreeRuleRef ref) {
		if (ref.getOrigin() != TreeOrigin.AUXILIARY || !ref.getRule().isFoot() || ref.getRule().isComplete()) {
			return false;
		}
		String rootLabel = grammar.getTree(TreeOrigin.AUXILIARY, ref.getTreeIndex()).getRootLabel();
		return ref.getRule().getLhs().equals(rootLabel + TreeNode.FOOT_MARKER);
	}

	private static <T> List<T> prepend(T head, List<T> tail) {
		List<T> result = new ArrayList<>(tail.size() + 1);
		result.add(head);
		result.addAll(tail);
		return result;
	}

	private static <T> List<T> append(List<T> init, T last) {
		List<T> result = new ArrayList<>(init);
		result.add(last);
		return result;
	}

	private static <T> List<T> rest(List<T> list) {
		return list.subList(1, list.size());
	}

	private static <T> T last(List<T> list) {
		return list.get(list.size() - 1);
	}

	private static <T> List<T> withoutLast(List<T> list) {
		return list.subList(0, list.size() - 1);
	}
}
