package ptag.model.grammar;

import ptag.errors.TopLevelIssueContext;
import ptag.model.tree.InternalNode;
import ptag.passes.validation.GrammarValidationPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A Tree Adjoining Grammar: a start symbol, initial trees and auxiliary trees. A grammar is
 * validated on construction, so every instance is well-formed and read-only.
 */
public final class TreeAdjoiningGrammar {

	private final String startSymbol;
	private final List<ElementaryTree> initialTrees;
	private final List<ElementaryTree> auxiliaryTrees;

	/**
	 * @throws GrammarException listing every problem found in the trees
	 */
	public TreeAdjoiningGrammar(String startSymbol, List<InternalNode> initialTrees,
	                            List<InternalNode> auxiliaryTrees) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		GrammarValidationPass.perform(ctx, startSymbol, initialTrees, auxiliaryTrees);
		if (ctx.hasErrors()) {
			throw new GrammarException(ctx);
		}
		this.startSymbol = startSymbol;
		this.initialTrees = compile(TreeOrigin.INITIAL, initialTrees);
		this.auxiliaryTrees = compile(TreeOrigin.AUXILIARY, auxiliaryTrees);
	}

	private static List<ElementaryTree> compile(TreeOrigin origin, List<InternalNode> trees) {
		List<ElementaryTree> compiled = new ArrayList<>();
		for (int i = 0; i < trees.size(); ++i) {
			compiled.add(new ElementaryTree(origin, i, trees.get(i)));
		}
		return Collections.unmodifiableList(compiled);
	}

	public String getStartSymbol() {
		return startSymbol;
	}

	public List<ElementaryTree> getInitialTrees() {
		return initialTrees;
	}

	public List<ElementaryTree> getAuxiliaryTrees() {
		return auxiliaryTrees;
	}

	public ElementaryTree getTree(TreeOrigin origin, int index) {
		switch (origin) {
			case INITIAL:
				return initialTrees.get(index);
			case AUXILIARY:
				return auxiliaryTrees.get(index);
			default:
				throw new IllegalArgumentException("no elementary tree has origin " + origin);
		}
	}
}
