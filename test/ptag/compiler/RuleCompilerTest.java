package ptag.compiler;

import org.junit.Test;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;
import ptag.model.tree.TreePath;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;
import static ptag.model.tree.TreeBuilder.*;

public class RuleCompilerTest {

	private static final InternalNode DET_A = tree("NP", tree("D", "a"), foot("NP"));

	@Test
	public void testOneRulePerNode() {
		CompiledTree rules = RuleCompiler.treeToRules(DET_A);
		assertThat(rules.size(), is(4));
		assertThat(rules.toList(), is(Arrays.asList(
				new DottedRule(RuleKind.INTERNAL, "NP", Arrays.asList("D", "NP*")),
				new DottedRule(RuleKind.INTERNAL, "D", Collections.singletonList("a")),
				new DottedRule(RuleKind.TERMINAL, "a", Collections.singletonList("a")),
				new DottedRule(RuleKind.FRONTIER, "NP*", Collections.singletonList("NP*")))));
	}

	@Test
	public void testRulesStartUnrecognised() {
		for (DottedRule rule : RuleCompiler.treeToRules(DET_A).toList()) {
			assertThat(rule.getDotPosition(), is(0));
			assertFalse(rule.isComplete());
		}
	}

	@Test
	public void testFootRule() {
		CompiledTree rules = RuleCompiler.treeToRules(DET_A);
		assertTrue(rules.nodeAt(TreePath.of(0, 2)).get().getRule().isFoot());
		assertFalse(RuleCompiler.treeToRules(tree("S", frontier("NP"), tree("V", "ran")))
				.nodeAt(TreePath.of(0, 1)).get().getRule().isFoot());
	}

	@Test
	public void testRuleAtPathFollowsDot() {
		CompiledTree rules = RuleCompiler.treeToRules(DET_A);
		TreeRuleRef root = new TreeRuleRef(rules.getRootRule(), TreeOrigin.AUXILIARY, 1, TreePath.root());

		TreeRuleRef first = RuleCompiler.getRuleAtPath(root, rules);
		assertThat(first, is(new TreeRuleRef(
				new DottedRule(RuleKind.INTERNAL, "D", Collections.singletonList("a")),
				TreeOrigin.AUXILIARY, 1, TreePath.of(0, 1))));

		TreeRuleRef second = RuleCompiler.getRuleAtPath(root.withRule(root.getRule().shift()), rules);
		assertThat(second.getRule().getLhs(), is("NP*"));
		assertThat(second.getPath(), is(TreePath.of(0, 2)));
	}

	@Test
	public void testRuleAtPathPastLastChild() {
		CompiledTree rules = RuleCompiler.treeToRules(DET_A);
		TreeRuleRef root = new TreeRuleRef(rules.getRootRule().complete(), TreeOrigin.AUXILIARY, 1, TreePath.root());
		assertTrue(RuleCompiler.getRuleAtPath(root, rules).isNoRule());
	}

	@Test
	public void testRuleAtPathBelowLeaf() {
		CompiledTree rules = RuleCompiler.treeToRules(DET_A);
		TreeRuleRef terminal = new TreeRuleRef(
				new DottedRule(RuleKind.TERMINAL, "a", Collections.singletonList("a")),
				TreeOrigin.AUXILIARY, 1, TreePath.of(0, 1, 1));
		assertThat(RuleCompiler.getRuleAtPath(terminal, rules), is(TreeRuleRef.NO_RULE));
		assertThat(RuleCompiler.getRuleAtPath(TreeRuleRef.NO_RULE, rules), is(TreeRuleRef.NO_RULE));
	}

	@Test
	public void testDottedRuleToString() {
		DottedRule rule = new DottedRule(RuleKind.INTERNAL, "NP", Arrays.asList("D", "NP*"));
		assertThat(rule.toString(), is("NP -> . D NP*"));
		assertThat(rule.shift().toString(), is("NP -> D . NP*"));
		assertThat(rule.complete().toString(), is("NP -> D NP* ."));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDotOutOfRange() {
		new DottedRule(RuleKind.INTERNAL, "NP", Arrays.asList("D", "NP*"), 3);
	}
}
