package ptag.passes.validation;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import ptag.DemoGrammar;
import ptag.errors.Issue;
import ptag.errors.TopLevelIssueContext;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static ptag.model.tree.TreeBuilder.*;

@RunWith(Parameterized.class)
public class GrammarValidationPassTest {

	private static final InternalNode MAP = tree("NP", tree("N", "map"));

	@Parameters
	public static List<Object[]> data() {
		InternalNode initialWithFoot = tree("NP", tree("D", "the"), foot("NP"));
		InternalNode footless = tree("NP", tree("D", "a"), frontier("NP"));
		InternalNode twoFeet = tree("NP", foot("NP"), tree("D", "a"), foot("NP"));
		InternalNode wrongFoot = tree("NP", tree("D", "a"), foot("VP"));
		InternalNode markedRoot = new InternalNode("NP*", Arrays.asList(tree("D", "a"), foot("NP")));
		InternalNode unlexicalizedInitial = tree("S", frontier("NP"), frontier("VP"));
		InternalNode unlexicalizedAux = tree("VP", foot("VP"), frontier("PP"));
		InternalNode unitInitial = tree("NP", frontier("NP"));
		InternalNode unitAux = tree("NP", foot("NP"));

		return Arrays.asList(new Object[][]{
				{"S", DemoGrammar.initialTrees(), DemoGrammar.auxiliaryTrees(), Collections.emptyList()},
				{"NP", Collections.singletonList(MAP), Collections.emptyList(), Collections.emptyList()},
				{"VP", DemoGrammar.initialTrees(), DemoGrammar.auxiliaryTrees(),
						Collections.singletonList(new UndefinedStartSymbolIssue("VP"))},
				{"NP", Arrays.asList(MAP, initialWithFoot), Collections.emptyList(),
						Collections.singletonList(new MisplacedFootIssue(TreeOrigin.INITIAL, 1, initialWithFoot, "NP*"))},
				{"NP", Collections.singletonList(MAP), Collections.singletonList(footless),
						Collections.singletonList(new MissingFootIssue(0, footless))},
				{"NP", Collections.singletonList(MAP), Arrays.asList(footless, twoFeet),
						Arrays.asList(new MissingFootIssue(0, footless), new MultipleFootIssue(1, twoFeet, 2))},
				{"NP", Collections.singletonList(MAP), Collections.singletonList(wrongFoot),
						Arrays.asList(
								new MisplacedFootIssue(TreeOrigin.AUXILIARY, 0, wrongFoot, "VP*"),
								new MissingFootIssue(0, wrongFoot))},
				{"NP", Collections.singletonList(MAP), Collections.singletonList(markedRoot),
						Arrays.asList(
								new MisplacedFootIssue(TreeOrigin.AUXILIARY, 0, markedRoot, "NP*"),
								// the foot below no longer matches the marked root
								new MisplacedFootIssue(TreeOrigin.AUXILIARY, 0, markedRoot, "NP*"),
								new MissingFootIssue(0, markedRoot))},
				{"S", Arrays.asList(unlexicalizedInitial, MAP), Collections.singletonList(unlexicalizedAux),
						Collections.emptyList()},
				{"NP", Arrays.asList(MAP, unitInitial), Collections.singletonList(unitAux),
						Arrays.asList(
								new UnitTreeIssue(TreeOrigin.INITIAL, 1, unitInitial),
								new UnitTreeIssue(TreeOrigin.AUXILIARY, 0, unitAux))},
		});
	}

	private final String startSymbol;
	private final List<InternalNode> initialTrees;
	private final List<InternalNode> auxiliaryTrees;
	private final List<Issue> issues;

	public GrammarValidationPassTest(String startSymbol, List<InternalNode> initialTrees,
	                                 List<InternalNode> auxiliaryTrees, List<Issue> issues) {
		this.startSymbol = startSymbol;
		this.initialTrees = initialTrees;
		this.auxiliaryTrees = auxiliaryTrees;
		this.issues = issues;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		GrammarValidationPass.perform(ctx, startSymbol, initialTrees, auxiliaryTrees);
		assertEquals(issues, ctx.getIssues());
	}
}
