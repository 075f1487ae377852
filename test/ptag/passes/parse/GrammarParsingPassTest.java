package ptag.passes.parse;

import org.junit.Test;
import ptag.DemoGrammar;
import ptag.errors.TopLevelIssueContext;
import ptag.model.grammar.ElementaryTree;
import ptag.model.grammar.TreeAdjoiningGrammar;
import ptag.model.grammar.TreeOrigin;
import ptag.model.tree.InternalNode;
import ptag.passes.validation.UndefinedStartSymbolIssue;
import ptag.passes.validation.UnitTreeIssue;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static ptag.model.tree.TreeBuilder.*;

public class GrammarParsingPassTest {

	private static List<InternalNode> trees(List<ElementaryTree> elementaryTrees) {
		List<InternalNode> result = new ArrayList<>();
		for (ElementaryTree tree : elementaryTrees) {
			result.add(tree.getTree());
		}
		return result;
	}

	@Test
	public void testSampleFile() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TreeAdjoiningGrammar grammar = GrammarParsingPass.perform(ctx, Paths.get("test", "grammars", "sample.json"));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(grammar.getStartSymbol(), is("S"));
		assertThat(trees(grammar.getInitialTrees()), is(DemoGrammar.initialTrees()));
		assertThat(trees(grammar.getAuxiliaryTrees()), is(DemoGrammar.auxiliaryTrees()));
	}

	@Test
	public void testMissingFile() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TreeAdjoiningGrammar grammar = GrammarParsingPass.perform(ctx, Paths.get("test", "grammars", "missing.json"));
		assertThat(grammar, is(nullValue()));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(IOErrorIssue.class));
	}

	@Test
	public void testAuxiliaryTreesOptional() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TreeAdjoiningGrammar grammar = GrammarParsingPass.perform(ctx, "inline",
				"{\"start\": \"NP\", \"initial\": [\"(NP (N map))\"]}");
		assertFalse(ctx.hasErrors());
		assertThat(grammar.getAuxiliaryTrees().size(), is(0));
	}

	@Test
	public void testNotJson() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(GrammarParsingPass.perform(ctx, "inline", "(NP (N map))"), is(nullValue()));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(GrammarFormatIssue.class));
	}

	@Test
	public void testMissingStart() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(GrammarParsingPass.perform(ctx, "inline", "{\"initial\": [\"(NP (N map))\"]}"),
				is(nullValue()));
		assertThat(ctx.getIssues().get(0), instanceOf(GrammarFormatIssue.class));
	}

	@Test
	public void testBadTrees() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(GrammarParsingPass.perform(ctx, "inline",
				"{\"start\": \"NP\", \"initial\": [\"(NP (N map)\", \"(NP (N desk))\"], \"auxiliary\": [\"NP\"]}"),
				is(nullValue()));
		assertEquals(2, ctx.getIssues().size());
		GrammarFormatIssue first = (GrammarFormatIssue) ctx.getIssues().get(0);
		assertThat(first.getSource(), is("inline"));
		assertThat(first.getProblem(), startsWith("initial tree #0: "));
		GrammarFormatIssue second = (GrammarFormatIssue) ctx.getIssues().get(1);
		assertThat(second.getProblem(), startsWith("auxiliary tree #0: "));
	}

	@Test
	public void testInvalidGrammar() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(GrammarParsingPass.perform(ctx, "inline", "{\"start\": \"S\", \"initial\": [\"(NP (N map))\"]}"),
				is(nullValue()));
		assertEquals(Collections.singletonList(new UndefinedStartSymbolIssue("S")), ctx.getIssues());
	}

	@Test
	public void testUnitTrees() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(GrammarParsingPass.perform(ctx, "inline",
				"{\"start\": \"NP\", \"initial\": [\"(NP (N map))\", \"(NP (NP))\"], \"auxiliary\": [\"(NP (NP*))\"]}"),
				is(nullValue()));
		assertEquals(Arrays.asList(
				new UnitTreeIssue(TreeOrigin.INITIAL, 1, tree("NP", frontier("NP"))),
				new UnitTreeIssue(TreeOrigin.AUXILIARY, 0, tree("NP", foot("NP")))), ctx.getIssues());
	}

	@Test
	public void testTreesWithoutTerminals() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TreeAdjoiningGrammar grammar = GrammarParsingPass.perform(ctx, "inline",
				"{\"start\": \"S\", \"initial\": [\"(S (NP) (VP (V had) (NP)))\", \"(NP (N map))\", " +
						"\"(PP (P on) (NP))\"], \"auxiliary\": [\"(VP (VP*) (PP))\"]}");
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(trees(grammar.getAuxiliaryTrees()),
				is(Collections.singletonList(tree("VP", foot("VP"), frontier("PP")))));
	}
}
