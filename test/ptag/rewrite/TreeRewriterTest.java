package ptag.rewrite;

import org.junit.Test;
import ptag.model.tree.InternalNode;
import ptag.model.tree.TreeNode;
import ptag.model.tree.TreePath;

import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;
import static ptag.model.tree.TreeBuilder.*;

public class TreeRewriterTest {

	private static final InternalNode SENTENCE = tree("S",
			frontier("NP"),
			tree("VP",
					tree("VP", tree("V", "had"), frontier("NP")),
					frontier("PP")));

	private static final InternalNode MAP = tree("NP", tree("N", "map"));
	private static final InternalNode DET_A = tree("NP", tree("D", "a"), foot("NP"));

	@Test
	public void testSubstitutePlacesFragmentUnchanged() {
		RewriteResult result = TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(0, 2, 1, 2));
		assertTrue(result.isSuccess());
		assertThat(TreeRewriter.subtreeAt(result.getSuccess(), TreePath.of(0, 2, 1, 2)),
				is(Optional.<TreeNode>of(MAP)));
		assertThat(result.getSuccess().toString(),
				is("(S (NP) (VP (VP (V had) (NP (N map))) (PP)))"));
	}

	@Test
	public void testSubstituteAtFirstChild() {
		RewriteResult result = TreeRewriter.substitute(SENTENCE, tree("NP", tree("N", "I")), TreePath.of(0, 1));
		assertThat(result.getSuccess().toString(), is("(S (NP (N I)) (VP (VP (V had) (NP)) (PP)))"));
	}

	@Test
	public void testSubstituteAtRootReplacesFrontierTree() {
		RewriteResult result = TreeRewriter.substitute(frontier("NP"), MAP, TreePath.root());
		assertThat(result.getSuccess(), is(MAP));
	}

	@Test
	public void testSubstituteIntoFoot() {
		RewriteResult result = TreeRewriter.substitute(DET_A, MAP, TreePath.of(0, 2));
		assertThat(result.getSuccess().toString(), is("(NP (D a) (NP (N map)))"));
	}

	@Test
	public void testSubstituteLabelMismatch() {
		RewriteResult result = TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(0, 2, 2));
		assertFalse(result.isSuccess());
		assertThat(result.getFailure().getKind(), is(RewriteFailure.Kind.LABEL_MISMATCH));
	}

	@Test
	public void testSubstituteAtInnerNode() {
		RewriteResult result = TreeRewriter.substitute(SENTENCE, tree("VP", tree("V", "ran")), TreePath.of(0, 2));
		assertThat(result.getFailure().getKind(), is(RewriteFailure.Kind.BAD_POSITION));
	}

	@Test
	public void testSubstituteOutOfRange() {
		RewriteResult result = TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(0, 3));
		assertThat(result.getFailure().getKind(), is(RewriteFailure.Kind.BAD_POSITION));
	}

	@Test
	public void testSubstituteThroughTerminal() {
		RewriteResult result = TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(0, 2, 1, 1, 1));
		assertThat(result.getFailure().getKind(), is(RewriteFailure.Kind.BAD_TREE));
	}

	@Test
	public void testMalformedPosition() {
		assertThat(TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(1, 2)).getFailure().getKind(),
				is(RewriteFailure.Kind.MALFORMED_POSITION));
		assertThat(TreeRewriter.adjoin(SENTENCE, DET_A, TreePath.of(0, 0)).getFailure().getKind(),
				is(RewriteFailure.Kind.MALFORMED_POSITION));
	}

	@Test
	public void testAdjoinKeepsExcisedSubtreeAtFoot() {
		InternalNode tree = tree("S", tree("NP", tree("N", "map")), tree("V", "fell"));
		RewriteResult result = TreeRewriter.adjoin(tree, DET_A, TreePath.of(0, 1));
		assertTrue(result.isSuccess());
		assertThat(result.getSuccess().toString(), is("(S (NP (D a) (NP (N map))) (V fell))"));
		// the excised subtree sits unchanged at the foot of the spliced tree
		assertThat(TreeRewriter.subtreeAt(result.getSuccess(), TreePath.of(0, 1, 2)),
				is(Optional.<TreeNode>of(tree("NP", tree("N", "map")))));
	}

	@Test
	public void testAdjoinAtRootIsSubstitutionAtFoot() {
		Optional<TreePath> foot = TreeRewriter.footPosition(DET_A);
		assertThat(foot, is(Optional.of(TreePath.of(0, 2))));
		assertThat(TreeRewriter.adjoin(MAP, DET_A, TreePath.root()),
				is(TreeRewriter.substitute(DET_A, MAP, foot.get())));
	}

	@Test
	public void testAdjoinLabelMismatch() {
		RewriteResult result = TreeRewriter.adjoin(SENTENCE, DET_A, TreePath.of(0, 2));
		assertThat(result.getFailure().getKind(), is(RewriteFailure.Kind.LABEL_MISMATCH));
	}

	@Test
	public void testAdjoinWithoutFoot() {
		RewriteResult result = TreeRewriter.adjoin(SENTENCE, tree("NP", tree("D", "a")), TreePath.of(0, 1));
		assertThat(result.getFailure().getKind(), is(RewriteFailure.Kind.MISSING_FOOT));
	}

	@Test
	public void testFootPositionNested() {
		InternalNode aux = tree("VP", tree("VP", tree("Adv", "really"), foot("VP")));
		assertThat(TreeRewriter.footPosition(aux), is(Optional.of(TreePath.of(0, 1, 2))));
		assertThat(TreeRewriter.footPosition(MAP), is(Optional.<TreePath>empty()));
	}

	@Test
	public void testInputsUnchanged() {
		String before = SENTENCE.toString();
		TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(0, 2, 1, 2));
		TreeRewriter.adjoin(SENTENCE, DET_A, TreePath.of(0, 1));
		assertThat(SENTENCE.toString(), is(before));
	}

	@Test(expected = IllegalStateException.class)
	public void testFailureHasNoTree() {
		TreeRewriter.substitute(SENTENCE, MAP, TreePath.of(0, 3)).getSuccess();
	}
}
