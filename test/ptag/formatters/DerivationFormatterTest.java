package ptag.formatters;

import org.junit.Test;
import ptag.automaton.Derivation;
import ptag.automaton.DerivationStep;
import ptag.automaton.OperationKind;
import ptag.model.tree.InternalNode;
import ptag.model.tree.TreePath;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static ptag.model.tree.TreeBuilder.*;

public class DerivationFormatterTest {

	@Test
	public void testLayout() throws IOException {
		InternalNode map = tree("NP", tree("N", "map"));
		InternalNode aux = tree("NP", tree("D", "a"), foot("NP"));
		InternalNode adjoined = tree("NP", tree("D", "a"), map);
		DerivationStep step = new DerivationStep(map, aux, OperationKind.ADJUNCTION, TreePath.root(), adjoined);

		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		new DerivationFormatter(out).format(Arrays.asList(
				new Derivation(Collections.singletonList(step), adjoined),
				new Derivation(Collections.<DerivationStep>emptyList(), map)));

		String nl = System.lineSeparator();
		assertThat(w.toString(), is(
				"**** For Parse 1 ****" + nl +
				"    **** Operation 1 ****" + nl +
				"         Tree1 = (NP (N map))" + nl +
				"         Tree2 = (NP (D a) (NP*))" + nl +
				"         op (S or A) = A" + nl +
				"         Position = [0]" + nl +
				"         Result = (NP (D a) (NP (N map)))" + nl +
				"*************************" + nl +
				"**** For Parse 2 ****" + nl +
				"*************************" + nl));
	}
}
