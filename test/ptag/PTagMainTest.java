package ptag;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class PTagMainTest {

	private static final String DEMO_PARSE =
			"(S (NP (N I)) (VP (VP (V had) (NP (D a) (NP (N map)))) (PP (P on) (NP (D my) (NP (N desk))))))";

	private static String run(boolean expectSuccess, String... args) throws UnsupportedEncodingException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream stdout = new PrintStream(bytes, true, "UTF-8");
		assertThat(new PTagMain(args, stdout).run(), is(expectSuccess));
		return bytes.toString("UTF-8");
	}

	@Test
	public void testDemo() throws UnsupportedEncodingException {
		assertThat(run(true, "-q", "--demo"), is(DEMO_PARSE + System.lineSeparator()));
	}

	@Test
	public void testDemoDerivations() throws UnsupportedEncodingException {
		String output = run(true, "-q", "-d", "--demo");
		assertThat(output, startsWith("**** For Parse 1 ****"));
		assertThat(output, containsString("**** Operation 6 ****"));
		assertThat(output, not(containsString("**** Operation 7 ****")));
		assertThat(output, containsString("Result = " + DEMO_PARSE));
	}

	@Test
	public void testGrammarFile() throws UnsupportedEncodingException {
		assertThat(run(true, "-q", "-g", "test/grammars/sample.json", "I", "had", "map", "on", "desk"),
				is("(S (NP (N I)) (VP (VP (V had) (NP (N map))) (PP (P on) (NP (N desk)))))"
						+ System.lineSeparator()));
	}

	@Test
	public void testNoParse() throws UnsupportedEncodingException {
		assertThat(run(true, "-q", "--demo", "I", "had", "a", "cat"), is(""));
	}

	@Test
	public void testMissingGrammarFile() throws UnsupportedEncodingException {
		assertThat(run(false, "-q", "-g", "test/grammars/missing.json", "I"), is(""));
	}

	@Test
	public void testGrammarRequired() throws UnsupportedEncodingException {
		assertThat(run(false, "-q", "I", "had", "map"), is(""));
	}

	@Test
	public void testVersion() throws UnsupportedEncodingException {
		assertThat(run(true, "--version"), is("PTag version " + PTagOptions.VERSION + System.lineSeparator()));
	}
}
