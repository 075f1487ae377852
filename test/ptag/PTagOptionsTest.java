package ptag;

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class PTagOptionsTest {

	private static PTagOptions parse(String... args) throws PTagOptionException {
		PTagOptions opts = new PTagOptions(args);
		opts.parse();
		return opts;
	}

	@Test
	public void testGrammarAndTokens() throws PTagOptionException {
		PTagOptions opts = parse("-v", "-d", "-g", "grammar.json", "I", "had", "map");
		assertTrue(opts.logLvlVerbose);
		assertTrue(opts.derivations);
		assertFalse(opts.demo);
		assertThat(opts.grammarFilePath, is("grammar.json"));
		assertThat(opts.tokens, is(Arrays.asList("I", "had", "map")));
	}

	@Test
	public void testDemoDefaultsToSampleSentence() throws PTagOptionException {
		PTagOptions opts = parse("--demo");
		assertTrue(opts.demo);
		assertThat(opts.grammarFilePath, is(nullValue()));
		assertThat(opts.tokens, is(DemoGrammar.sentence()));
	}

	@Test
	public void testDemoWithTokens() throws PTagOptionException {
		assertThat(parse("--demo", "I", "had", "map").tokens, is(Arrays.asList("I", "had", "map")));
	}

	@Test(expected = PTagOptionException.class)
	public void testGrammarAndDemo() throws PTagOptionException {
		parse("--demo", "-g", "grammar.json", "I");
	}

	@Test(expected = PTagOptionException.class)
	public void testNoTokens() throws PTagOptionException {
		parse("-g", "grammar.json");
	}

	@Test(expected = PTagOptionException.class)
	public void testQuietAndVerbose() throws PTagOptionException {
		parse("-q", "-v", "--demo");
	}

	@Test
	public void testHelpSkipsChecks() throws PTagOptionException {
		assertTrue(parse("-h").help);
	}
}
