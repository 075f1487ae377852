package ptag.automaton;

/**
 * How {@link Bepda#returnTransition(ParserConfiguration, ReturnMode)} pops a completed rule.
 */
public enum ReturnMode {
	/** The completed rule must be the child after the dot of the rule below it. */
	PLAIN,
	/** The rule below belongs to another tree that is being resumed; no child check. */
	RESUMING,
}
