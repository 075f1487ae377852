package ptag.compiler;

public enum RuleKind {
	/** A node with children: {@code VP -> V NP}. */
	INTERNAL,
	/** A childless nonterminal, substitution site or foot: {@code NP -> NP}. */
	FRONTIER,
	/** A terminal: {@code had -> had}. */
	TERMINAL,
	/** Reserved marker returned when there is nothing after the dot. */
	NO_RULE,
}
