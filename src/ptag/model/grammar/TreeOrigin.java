package ptag.model.grammar;

public enum TreeOrigin {
	INITIAL,
	AUXILIARY,
	/** Reserved for rule references that do not point into any tree. */
	NONE,
}
