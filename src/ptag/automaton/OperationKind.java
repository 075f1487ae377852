package ptag.automaton;

public enum OperationKind {
	SUBSTITUTION("S"),
	ADJUNCTION("A");

	private final String code;

	OperationKind(String code) {
		this.code = code;
	}

	/**
	 * @return the one-letter code used in derivation traces
	 */
	public String getCode() {
		return code;
	}
}
