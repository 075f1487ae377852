package ptag.automaton;

import ptag.compiler.TreeRuleRef;

import java.util.Optional;

public enum Sentinel implements StackSymbol {
	START("$0"),
	FINISH("$f");

	private final String symbol;

	Sentinel(String symbol) {
		this.symbol = symbol;
	}

	@Override
	public Optional<TreeRuleRef> asTreeRule() {
		return Optional.empty();
	}

	@Override
	public String toString() {
		return symbol;
	}
}
