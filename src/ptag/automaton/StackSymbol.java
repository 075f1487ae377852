package ptag.automaton;

import ptag.compiler.TreeRuleRef;

import java.util.Optional;

/**
 * An entry of the automaton's stack set: a rule reference or a sentinel.
 */
public interface StackSymbol {

	Optional<TreeRuleRef> asTreeRule();

}
