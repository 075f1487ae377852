package ptag.automaton;

import java.util.List;

@FunctionalInterface
public interface Transition {

	List<ParserConfiguration> apply(ParserConfiguration configuration);

}
