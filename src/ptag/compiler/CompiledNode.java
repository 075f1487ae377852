package ptag.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a compiled elementary tree: the node's rule (dot at 0) and the compiled children.
 */
public final class CompiledNode {

	private final DottedRule rule;
	private final List<CompiledNode> children;

	public CompiledNode(DottedRule rule, List<CompiledNode> children) {
		this.rule = rule;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public DottedRule getRule() {
		return rule;
	}

	public List<CompiledNode> getChildren() {
		return children;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CompiledNode that = (CompiledNode) o;
		return rule.equals(that.rule) && children.equals(that.children);
	}

	@Override
	public int hashCode() {
		return 31 * rule.hashCode() + children.hashCode();
	}
}
