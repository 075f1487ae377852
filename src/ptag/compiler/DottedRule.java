package ptag.compiler;

import ptag.model.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A context free production compiled from one node of an elementary tree, with a dot marking
 * how many right-hand symbols have been recognised.
 */
public final class DottedRule {

	private static final DottedRule NO_RULE = new DottedRule(RuleKind.NO_RULE, "NoRule",
			Collections.singletonList("NoRule"), 0);

	private final RuleKind kind;
	private final String lhs;
	private final List<String> rhs;
	private final int dotPosition;

	public DottedRule(RuleKind kind, String lhs, List<String> rhs, int dotPosition) {
		if (dotPosition < 0 || dotPosition > rhs.size()) {
			throw new IllegalArgumentException("dot position " + dotPosition + " outside of " + rhs);
		}
		this.kind = kind;
		this.lhs = lhs;
		this.rhs = Collections.unmodifiableList(new ArrayList<>(rhs));
		this.dotPosition = dotPosition;
	}

	public DottedRule(RuleKind kind, String lhs, List<String> rhs) {
		this(kind, lhs, rhs, 0);
	}

	public static DottedRule noRule() {
		return NO_RULE;
	}

	public RuleKind getKind() {
		return kind;
	}

	public String getLhs() {
		return lhs;
	}

	public List<String> getRhs() {
		return rhs;
	}

	public int getDotPosition() {
		return dotPosition;
	}

	public boolean isComplete() {
		return dotPosition == rhs.size();
	}

	public boolean isNoRule() {
		return kind == RuleKind.NO_RULE;
	}

	/**
	 * A frontier rule whose label carries the foot marker.
	 */
	public boolean isFoot() {
		return kind == RuleKind.FRONTIER && lhs.endsWith(TreeNode.FOOT_MARKER);
	}

	public DottedRule shift() {
		return new DottedRule(kind, lhs, rhs, dotPosition + 1);
	}

	/**
	 * @return a copy with the dot moved past the last right-hand symbol
	 */
	public DottedRule complete() {
		return new DottedRule(kind, lhs, rhs, rhs.size());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DottedRule that = (DottedRule) o;
		return dotPosition == that.dotPosition &&
				kind == that.kind &&
				lhs.equals(that.lhs) &&
				rhs.equals(that.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, lhs, rhs, dotPosition);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(lhs).append(" ->");
		for (int i = 0; i < rhs.size(); ++i) {
			if (i == dotPosition) {
				builder.append(" .");
			}
			builder.append(' ').append(rhs.get(i));
		}
		if (isComplete()) {
			builder.append(" .");
		}
		return builder.toString();
	}
}
