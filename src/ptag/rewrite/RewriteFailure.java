package ptag.rewrite;

import ptag.model.tree.TreePath;

import java.util.Objects;

/**
 * Why a substitution or adjunction could not be carried out.
 */
public class RewriteFailure {

	public enum Kind {
		/** The position is empty, does not start at the root marker 0, or has a non-positive index. */
		MALFORMED_POSITION,
		/** The position does not resolve to a node that can be rewritten. */
		BAD_POSITION,
		/** The position runs into a terminal. */
		BAD_TREE,
		/** The node at the position does not carry the required label. */
		LABEL_MISMATCH,
		/** The auxiliary tree has no foot node. */
		MISSING_FOOT,
	}

	private final Kind kind;
	private final TreePath position;
	private final String detail;

	public RewriteFailure(Kind kind, TreePath position, String detail) {
		this.kind = kind;
		this.position = position;
		this.detail = detail;
	}

	public Kind getKind() {
		return kind;
	}

	public TreePath getPosition() {
		return position;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RewriteFailure that = (RewriteFailure) o;
		return kind == that.kind &&
				Objects.equals(position, that.position) &&
				Objects.equals(detail, that.detail);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, position, detail);
	}

	@Override
	public String toString() {
		return kind + " at " + position + ": " + detail;
	}
}
