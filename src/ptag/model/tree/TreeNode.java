package ptag.model.tree;

import ptag.Unreachable;
import ptag.formatters.IndentingWriter;
import ptag.formatters.TreeFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A node of an elementary or derived tree: either an {@link InternalNode} carrying a
 * nonterminal label, or a {@link TerminalLeaf}.
 */
public abstract class TreeNode {

	public static final String FOOT_MARKER = "*";

	/**
	 * @return the nonterminal label of an internal node, or the symbol of a terminal leaf
	 */
	public abstract String getLabel();

	/**
	 * @return the number of frontier nodes and terminals under this node
	 */
	public abstract int countLeaves();

	public abstract <T, E extends Throwable> T accept(TreeNodeVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	/**
	 * Strips a trailing foot marker, if any.
	 */
	public static String unmarked(String label) {
		if (label.endsWith(FOOT_MARKER)) {
			return label.substring(0, label.length() - FOOT_MARKER.length());
		}
		return label;
	}

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new TreeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
