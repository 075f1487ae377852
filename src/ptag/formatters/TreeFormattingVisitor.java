package ptag.formatters;

import ptag.model.tree.InternalNode;
import ptag.model.tree.TerminalLeaf;
import ptag.model.tree.TreeNode;
import ptag.model.tree.TreeNodeVisitor;

import java.io.IOException;

/**
 * Writes a tree in bracketed notation: {@code (S (NP (N I)) (VP ...))}. Frontier nodes
 * print as {@code (NP)}, terminals as bare atoms.
 */
public class TreeFormattingVisitor extends TreeNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public TreeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(InternalNode internalNode) throws IOException {
		out.write("(");
		out.write(internalNode.getLabel());
		for (TreeNode child : internalNode.getChildren()) {
			out.write(" ");
			child.accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TerminalLeaf terminalLeaf) throws IOException {
		out.write(terminalLeaf.getLabel());
		return null;
	}

}
