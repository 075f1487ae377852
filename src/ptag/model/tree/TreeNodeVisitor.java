package ptag.model.tree;

public abstract class TreeNodeVisitor<T, E extends Throwable> {

	public abstract T visit(InternalNode internalNode) throws E;
	public abstract T visit(TerminalLeaf terminalLeaf) throws E;

}
