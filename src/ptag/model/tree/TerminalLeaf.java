package ptag.model.tree;

public class TerminalLeaf extends TreeNode {

	private final String terminal;

	public TerminalLeaf(String terminal) {
		this.terminal = terminal;
	}

	@Override
	public String getLabel() {
		return terminal;
	}

	@Override
	public int countLeaves() {
		return 1;
	}

	@Override
	public <T, E extends Throwable> T accept(TreeNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return terminal.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return terminal.equals(((TerminalLeaf) obj).terminal);
	}

}
