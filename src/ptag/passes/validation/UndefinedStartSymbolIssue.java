package ptag.passes.validation;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;

public class UndefinedStartSymbolIssue extends Issue {

	private final String startSymbol;

	public UndefinedStartSymbolIssue(String startSymbol) {
		this.startSymbol = startSymbol;
	}

	public String getStartSymbol() {
		return startSymbol;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof UndefinedStartSymbolIssue
				&& startSymbol.equals(((UndefinedStartSymbolIssue) obj).startSymbol);
	}

	@Override
	public int hashCode() {
		return startSymbol.hashCode();
	}
}
