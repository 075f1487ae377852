package ptag.passes.option;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	public String getDescription() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof OptionParserIssue && message.equals(((OptionParserIssue) obj).message);
	}

	@Override
	public int hashCode() {
		return message.hashCode();
	}
}
