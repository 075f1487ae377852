package ptag.passes.parse;

import ptag.errors.Issue;
import ptag.errors.IssueVisitor;

/**
 * A grammar file that is not a well-formed grammar description.
 */
public class GrammarFormatIssue extends Issue {

	private final String source;
	private final String problem;

	public GrammarFormatIssue(String source, String problem) {
		this.source = source;
		this.problem = problem;
	}

	public String getSource() {
		return source;
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		GrammarFormatIssue other = (GrammarFormatIssue) obj;
		return source.equals(other.source) && problem.equals(other.problem);
	}

	@Override
	public int hashCode() {
		return 31 * source.hashCode() + problem.hashCode();
	}
}
