package ptag.model.grammar;

import ptag.PTagException;
import ptag.errors.Issue;
import ptag.errors.TopLevelIssueContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a set of elementary trees does not form a valid grammar.
 */
public class GrammarException extends PTagException {

	private static final long serialVersionUID = 8830519263571062764L;
	private static final String prefix = "Grammar Error";

	private final transient List<Issue> issues;

	public GrammarException(TopLevelIssueContext ctx) {
		super(prefix, ctx.format());
		this.issues = Collections.unmodifiableList(new ArrayList<>(ctx.getIssues()));
	}

	/**
	 * @return the problems found, in the order they were reported
	 */
	public List<Issue> getIssues() {
		return issues;
	}

}
