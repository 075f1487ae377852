package ptag.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import ptag.Unreachable;
import ptag.formatters.IndentingWriter;
import ptag.formatters.IssueFormattingVisitor;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public List<Issue> getIssues() {
		return errors;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Issue e : errors) {
				out.newLine();
				e.accept(new IssueFormattingVisitor(out));
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
