package ptag.errors;

import ptag.PTagLoadException;
import ptag.Unreachable;
import ptag.formatters.IndentingWriter;
import ptag.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends PTagLoadException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
