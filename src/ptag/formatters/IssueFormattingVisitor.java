package ptag.formatters;

import ptag.errors.IssueVisitor;
import ptag.model.grammar.TreeOrigin;
import ptag.passes.option.OptionParserIssue;
import ptag.passes.parse.GrammarFormatIssue;
import ptag.passes.parse.IOErrorIssue;
import ptag.passes.validation.MisplacedFootIssue;
import ptag.passes.validation.MissingFootIssue;
import ptag.passes.validation.MultipleFootIssue;
import ptag.passes.validation.UndefinedStartSymbolIssue;
import ptag.passes.validation.UnitTreeIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeTree(TreeOrigin origin, int index) throws IOException {
		out.write(origin == TreeOrigin.INITIAL ? "initial" : "auxiliary");
		out.write(" tree #");
		out.write(Integer.toString(index));
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(GrammarFormatIssue grammarFormatIssue) throws IOException {
		out.write("malformed grammar in ");
		out.write(grammarFormatIssue.getSource());
		out.write(": ");
		out.write(grammarFormatIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(UndefinedStartSymbolIssue undefinedStartSymbolIssue) throws IOException {
		out.write("no initial tree is rooted in the start symbol ");
		out.write(undefinedStartSymbolIssue.getStartSymbol());
		return null;
	}

	@Override
	public Void visit(MissingFootIssue missingFootIssue) throws IOException {
		writeTree(TreeOrigin.AUXILIARY, missingFootIssue.getIndex());
		out.write(" has no foot node; expected a frontier node ");
		out.write(missingFootIssue.getTree().getLabel());
		out.write("* in ");
		missingFootIssue.getTree().accept(new TreeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(MultipleFootIssue multipleFootIssue) throws IOException {
		writeTree(TreeOrigin.AUXILIARY, multipleFootIssue.getIndex());
		out.write(" has ");
		out.write(Integer.toString(multipleFootIssue.getFootCount()));
		out.write(" foot nodes: ");
		multipleFootIssue.getTree().accept(new TreeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(MisplacedFootIssue misplacedFootIssue) throws IOException {
		writeTree(misplacedFootIssue.getOrigin(), misplacedFootIssue.getIndex());
		out.write(" has a misplaced foot marker on ");
		out.write(misplacedFootIssue.getLabel());
		out.write(": ");
		misplacedFootIssue.getTree().accept(new TreeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(UnitTreeIssue unitTreeIssue) throws IOException {
		writeTree(unitTreeIssue.getOrigin(), unitTreeIssue.getIndex());
		out.write(" can be used without consuming input: ");
		unitTreeIssue.getTree().accept(new TreeFormattingVisitor(out));
		return null;
	}
}
