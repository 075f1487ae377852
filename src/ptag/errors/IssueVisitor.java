package ptag.errors;

import ptag.passes.option.OptionParserIssue;
import ptag.passes.parse.GrammarFormatIssue;
import ptag.passes.parse.IOErrorIssue;
import ptag.passes.validation.MisplacedFootIssue;
import ptag.passes.validation.MissingFootIssue;
import ptag.passes.validation.MultipleFootIssue;
import ptag.passes.validation.UndefinedStartSymbolIssue;
import ptag.passes.validation.UnitTreeIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(GrammarFormatIssue grammarFormatIssue) throws E;
	public abstract T visit(UndefinedStartSymbolIssue undefinedStartSymbolIssue) throws E;
	public abstract T visit(MissingFootIssue missingFootIssue) throws E;
	public abstract T visit(MultipleFootIssue multipleFootIssue) throws E;
	public abstract T visit(MisplacedFootIssue misplacedFootIssue) throws E;
	public abstract T visit(UnitTreeIssue unitTreeIssue) throws E;
}
