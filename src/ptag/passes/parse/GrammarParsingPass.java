package ptag.passes.parse;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import ptag.errors.Issue;
import ptag.errors.IssueContext;
import ptag.model.grammar.GrammarException;
import ptag.model.grammar.TreeAdjoiningGrammar;
import ptag.model.tree.InternalNode;
import ptag.parser.BracketedTreeReader;
import ptag.parser.TreeParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loads a grammar from a JSON description:
 *
 * <pre>
 * {
 *   "start": "S",
 *   "initial": ["(S (NP) (VP (V had) (NP)))", "(NP (N I))"],
 *   "auxiliary": ["(NP (D a) (NP*))"]
 * }
 * </pre>
 *
 * Every problem is reported to the context, including the ones the grammar finds when it
 * validates its trees. The grammar is returned only if there were none.
 */
public class GrammarParsingPass {
	private GrammarParsingPass() {}

	public static TreeAdjoiningGrammar perform(IssueContext ctx, Path grammarFile) {
		String contents;
		try {
			contents = FileUtils.readFileToString(grammarFile.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return null;
		}
		return perform(ctx, grammarFile.toString(), contents);
	}

	public static TreeAdjoiningGrammar perform(IssueContext ctx, String source, String contents) {
		String startSymbol;
		List<String> initialTexts;
		List<String> auxiliaryTexts;
		try {
			JSONObject json = new JSONObject(contents);
			startSymbol = json.getString("start");
			initialTexts = strings(json.getJSONArray("initial"));
			JSONArray auxiliary = json.optJSONArray("auxiliary");
			auxiliaryTexts = auxiliary == null ? Collections.emptyList() : strings(auxiliary);
		} catch (JSONException e) {
			ctx.error(new GrammarFormatIssue(source, e.getMessage()));
			return null;
		}

		List<InternalNode> initialTrees = readTrees(ctx, source, "initial", initialTexts);
		List<InternalNode> auxiliaryTrees = readTrees(ctx, source, "auxiliary", auxiliaryTexts);
		if (ctx.hasErrors()) {
			return null;
		}

		try {
			return new TreeAdjoiningGrammar(startSymbol, initialTrees, auxiliaryTrees);
		} catch (GrammarException e) {
			for (Issue issue : e.getIssues()) {
				ctx.error(issue);
			}
			return null;
		}
	}

	private static List<String> strings(JSONArray array) {
		List<String> result = new ArrayList<>();
		for (int i = 0; i < array.length(); ++i) {
			result.add(array.getString(i));
		}
		return result;
	}

	private static List<InternalNode> readTrees(IssueContext ctx, String source, String section, List<String> texts) {
		List<InternalNode> trees = new ArrayList<>();
		for (int i = 0; i < texts.size(); ++i) {
			try {
				trees.add(BracketedTreeReader.read(texts.get(i)));
			} catch (TreeParseException e) {
				ctx.error(new GrammarFormatIssue(source, section + " tree #" + i + ": " + e.getMessage()));
			}
		}
		return trees;
	}
}
