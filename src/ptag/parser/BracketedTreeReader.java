package ptag.parser;

import ptag.model.tree.InternalNode;
import ptag.model.tree.TerminalLeaf;
import ptag.model.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads trees written in bracketed notation.
 *
 * <pre>
 *   tree  ::= '(' label child* ')'
 *   child ::= tree | atom
 * </pre>
 *
 * A tree without children is a frontier node, so {@code (NP)} is a substitution site and
 * {@code (NP*)} a foot. Atoms are terminals. Labels and atoms are runs of characters other than
 * whitespace and parentheses.
 */
public class BracketedTreeReader {

	private final String text;
	private int pos;

	private BracketedTreeReader(String text) {
		this.text = text;
		this.pos = 0;
	}

	public static InternalNode read(String text) throws TreeParseException {
		BracketedTreeReader reader = new BracketedTreeReader(text);
		reader.skipWhitespace();
		InternalNode tree = reader.readTree();
		reader.skipWhitespace();
		if (reader.pos != text.length()) {
			throw new TreeParseException("unexpected trailing input", reader.pos);
		}
		return tree;
	}

	private InternalNode readTree() throws TreeParseException {
		expect('(');
		skipWhitespace();
		String label = readAtom();
		List<TreeNode> children = new ArrayList<>();
		skipWhitespace();
		while (pos < text.length() && text.charAt(pos) != ')') {
			if (text.charAt(pos) == '(') {
				children.add(readTree());
			} else {
				children.add(new TerminalLeaf(readAtom()));
			}
			skipWhitespace();
		}
		expect(')');
		return new InternalNode(label, children);
	}

	private String readAtom() throws TreeParseException {
		int start = pos;
		while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
			++pos;
		}
		if (start == pos) {
			throw new TreeParseException("expected a label", pos);
		}
		return text.substring(start, pos);
	}

	private void expect(char c) throws TreeParseException {
		if (pos >= text.length()) {
			throw new TreeParseException("expected '" + c + "' but input ended", pos);
		}
		if (text.charAt(pos) != c) {
			throw new TreeParseException("expected '" + c + "' but found '" + text.charAt(pos) + "'", pos);
		}
		++pos;
	}

	private void skipWhitespace() {
		while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
			++pos;
		}
	}

	private static boolean isDelimiter(char c) {
		return c == '(' || c == ')' || Character.isWhitespace(c);
	}
}
