package ptag.parser;

public class TreeParseException extends Exception {

	private static final long serialVersionUID = 6093152480217794501L;

	private final int offset;

	public TreeParseException(String message, int offset) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	public int getOffset() {
		return offset;
	}
}
