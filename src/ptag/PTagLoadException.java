package ptag;

/**
 * Raised when a grammar, a grammar file or the command line could not be loaded.
 */
public class PTagLoadException extends PTagException {

	private static final long serialVersionUID = 4127740315562890131L;
	private static final String prefix = "Load Error";

	public PTagLoadException(String msg) {
		super(prefix, msg);
	}

}
