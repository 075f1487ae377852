package ptag;

public class PTagOptionException extends Exception {

	private static final long serialVersionUID = -2276455512398764390L;

	public PTagOptionException(String msg) {
		super(msg);
	}

}
