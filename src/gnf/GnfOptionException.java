package gnf;

public class GnfOptionException extends Exception {

	private static final long serialVersionUID = 4207312964810349166L;

	public GnfOptionException(String msg) {
		super(msg);
	}

}
