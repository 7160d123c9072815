package gnf.trans;

import gnf.GnfException;

/**
 * Exception raised when a grammar cannot be brought into Greibach normal form
 *
 */
public class GnfTransException extends GnfException {

	private static final long serialVersionUID = 6630417218935530071L;
	private static final String prefix = "Conversion Error";

	public GnfTransException(String msg) {
		super(prefix, msg);
	}

}
