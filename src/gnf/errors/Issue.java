package gnf.errors;

import gnf.InternalConverterError;
import gnf.formatters.IndentingWriter;
import gnf.formatters.IssueFormattingVisitor;
import gnf.trans.GnfTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends GnfTransException {
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
			throw new InternalConverterError(e);
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
