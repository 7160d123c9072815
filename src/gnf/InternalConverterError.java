package gnf;

public class InternalConverterError extends RuntimeException {
	public InternalConverterError() {
		super("internal converter error");
	}

	public InternalConverterError(String detail) {
		super("internal converter error: " + detail);
	}

	public InternalConverterError(Exception e) {
		super("internal converter error", e);
	}
}
