package gnf.formatters;

import java.io.IOException;
import java.io.Writer;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T param) throws IOException;
	}

	public static <T> void writeSeparated(Writer out, Iterable<T> items, String separator, Formatter<T> writer)
			throws IOException {
		boolean isFirst = true;
		for (T item : items) {
			if (!isFirst) {
				out.write(separator);
			}
			isFirst = false;
			writer.format(item);
		}
	}

}
