package gnf.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A Writer that prefixes every line it starts with the current indentation.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = true;

	public class Indent implements AutoCloseable {

		private final int spaces;

		private Indent(int spaces) {
			this.spaces = spaces;
		}

		@Override
		public void close() {
			unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	private void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(System.lineSeparator());
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for (int i = offset; i < offset + len; ++i) {
			char c = chars[i];
			if (atLineStart && c != '\n' && c != '\r') {
				for (int s = 0; s < indent; ++s) {
					out.write(' ');
				}
				atLineStart = false;
			}
			out.write(c);
			if (c == '\n') {
				atLineStart = true;
			}
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
