package gocpp.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A {@link Writer} that prefixes every line it starts with the current amount of indentation. Lines are always
 * separated by '\n' so that generated C++ text and diagnostics look the same on every platform.
 */
public class IndentingWriter extends Writer {

	private static final char LF = '\n';

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
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
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public void unindent(int spaces) {
		if (spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for (int i = offset; i < offset + len; i++) {
			char c = chars[i];
			if (shouldIndent && c != LF) {
				for (int j = 0; j < indent; ++j) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			out.write(c);
			if (c == LF) {
				shouldIndent = true;
			}
		}
	}

}
