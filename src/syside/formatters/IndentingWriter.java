package syside.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * Writer for issue messages and {@link syside.doc.DocFormatter} dumps. Every line
 * after a line feed starts with the indentation active when its first character
 * is written, so an indent opened after {@link #newLine()} still applies.
 *
 * Only "\n" is treated as a line end, and empty lines get no indentation.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int step;
	private int depth = 0;
	private boolean atLineStart = false;

	/**
	 * Restores the previous indentation when closed.
	 */
	public static final class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int width;
		private boolean closed = false;

		private Indent(IndentingWriter writer, int width) {
			this.writer = writer;
			this.width = width;
		}

		@Override
		public void close() {
			if (!closed) {
				closed = true;
				writer.depth -= width;
			}
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 2);
	}

	public IndentingWriter(Writer out, int step) {
		if (step < 0) {
			throw new IllegalArgumentException("negative indent step " + step);
		}
		this.out = out;
		this.step = step;
	}

	public Indent indent() {
		return indent(step);
	}

	public Indent indent(int width) {
		depth += width;
		return new Indent(this, width);
	}

	public int getIndentation() {
		return depth;
	}

	public void newLine() throws IOException {
		write('\n');
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		int end = offset + len;
		int runStart = offset;
		for (int i = offset; i < end; i++) {
			if (atLineStart && chars[i] != '\n') {
				for (int n = 0; n < depth; n++) {
					out.write(' ');
				}
				atLineStart = false;
			}
			if (chars[i] == '\n') {
				out.write(chars, runStart, i + 1 - runStart);
				runStart = i + 1;
				atLineStart = true;
			} else if (i == end - 1 || chars[i + 1] == '\n') {
				out.write(chars, runStart, i + 1 - runStart);
				runStart = i + 1;
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
