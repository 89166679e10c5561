package syside.util;

import syside.Unreachable;
import syside.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A range in a source document. Offsets are character offsets into the document
 * text, lines and columns are 0-based.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final String uri;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(String uri, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.uri = uri;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	/**
	 * Computes the line and column information for [startOffset, endOffset) in text.
	 */
	public static SourceLocation fromOffsets(String uri, String text, int startOffset, int endOffset) {
		int line = 0;
		int column = 0;
		int startLine = 0, startColumn = 0;
		for (int pos = 0; pos < endOffset && pos < text.length(); pos++) {
			if (pos == startOffset) {
				startLine = line;
				startColumn = column;
			}
			if (text.charAt(pos) == '\n') {
				line++;
				column = 0;
			} else {
				column++;
			}
		}
		if (startOffset >= endOffset) {
			startLine = line;
			startColumn = column;
		}
		return new SourceLocation(uri, startOffset, endOffset, startLine, line, startColumn, column);
	}

	public String prettyString(String text) {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw), text);
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out, String text) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at ");
			if (startLine != endLine) {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn);
			} else if (startColumn != endColumn) {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn);
			} else {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1));
			}
			if (uri != null) {
				out.write(" in " + uri);
			}
			if (text == null || startOffset > text.length()) {
				return;
			}
			out.newLine();
			int lineStart = text.lastIndexOf('\n', Math.max(0, startOffset - 1)) + 1;
			if (startOffset == 0) {
				lineStart = 0;
			}
			int lineEnd = text.indexOf('\n', startOffset);
			if (lineEnd == -1) {
				lineEnd = text.length();
			}
			out.append(text, lineStart, lineEnd);
			out.newLine();
			for (int pos = lineStart; pos < startOffset; pos++) {
				out.append(' ');
			}
			int effectiveEndOffset = startOffset == endOffset ? endOffset + 1 : endOffset;
			for (int pos = startOffset; pos < lineEnd && pos < effectiveEndOffset; pos++) {
				out.append('^');
			}
			if (startOffset == text.length()) {
				out.append("^ EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	public boolean contains(int offset) {
		return !isUnknown() && startOffset <= offset && offset <= endOffset;
	}

	/**
	 * True if either range has an endpoint strictly inside the other one.
	 */
	public boolean intersects(SourceLocation other) {
		if (isUnknown() || other.isUnknown()) {
			return false;
		}
		return overlaps(this, other) || overlaps(other, this);
	}

	private static boolean overlaps(SourceLocation a, SourceLocation b) {
		return (a.startOffset > b.startOffset && a.startOffset < b.endOffset) ||
				(a.endOffset < b.endOffset && a.endOffset > b.startOffset);
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (!Objects.equals(uri, other.getUri())) {
			throw new RuntimeException("Tried to combine source locations from two different documents: " + uri + ", " + other.getUri());
		}
		SourceLocation first = startOffset <= other.startOffset ? this : other;
		SourceLocation last = endOffset >= other.endOffset ? this : other;
		return new SourceLocation(uri, first.startOffset, last.endOffset, first.startLine, last.endLine,
				first.startColumn, last.endColumn);
	}

	public String getUri() {
		return uri;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(uri, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(uri, other.uri);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [uri=" + uri + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStart = Integer.compare(getStartOffset(), o.getStartOffset());
		if (comparedStart != 0) {
			return comparedStart;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
