package syside.formatters;

import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.Assert.assertEquals;

public class IndentingWriterTest {

	@Test
	public void testIndentAppliesFromNextLine() throws IOException {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		out.write("a");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.write(" b\nc");
			try (IndentingWriter.Indent ignored2 = out.indent(3)) {
				out.newLine();
				out.write("d");
			}
			out.newLine();
			out.write("e");
		}
		out.write("\nf");
		assertEquals("a b\n  c\n     d\n  e\nf", sw.toString());
	}

	@Test
	public void testEmptyLinesStayEmpty() throws IOException {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw, 4);
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.write("\nx\n\ny");
		}
		assertEquals("\n    x\n\n    y", sw.toString());
	}

	@Test
	public void testIndentCloseIsIdempotent() {
		IndentingWriter out = new IndentingWriter(new StringWriter());
		IndentingWriter.Indent indent = out.indent();
		indent.close();
		indent.close();
		assertEquals(0, out.getIndentation());
	}

}
