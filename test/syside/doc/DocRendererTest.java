package syside.doc;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static syside.doc.DocBuilder.*;

public class DocRendererTest {

	private static String print(Doc doc, int width) {
		return DocRenderer.print(doc, PrinterConfig.defaults().withLineWidth(width));
	}

	// a group that fits on the remaining line is printed flat
	@Test
	public void testGroupFits() {
		assertEquals("a b\n", print(group(concat(text("a"), LINE, text("b"))), 80));
	}

	// a group that does not fit breaks every line directly inside it
	@Test
	public void testGroupBreaks() {
		assertEquals("a\nb\n", print(group(concat(text("a"), LINE, text("b"))), 2));
	}

	// the full width of the line is usable
	@Test
	public void testGroupFitsExactly() {
		Doc doc = group(concat(text("{"), indent(concat(LINE, text("x"))), LINE, text("}")));
		assertEquals("{ x }\n", print(doc, 5));
		assertEquals("{\n    x\n}\n", print(doc, 4));
	}

	@Test
	public void testSoftLine() {
		Doc doc = group(concat(text("("), indent(concat(SOFTLINE, text("x"))), SOFTLINE, text(")")));
		assertEquals("(x)\n", print(doc, 80));
		assertEquals("(\n    x\n)\n", print(doc, 2));
	}

	// a hard line breaks every enclosing group
	@Test
	public void testHardLineBreaksParent() {
		Doc doc = group(concat(text("a"), LINE, text("b"), HARDLINE, text("c")));
		assertEquals("a\nb\nc\n", print(doc, 80));
	}

	@Test
	public void testTrailingWhitespaceIsTrimmed() {
		assertEquals("a\nb\n", print(concat(text("a  "), HARDLINE, text("b")), 80));
	}

	@Test
	public void testFill() {
		Doc doc = fill(Arrays.asList(text("aaa"), LINE, text("bbb"), LINE, text("ccc")));
		assertEquals("aaa bbb\nccc\n", print(doc, 7));
		assertEquals("aaa bbb ccc\n", print(doc, 80));
	}

	@Test
	public void testIfBreak() {
		Doc doc = group(concat(text("["), SOFTLINE, text("x"), ifBreak(text(","), EMPTY), SOFTLINE, text("]")));
		assertEquals("[x]\n", print(doc, 80));
		assertEquals("[\nx,\n]\n", print(doc, 2));
	}

	// indentation follows the state of another group
	@Test
	public void testIndentIfBreak() {
		Doc doc = concat(
				group(concat(text("head"), LINE), "head"),
				indentIfBreak(concat(text("tail"), HARDLINE, text("end")), "head"));
		assertEquals("head tail\nend\n", print(doc, 80));
		assertEquals("head\ntail\n    end\n", print(doc, 4));
	}

	// literal lines continue at the indentation of the enclosing root
	@Test
	public void testLiteralLineWithRoot() {
		Doc body = concat(text("/*"), LITERALLINE, text(" */"));
		assertEquals("x\n    /*\n     */\n", print(concat(text("x"), indent(concat(HARDLINE, markAsRoot(body)))), 80));
		assertEquals("x\n    /*\n */\n", print(concat(text("x"), indent(concat(HARDLINE, body))), 80));
	}

	// line suffixes are flushed before the next line break
	@Test
	public void testLineSuffix() {
		Doc doc = concat(text("a"), lineSuffix(text(" // note")), text(";"), HARDLINE, text("b"));
		assertEquals("a; // note\nb\n", print(doc, 80));
	}

	@Test
	public void testTabs() {
		Doc doc = concat(text("{"), indent(concat(HARDLINE, text("x"))), HARDLINE, text("}"));
		assertEquals("{\n\tx\n}\n", DocRenderer.print(doc, PrinterConfig.defaults().withUseSpaces(false)));
		assertEquals("{\n  x\n}\n", DocRenderer.print(doc, PrinterConfig.defaults().withTabWidth(2)));
	}

	@Test
	public void testLineEndAndFinalNewline() {
		Doc doc = concat(text("a"), HARDLINE, text("b"));
		PrinterConfig config = PrinterConfig.defaults().withLineEnd("\r\n").withAddFinalNewline(false);
		assertEquals("a\r\nb", DocRenderer.print(doc, config));
	}

	// typed text is reported as semantic ranges when highlighting is enabled
	@Test
	public void testHighlighting() {
		Doc doc = concat(keyword("part"), SPACE, text("x", "variable"), SEMICOLON);
		PrintResult result = DocRenderer.render(doc, PrinterConfig.defaults().withHighlighting(true));
		assertEquals("part x;\n", result.getText());
		assertThat(result.getHighlighting(), is(Arrays.asList(
				new SemanticRange(0, 4, "keyword", Collections.<String>emptyList()),
				new SemanticRange(5, 6, "variable", Collections.<String>emptyList()))));
	}

	@Test
	public void testNoHighlightingByDefault() {
		PrintResult result = DocRenderer.render(keyword("part"), PrinterConfig.defaults());
		assertTrue(result.getHighlighting().isEmpty());
	}

	// docs dump as an indented tree
	@Test
	public void testToString() {
		Doc doc = group(concat(text("a"), LINE));
		assertEquals("group\n  concat\n    text \"a\"\n    line auto", doc.toString());
	}
}
