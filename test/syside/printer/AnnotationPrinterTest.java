package syside.printer;

import org.json.JSONObject;
import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.model.Element;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import static org.junit.Assert.assertEquals;
import static syside.model.ModelBuilder.*;

public class AnnotationPrinterTest {

	private static String print(Element element, JSONObject format) throws FormatOptionException {
		PrintOptions options = new PrintOptions(LanguageMode.KERML).withFormat(FormatOptions.fromJSON(format));
		return new SysIDEFormatter(options).printElement(element);
	}

	private static String print(Element element) throws FormatOptionException {
		return print(element, new JSONObject());
	}

	@Test
	public void testCommentBody() throws FormatOptionException {
		assertEquals("/*\n * hello\n * world\n */", print(comment("hello\nworld")));
	}

	// empty body lines keep the star without a trailing space
	@Test
	public void testCommentEmptyLine() throws FormatOptionException {
		assertEquals("/*\n * a\n *\n * b\n */", print(comment("a\n\nb")));
	}

	@Test
	public void testCommentAbout() throws FormatOptionException {
		assertEquals("comment about A, B\n/*\n * note\n */", print(comment("note", "A", "B")));
	}

	@Test
	public void testCommentKeywordAlways() throws FormatOptionException {
		JSONObject format = new JSONObject().put("comment_keyword", "always");
		assertEquals("comment\n/*\n * c\n */", print(comment("c"), format));
	}

	@Test
	public void testDocumentation() throws FormatOptionException {
		assertEquals("doc\n/*\n * text\n */", print(doc("text")));
	}

	// documentation bodies follow the indentation of their owner
	@Test
	public void testNestedDocumentation() throws FormatOptionException {
		String expected = "package P {\n" +
				"    doc\n" +
				"    /*\n" +
				"     * text\n" +
				"     */\n" +
				"}";
		assertEquals(expected, print(pkg("P", member(doc("text")))));
	}
}
