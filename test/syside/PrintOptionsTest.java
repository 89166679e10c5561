package syside;

import org.json.JSONObject;
import org.junit.Test;
import syside.options.FormatOptionException;
import syside.options.LanguageMode;
import syside.options.OperatorBreak;

import static org.junit.Assert.*;

public class PrintOptionsTest {

	@Test
	public void testEmpty() throws FormatOptionException {
		PrintOptions options = PrintOptions.fromJSON(LanguageMode.SYSML, new JSONObject());
		assertEquals(LanguageMode.SYSML, options.getMode());
		assertEquals(100, options.getConfig().getLineWidth());
		assertEquals(OperatorBreak.AFTER, options.getFormat().operatorBreak);
		assertFalse(options.isForceFormatting());
	}

	@Test
	public void testSections() throws FormatOptionException {
		JSONObject json = new JSONObject()
				.put("format", new JSONObject().put("operator_break", "before"))
				.put("printer", new JSONObject().put("lineWidth", 40).put("useSpaces", false));
		PrintOptions options = PrintOptions.fromJSON(LanguageMode.KERML, json);
		assertEquals(OperatorBreak.BEFORE, options.getFormat().operatorBreak);
		assertEquals(40, options.getConfig().getLineWidth());
		assertFalse(options.getConfig().useSpaces());
	}

	@Test(expected = FormatOptionException.class)
	public void testUnknownSection() throws FormatOptionException {
		PrintOptions.fromJSON(LanguageMode.SYSML, new JSONObject().put("style", new JSONObject()));
	}

	@Test(expected = FormatOptionException.class)
	public void testSectionMustBeObject() throws FormatOptionException {
		PrintOptions.fromJSON(LanguageMode.SYSML, new JSONObject().put("format", 3));
	}

	@Test(expected = FormatOptionException.class)
	public void testUnknownPrinterKey() throws FormatOptionException {
		PrintOptions.fromJSON(LanguageMode.SYSML, new JSONObject().put("printer", new JSONObject().put("width", 3)));
	}

	@Test(expected = FormatOptionException.class)
	public void testInvalidLineEnd() throws FormatOptionException {
		PrintOptions.fromJSON(LanguageMode.SYSML, new JSONObject().put("printer", new JSONObject().put("lineEnd", "\r")));
	}

	@Test
	public void testCopies() {
		PrintOptions options = new PrintOptions(LanguageMode.SYSML);
		PrintOptions narrow = options.withLineWidth(20).withForceFormatting(true);
		assertEquals(20, narrow.getConfig().getLineWidth());
		assertTrue(narrow.isForceFormatting());
		assertEquals(100, options.getConfig().getLineWidth());
	}
}
