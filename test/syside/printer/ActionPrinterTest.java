package syside.printer;

import org.json.JSONObject;
import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.model.Element;
import syside.model.UsageKind;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import static org.junit.Assert.assertEquals;
import static syside.model.ModelBuilder.*;

public class ActionPrinterTest {
	private static final String LONG_TARGET = "abcdefghijabcdefghijabcdefghijabcdefghij";

	private static String print(Element element, int width) throws FormatOptionException {
		PrintOptions options = new PrintOptions(LanguageMode.SYSML)
				.withFormat(FormatOptions.fromJSON(new JSONObject().put("empty_namespace_brackets", "never")))
				.withLineWidth(width);
		return new SysIDEFormatter(options).printElement(element);
	}

	@Test
	public void testAssignment() throws FormatOptionException {
		assertEquals("assign x := 42;", print(assign(ref("x"), num(42)), 80));
	}

	// a long target stays whole and the value moves after :=
	@Test
	public void testLongAssignmentTarget() throws FormatOptionException {
		Element action = body(usage(UsageKind.ACTION, "a"), member(assign(ref(LONG_TARGET), num(42))));
		String expected = "action a {\n" +
				"    assign " + LONG_TARGET + " :=\n" +
				"        42;\n" +
				"}";
		assertEquals(expected, print(action, 50));
	}

	@Test
	public void testControlNodes() throws FormatOptionException {
		assertEquals("decide;", print(decide(null), 80));
		assertEquals("fork f;", print(fork("f"), 80));
	}
}
