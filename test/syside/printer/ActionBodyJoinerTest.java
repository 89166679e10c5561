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

public class ActionBodyJoinerTest {

	private static String print(Element element) throws FormatOptionException {
		PrintOptions options = new PrintOptions(LanguageMode.SYSML)
				.withFormat(FormatOptions.fromJSON(new JSONObject().put("empty_namespace_brackets", "never")));
		return new SysIDEFormatter(options).printElement(element);
	}

	// successions after a decision are indented until the decision is closed by else
	@Test
	public void testNestedDecisions() throws FormatOptionException {
		Element action = body(usage(UsageKind.ACTION, "a1"),
				member(then()),
				member(decide(null)),
				member(then()),
				member(decide(null)),
				member(transition(bool(true), "m")),
				member(elseTransition("done")),
				member(then("done")),
				member(succession("x", "b")));

		String expected = "action a1 {\n" +
				"    then decide;\n" +
				"        then decide;\n" +
				"            if true then m;\n" +
				"            else done;\n" +
				"        then done;\n" +
				"    succession first x then b;\n" +
				"}";
		assertEquals(expected, print(action));
	}

	// a fork stays open until a regular succession
	@Test
	public void testForkBranches() throws FormatOptionException {
		Element action = body(usage(UsageKind.ACTION, "a2"),
				member(fork("f")),
				member(then("b1")),
				member(then("b2")),
				member(succession("b1", "j")));

		String expected = "action a2 {\n" +
				"    fork f;\n" +
				"        then b1;\n" +
				"        then b2;\n" +
				"    succession first b1 then j;\n" +
				"}";
		assertEquals(expected, print(action));
	}

	// a trailing bare then has nothing to bind to
	@Test
	public void testTrailingThen() throws FormatOptionException {
		Element action = body(usage(UsageKind.ACTION, "a3"),
				member(usage(UsageKind.ACTION, "b")),
				member(then()));

		assertEquals("action a3 {\n    action b;\n    then\n}", print(action));
	}
}
