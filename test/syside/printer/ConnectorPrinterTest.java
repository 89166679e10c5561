package syside.printer;

import org.json.JSONObject;
import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.errors.MissingMemberIssue;
import syside.model.ConnectorKind;
import syside.model.Element;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import static org.junit.Assert.assertEquals;
import static syside.model.ModelBuilder.*;

public class ConnectorPrinterTest {

	private static String print(LanguageMode mode, Element element, JSONObject format) throws FormatOptionException {
		format.put("empty_namespace_brackets", "never");
		PrintOptions options = new PrintOptions(mode).withFormat(FormatOptions.fromJSON(format));
		return new SysIDEFormatter(options).printElement(element);
	}

	private static String print(LanguageMode mode, Element element) throws FormatOptionException {
		return print(mode, element, new JSONObject());
	}

	@Test
	public void testBinaryConnector() throws FormatOptionException {
		assertEquals("connector from a to b;",
				print(LanguageMode.KERML, connector(ConnectorKind.CONNECTOR, "a", "b")));
	}

	@Test
	public void testBinaryConnectorWithoutFrom() throws FormatOptionException {
		JSONObject format = new JSONObject().put("binary_connectors_from_keyword", "as_needed");
		assertEquals("connector a to b;",
				print(LanguageMode.KERML, connector(ConnectorKind.CONNECTOR, "a", "b"), format));
	}

	// more than two ends are always listed in parentheses
	@Test
	public void testNaryConnector() throws FormatOptionException {
		assertEquals("connector (a, b, c);",
				print(LanguageMode.KERML, connector(ConnectorKind.CONNECTOR, "a", "b", "c")));
	}

	@Test
	public void testBinding() throws FormatOptionException {
		assertEquals("binding of x = y;", print(LanguageMode.KERML, connector(ConnectorKind.BINDING, "x", "y")));
	}

	@Test
	public void testConnectionUsage() throws FormatOptionException {
		assertEquals("connection connect a to b;",
				print(LanguageMode.SYSML, connector(ConnectorKind.CONNECTION, "a", "b")));
	}

	@Test
	public void testSuccessionKeywordAsNeeded() throws FormatOptionException {
		JSONObject format = new JSONObject().put("succession_as_usage_keyword", "as_needed");
		assertEquals("first a then b;", print(LanguageMode.SYSML, succession("a", "b"), format));
	}

	@Test(expected = MissingMemberIssue.class)
	public void testSingleEnd() throws FormatOptionException {
		print(LanguageMode.KERML, connector(ConnectorKind.CONNECTOR, "a"));
	}
}
