package syside.printer;

import org.json.JSONObject;
import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.model.Element;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;
import syside.options.LiteralRealFormat;

import static org.junit.Assert.assertEquals;
import static syside.model.ModelBuilder.*;
import static syside.model.expression.Operator.*;

public class ExpressionLayoutTest {

	private static String print(Element element, int width, JSONObject format) throws FormatOptionException {
		PrintOptions options = new PrintOptions(LanguageMode.SYSML)
				.withFormat(FormatOptions.fromJSON(format))
				.withLineWidth(width);
		return new SysIDEFormatter(options).printElement(element);
	}

	private static String print(Element element, int width) throws FormatOptionException {
		return print(element, width, new JSONObject());
	}

	// operators stay at the end of the broken line by default
	@Test
	public void testBreakAfterOperator() throws FormatOptionException {
		assertEquals("alpha +\nbeta", print(op(PLUS, fref("alpha"), fref("beta")), 10));
	}

	@Test
	public void testBreakBeforeOperator() throws FormatOptionException {
		JSONObject format = new JSONObject().put("operator_break", "before");
		assertEquals("alpha\n+ beta", print(op(PLUS, fref("alpha"), fref("beta")), 10, format));
	}

	// a sequence that does not fit puts every item on its own line with a trailing comma
	@Test
	public void testBrokenSequence() throws FormatOptionException {
		String expected = "(\n    alpha, beta,\n    gamma,\n)";
		assertEquals(expected, print(op(COMMA, fref("alpha"), op(COMMA, fref("beta"), fref("gamma"))), 16));
	}

	@Test
	public void testBrokenSequenceWithoutTrailingComma() throws FormatOptionException {
		JSONObject format = new JSONObject().put("sequence_expression_trailing_comma", false);
		String expected = "(\n    alpha, beta,\n    gamma\n)";
		assertEquals(expected, print(op(COMMA, fref("alpha"), op(COMMA, fref("beta"), fref("gamma"))), 16, format));
	}

	@Test
	public void testBrokenArguments() throws FormatOptionException {
		assertEquals("f(\n    alpha,\n    beta\n)", print(invoke("f", fref("alpha"), fref("beta")), 10));
	}

	@Test
	public void testFormatReal() {
		assertEquals("1.5", ExpressionPrinter.formatReal(1.5, LiteralRealFormat.NONE));
		assertEquals("100", ExpressionPrinter.formatReal(100.0, LiteralRealFormat.NONE));
		assertEquals("1e-7", ExpressionPrinter.formatReal(1e-7, LiteralRealFormat.NONE));
		assertEquals("1e+2", ExpressionPrinter.formatReal(100.0, LiteralRealFormat.EXP));
		assertEquals("-2.5e+0", ExpressionPrinter.formatReal(-2.5, LiteralRealFormat.EXP));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFormatNaN() {
		ExpressionPrinter.formatReal(Double.NaN, LiteralRealFormat.NONE);
	}
}
