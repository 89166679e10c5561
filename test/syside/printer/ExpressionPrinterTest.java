package syside.printer;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.model.expression.Expression;
import syside.options.LanguageMode;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static syside.model.ModelBuilder.*;
import static syside.model.expression.Operator.*;

@RunWith(Parameterized.class)
public class ExpressionPrinterTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// literals
				{"42", num(42)},
				{"1.5", real(1.5)},
				{"true", bool(true)},
				{"\"a\\\"b\"", str("a\"b")},
				{"\"a</b\"", str("a</b")},
				{"\"tab\\tend\\\\\"", str("tab\tend\\")},
				{"*", inf()},
				{"null", nul()},
				{"a::b", fref("a::b")},

				// operands bind tighter than their parent
				{"1 + 2 * 3", op(PLUS, num(1), op(MULTIPLY, num(2), num(3)))},
				{"(1 + 2) * 3", op(MULTIPLY, op(PLUS, num(1), num(2)), num(3))},

				// left associative chains stay flat, right nested ones keep their parentheses
				{"1 - 2 - 3", op(MINUS, op(MINUS, num(1), num(2)), num(3))},
				{"1 - (2 - 3)", op(MINUS, num(1), op(MINUS, num(2), num(3)))},
				{"(a * b) % c", op(MODULO, op(MULTIPLY, fref("a"), fref("b")), fref("c"))},
				{"(a % b) * c", op(MULTIPLY, op(MODULO, fref("a"), fref("b")), fref("c"))},
				{"a * b * c", op(MULTIPLY, op(MULTIPLY, fref("a"), fref("b")), fref("c"))},
				{"(a == b) == c", op(EQUALS, op(EQUALS, fref("a"), fref("b")), fref("c"))},
				{"2**(3**4)", op(EXPONENT, num(2), op(EXPONENT, num(3), num(4)))},

				// `and` inside `or` is always parenthesized
				{"(a and b) or c", op(OR, op(AND, fref("a"), fref("b")), fref("c"))},
				{"a and b and c", op(AND, op(AND, fref("a"), fref("b")), fref("c"))},

				// unary operators
				{"-1", op(MINUS, num(1))},
				{"not (a or b)", op(NOT, op(OR, fref("a"), fref("b")))},
				{"not a or b", op(OR, op(NOT, fref("a")), fref("b"))},
				{"1 + (-2)", op(PLUS, num(1), op(MINUS, num(2)))},

				{"1..5", op(RANGE, num(1), num(5))},
				{"x istype T", op(ISTYPE, fref("x"), fref("T"))},
				{"a.b", dot(fref("a"), "b")},
				{"a.b.c", dot(dot(fref("a"), "b"), "c")},

				{"if a ? 1 else 2", op(IF, fref("a"), num(1), num(2))},
				{"if a ? 1 else if b ? 2 else 3", op(IF, fref("a"), num(1), op(IF, fref("b"), num(2), num(3)))},

				{"(1, 2, 3)", op(COMMA, num(1), op(COMMA, num(2), num(3)))},

				{"f(1, 2)", invoke("f", num(1), num(2))},
				{"f()", invoke("f")},
				{"xs->sum()", arrow(fref("xs"), "sum")},
				{"(a + b)->sum()", arrow(op(PLUS, fref("a"), fref("b")), "sum")},
		});
	}

	private final String expected;
	private final Expression expression;

	public ExpressionPrinterTest(String expected, Expression expression) {
		this.expected = expected;
		this.expression = expression;
	}

	@Test
	public void test() {
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.SYSML));
		assertThat(formatter.printElement(expression), is(expected));
	}
}
