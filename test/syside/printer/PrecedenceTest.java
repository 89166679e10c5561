package syside.printer;

import org.junit.Test;
import syside.model.expression.Expression;
import syside.model.expression.Operator;
import syside.model.expression.OperatorExpression;

import static org.junit.Assert.*;
import static syside.model.ModelBuilder.*;
import static syside.model.expression.Operator.*;

public class PrecedenceTest {

	private static Expression lhs(OperatorExpression expr) {
		return expr.getArguments().get(0);
	}

	private static Expression rhs(OperatorExpression expr) {
		return expr.getArguments().get(1);
	}

	@Test
	public void testLevels() {
		assertEquals(Precedence.ADDITION, Precedence.of(op(PLUS, num(1), num(2))));
		assertEquals(Precedence.UNARY, Precedence.of(op(MINUS, num(1))));
		assertEquals(Precedence.OR, Precedence.of(op(BITWISE_OR, num(1), num(2))));
		assertEquals(Precedence.CLASSIFICATION, Precedence.of(op(HASTYPE, fref("x"), fref("T"))));
		assertEquals(Precedence.LITERAL, Precedence.of(num(1)));
		assertEquals(Precedence.NONE, Precedence.of(op(COMMA, num(1), num(2))));
		assertTrue(Precedence.OR.isLowerThan(Precedence.AND));
	}

	// feature chains take the precedence of the operator they wrap
	@Test
	public void testChainOperator() {
		assertNull(Precedence.operatorOf(fref("a")));
		assertEquals(Operator.DOT, Precedence.operatorOf(dot(fref("a"), "b")));
	}

	@Test
	public void testFlatten() {
		OperatorExpression sum = op(PLUS, op(MINUS, num(1), num(2)), num(3));
		assertTrue(Precedence.shouldFlatten(sum, lhs(sum)));

		OperatorExpression power = op(EXPONENT, op(EXPONENT, num(1), num(2)), num(3));
		assertFalse(Precedence.shouldFlatten(power, lhs(power)));

		OperatorExpression equality = op(EQUALS, op(EQUALS, num(1), num(2)), num(3));
		assertFalse(Precedence.shouldFlatten(equality, lhs(equality)));

		OperatorExpression product = op(MULTIPLY, op(DIVIDE, num(1), num(2)), num(3));
		assertFalse(Precedence.shouldFlatten(product, lhs(product)));

		OperatorExpression modulo = op(MODULO, op(MODULO, num(1), num(2)), num(3));
		assertFalse(Precedence.shouldFlatten(modulo, lhs(modulo)));
	}

	@Test
	public void testParenthesize() {
		OperatorExpression lower = op(MULTIPLY, op(PLUS, num(1), num(2)), num(3));
		assertTrue(Precedence.shouldParenthesize(lower, lhs(lower)));

		OperatorExpression higher = op(PLUS, num(1), op(MULTIPLY, num(2), num(3)));
		assertFalse(Precedence.shouldParenthesize(higher, rhs(higher)));

		OperatorExpression equal = op(MINUS, num(1), op(MINUS, num(2), num(3)));
		assertTrue(Precedence.shouldParenthesize(equal, rhs(equal)));

		OperatorExpression mixed = op(XOR, op(AND, num(1), num(2)), num(3));
		assertTrue(Precedence.shouldParenthesize(mixed, lhs(mixed)));

		OperatorExpression unary = op(MULTIPLY, num(1), op(NOT, num(2)));
		assertTrue(Precedence.shouldParenthesize(unary, rhs(unary)));

		OperatorExpression range = op(RANGE, op(PLUS, num(1), num(2)), num(3));
		assertTrue(Precedence.shouldParenthesize(range, lhs(range)));

		OperatorExpression comparison = op(LESS, op(PLUS, num(1), num(2)), num(3));
		assertFalse(Precedence.shouldParenthesize(comparison, lhs(comparison)));
	}
}
