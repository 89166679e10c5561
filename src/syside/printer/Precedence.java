package syside.printer;

import syside.model.Element;
import syside.model.expression.FeatureReferenceExpression;
import syside.model.expression.MetadataAccessExpression;
import syside.model.expression.Operator;
import syside.model.expression.OperatorExpression;

/**
 * Binding strength of expression operators, later constants bind tighter.
 */
public enum Precedence {
	NONE,
	IF,
	NULL_COALESCING,
	IMPLIES,
	OR,
	XOR,
	AND,
	EQUALITY,
	CLASSIFICATION,
	COMPARISON,
	RANGE,
	ADDITION,
	MULTIPLICATION,
	EXPONENTIATION,
	UNARY,
	ALL,
	ACCESS,
	LITERAL;

	public boolean isLowerThan(Precedence other) {
		return compareTo(other) < 0;
	}

	/**
	 * @return the operator of expression, including the implicit operators of
	 * feature chains and metadata access, or null for operands without one
	 */
	public static Operator operatorOf(Element expression) {
		if (expression instanceof OperatorExpression) {
			return ((OperatorExpression) expression).getOperator();
		}
		if (expression instanceof FeatureReferenceExpression) {
			Element target = ((FeatureReferenceExpression) expression).getTarget();
			return target instanceof OperatorExpression ? ((OperatorExpression) target).getOperator() : null;
		}
		if (expression instanceof MetadataAccessExpression) {
			Element owner = expression.getOwner();
			if (owner instanceof OperatorExpression) {
				Operator op = ((OperatorExpression) owner).getOperator();
				// `@@` and `meta` take metadata access without `.metadata`
				if (op == Operator.AT_AT || op == Operator.META) {
					return null;
				}
			}
			return Operator.METADATA;
		}
		return null;
	}

	public static Precedence of(Element expression) {
		Operator op = operatorOf(expression);
		if (op == null) {
			return LITERAL;
		}
		switch (op) {
			case IF:
				return IF;
			case NULL_COALESCING:
				return NULL_COALESCING;
			case IMPLIES:
				return IMPLIES;
			case OR:
			case BITWISE_OR:
				return OR;
			case XOR:
				return XOR;
			case AND:
			case BITWISE_AND:
				return AND;
			case EQUALS:
			case NOT_EQUALS:
			case SAME:
			case NOT_SAME:
				return EQUALITY;
			case ISTYPE:
			case HASTYPE:
			case AT:
			case AT_AT:
			case AS:
			case META:
				return CLASSIFICATION;
			case LESS:
			case GREATER:
			case LESS_EQUAL:
			case GREATER_EQUAL:
				return COMPARISON;
			case RANGE:
				return RANGE;
			case PLUS:
			case MINUS:
				return isUnary(expression) ? UNARY : ADDITION;
			case MULTIPLY:
			case DIVIDE:
			case MODULO:
				return MULTIPLICATION;
			case EXPONENT:
			case POWER:
				return EXPONENTIATION;
			case BITWISE_NOT:
			case NOT:
				return UNARY;
			case ALL:
				return ALL;
			case INDEX:
			case BRACKET:
			case SELECT:
			case DOT:
			case COLLECT:
			case METADATA:
				return ACCESS;
			case COMMA:
				return NONE;
			default:
				throw new syside.Unreachable();
		}
	}

	private static boolean isUnary(Element expression) {
		return expression instanceof OperatorExpression && ((OperatorExpression) expression).isUnary();
	}

	/**
	 * @return true if lhs of parent binds the same way as parent and can be
	 * printed at the same level
	 */
	public static boolean shouldFlatten(Element parent, Element lhs) {
		Precedence parentPrec = of(parent);
		if (parentPrec != of(lhs)) {
			return false;
		}
		// right associative
		if (parentPrec == EXPONENTIATION) {
			return false;
		}
		// a == b == c -> (a == b) == c
		if (parentPrec == EQUALITY) {
			return false;
		}
		Operator parentOp = operatorOf(parent);
		if (parentPrec == MULTIPLICATION && (parentOp == Operator.MODULO || parentOp != operatorOf(lhs))) {
			return false;
		}
		return true;
	}

	/**
	 * Operands of equal precedence are parenthesized since expressions parse
	 * left associative.
	 */
	public static boolean shouldParenthesize(Element parent, Element operand) {
		Precedence parentPrec = of(parent);
		Precedence operandPrec = of(operand);
		if (operandPrec.compareTo(parentPrec) <= 0) {
			return true;
		}
		if (operandPrec == AND) {
			// `and` inside `or` and `xor` reads ambiguously
			return parentPrec == OR || parentPrec == XOR;
		}
		if (operandPrec == UNARY || operandPrec == ALL) {
			return parentPrec == RANGE || parentPrec == ADDITION || parentPrec == EXPONENTIATION ||
					parentPrec == MULTIPLICATION;
		}
		if (parentPrec == RANGE) {
			return operandPrec == ADDITION || operandPrec == EXPONENTIATION || operandPrec == MULTIPLICATION;
		}
		return false;
	}
}
