package syside.model.expression;

/**
 * Operators of {@link OperatorExpression}, including the implicit ones of feature
 * chains, selections and collections.
 */
public enum Operator {
	IF("if"),
	NULL_COALESCING("??"),
	IMPLIES("implies"),
	OR("or"),
	BITWISE_OR("|"),
	XOR("xor"),
	AND("and"),
	BITWISE_AND("&"),
	EQUALS("=="),
	NOT_EQUALS("!="),
	SAME("==="),
	NOT_SAME("!=="),
	ISTYPE("istype"),
	HASTYPE("hastype"),
	AT("@"),
	AT_AT("@@"),
	AS("as"),
	META("meta"),
	LESS("<"),
	GREATER(">"),
	LESS_EQUAL("<="),
	GREATER_EQUAL(">="),
	RANGE(".."),
	PLUS("+"),
	MINUS("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	MODULO("%"),
	EXPONENT("**"),
	POWER("^"),
	BITWISE_NOT("~"),
	NOT("not"),
	ALL("all"),
	INDEX("#"),
	BRACKET("["),
	SELECT(".?"),
	DOT("."),
	COLLECT("."),
	METADATA(".metadata"),
	COMMA(",");

	private final String symbol;

	Operator(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the text of the operator as it appears in source
	 */
	public String getSymbol() {
		return symbol;
	}
}
