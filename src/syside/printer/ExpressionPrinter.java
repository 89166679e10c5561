package syside.printer;

import syside.doc.Doc;
import syside.model.Element;
import syside.model.Feature;
import syside.model.Reference;
import syside.model.expression.*;
import syside.options.LiteralRealFormat;
import syside.options.NullExpressionFormat;
import syside.options.OperatorBreak;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static syside.doc.DocBuilder.*;

/**
 * Expressions. Operands are parenthesized by comparing {@link Precedence}s, and
 * left operands binding the same way as their parent are printed at the level
 * of the parent so that a chain of operators breaks as one block.
 */
public class ExpressionPrinter {
	private static final String OPERATOR = "operator";

	private final ModelPrinter printer;
	private final PrintContext ctx;

	// group ids of enclosing argument lists and sequences
	private final Map<Element, String> argumentLists = new IdentityHashMap<>();
	private final Map<Element, String> sequences = new IdentityHashMap<>();

	public ExpressionPrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	private static Doc operator(String symbol) {
		return text(symbol, OPERATOR);
	}

	private static Doc paren(Doc doc, boolean condition) {
		return condition ? parens(doc) : doc;
	}

	private static Doc bracketed(String open, Doc contents, String close) {
		return group(concat(text(open), indent(SOFTLINE, contents), SOFTLINE, text(close)));
	}

	// operators

	public Doc printOperatorExpression(OperatorExpression expr) {
		Operator op = expr.getOperator();
		switch (op) {
			case IF:
				return printConditional(expr, false);
			case BITWISE_NOT:
			case NOT:
			case ALL:
				return printUnary(expr);
			case PLUS:
			case MINUS:
				if (expr.isUnary()) {
					return printUnary(expr);
				}
				return group(concat(printBinaryish(expr)));
			case DOT: {
				List<Doc> contents = printBinaryish(expr);
				if (Precedence.operatorOf(expr.getOwner()) != Operator.DOT) {
					return fill(contents);
				}
				return group(concat(contents));
			}
			case COMMA: {
				if (Precedence.operatorOf(expr.getOwner()) == Operator.COMMA) {
					// nested sequences continue the sequence of their owner
					return concat(printBinaryish(expr));
				}
				String id = ctx.groupId("sequence-expr");
				sequences.put(expr, id);
				List<Doc> contents = printBinaryish(expr);
				return group(concat(text("("), indent(SOFTLINE, fill(contents)), SOFTLINE, text(")")), id);
			}
			default:
				return group(concat(printBinaryish(expr)));
		}
	}

	private String sequenceId(Element expr) {
		Element outer = expr;
		while (Precedence.operatorOf(outer.getOwner()) == Operator.COMMA) {
			outer = outer.getOwner();
		}
		return sequences.get(outer);
	}

	private static Expression argument(OperatorExpression expr, int index) {
		List<Expression> args = expr.getArguments();
		return ModelPrinter.required(expr, index < args.size() ? args.get(index) : null,
				index == 0 ? "left operand" : "right operand");
	}

	/**
	 * Operands without notes are spread into the parts of their parent so that
	 * fills see every operand.
	 */
	private static boolean canSpread(Element operand) {
		return operand instanceof OperatorExpression && ((OperatorExpression) operand).getArguments().size() == 2 &&
				operand.getNotes().isEmpty();
	}

	private List<Doc> printBinaryish(OperatorExpression expr) {
		Expression lhs = argument(expr, 0);
		Expression rhs = argument(expr, 1);
		Operator op = expr.getOperator();

		boolean flatten = lhs instanceof OperatorExpression &&
				((OperatorExpression) lhs).getArguments().size() == 2 &&
				Precedence.shouldFlatten(expr, lhs);
		List<Doc> parts = new ArrayList<>();
		boolean hasLhs = true;
		if (flatten) {
			if (canSpread(lhs)) {
				parts.addAll(printBinaryish((OperatorExpression) lhs));
			} else {
				parts.add(printer.print((OperatorExpression) lhs, null,
						(e, previous) -> concat(printBinaryish(e))));
			}
		} else {
			Doc left = printer.print(lhs);
			hasLhs = !isEmpty(left);
			parts.add(paren(left, Precedence.operatorOf(lhs) != Operator.COMMA &&
					Precedence.shouldParenthesize(expr, lhs)));
		}

		if (op == Operator.COMMA && Precedence.operatorOf(rhs) == Operator.COMMA && canSpread(rhs)) {
			parts.add(EMPTY);
			parts.add(COMMA);
			parts.add(LINE);
			parts.addAll(printBinaryish((OperatorExpression) rhs));
			return parts;
		}

		Doc right = printer.print(rhs);
		parts.addAll(printBinaryRhs(op, right, Precedence.shouldParenthesize(expr, rhs), hasLhs));

		if (ctx.getFormat().sequenceExpressionTrailingComma && op == Operator.COMMA &&
				Precedence.operatorOf(rhs) != Operator.COMMA) {
			parts.add(EMPTY);
			parts.add(ifBreak(COMMA, EMPTY, sequenceId(expr)));
		}
		return parts;
	}

	private List<Doc> printBinaryRhs(Operator op, Doc right, boolean parens, boolean hasLhs) {
		Doc before;
		Doc after;
		boolean shouldIndent = false;
		switch (op) {
			case ISTYPE:
			case HASTYPE:
			case AT:
			case AT_AT:
			case AS:
			case META:
				// a self reference prints nothing, e.g. `istype T`
				before = hasLhs ? SPACE : EMPTY;
				after = LINE;
				break;
			case RANGE:
			case EXPONENT:
			case POWER:
				before = EMPTY;
				after = SOFTLINE;
				shouldIndent = ctx.getFormat().operatorBreak == OperatorBreak.BEFORE;
				break;
			case INDEX:
				return listOf(EMPTY, group(concat(operator("#"), text("("), indent(SOFTLINE, right), SOFTLINE,
						text(")"))));
			case BRACKET:
				return listOf(SPACE, bracketed("[", right, "]"));
			case COMMA:
				return listOf(EMPTY, COMMA, LINE, right);
			case DOT:
				return listOf(indent(SOFTLINE, operator("."), right));
			case COLLECT:
				return listOf(operator("."), right);
			case SELECT:
				return listOf(operator(".?"), right);
			case IF:
			case BITWISE_NOT:
			case NOT:
			case ALL:
			case METADATA:
				throw new syside.Unreachable();
			default:
				before = SPACE;
				after = LINE;
		}

		if (ctx.getFormat().operatorBreak == OperatorBreak.BEFORE) {
			Doc swap = before;
			before = after;
			after = swap;
		}
		Doc contents = concat(before, operator(op.getSymbol()), after, paren(right, parens));
		if (shouldIndent) {
			return listOf(EMPTY, indent(contents));
		}
		return listOf(contents);
	}

	private static List<Doc> listOf(Doc... docs) {
		List<Doc> list = new ArrayList<>();
		Collections.addAll(list, docs);
		return list;
	}

	private Doc printUnary(OperatorExpression expr) {
		Operator op = expr.getOperator();
		Expression arg = argument(expr, 0);
		boolean space = op == Operator.NOT || op == Operator.ALL;
		return concat(
				operator(op.getSymbol()),
				space ? SPACE : EMPTY,
				paren(printer.print(arg), Precedence.of(arg).isLowerThan(Precedence.UNARY) &&
						Precedence.operatorOf(arg) != Operator.COMMA));
	}

	private Doc printConditional(OperatorExpression expr, boolean nested) {
		List<Expression> args = expr.getArguments();
		Expression test = argument(expr, 0);
		Expression then = argument(expr, 1);
		Expression otherwise = ModelPrinter.required(expr, args.size() > 2 ? args.get(2) : null, "else branch");

		boolean chain = otherwise instanceof OperatorExpression &&
				((OperatorExpression) otherwise).getOperator() == Operator.IF;
		Doc printedElse = chain
				? printer.print((OperatorExpression) otherwise, null, (e, previous) -> printConditional(e, true))
				: printer.print(otherwise);

		Doc branches = concat(
				LINE,
				// align nested branches
				ifBreak(text("?    "), text("? ")),
				indent(printer.print(then)),
				LINE,
				text("else "),
				chain ? printedElse : indent(printedElse));

		Doc printedTest = printer.print(test);
		Doc condition = group(concat(
				operator("if"),
				SPACE,
				Precedence.operatorOf(test) == Operator.IF
						? bracketed("(", printedTest, ")")
						: indent(printedTest)));

		if (nested) {
			return concat(condition, branches);
		}
		return group(concat(condition, indent(branches)));
	}

	/**
	 * Prefixes an expression with assignment-like tokens, e.g. {@code := value}.
	 * Expressions that break well on their own stay on the line of the prefix.
	 *
	 * @param doc the printed expression, or null to print node
	 */
	public Doc printAssignmentExpression(List<Doc> prefix, Element node, Doc doc) {
		Doc target = doc != null ? doc : printer.print(node);
		if (prefix.isEmpty()) {
			return target;
		}

		List<Doc> parts = new ArrayList<>(prefix);
		Operator op = Precedence.operatorOf(node);
		if (node instanceof InvocationExpression ||
				(Precedence.of(node) == Precedence.ACCESS && op != Operator.DOT && op != Operator.METADATA) ||
				op == Operator.COMMA) {
			String id = ctx.groupId("assignment-expr");
			parts.add(group(indent(LINE), id));
			parts.add(LINE_SUFFIX_BOUNDARY);
			parts.add(indentIfBreak(group(target), id));
			return group(concat(parts));
		}

		parts.add(indent(LINE, group(target)));
		return group(concat(parts));
	}

	public Doc printAssignmentExpression(List<Doc> prefix, Element node) {
		return printAssignmentExpression(prefix, node, null);
	}

	// references and invocations

	public Doc printFeatureReference(FeatureReferenceExpression expr) {
		Element target = expr.getTarget();
		// self references print nothing
		if (target == null) {
			return EMPTY;
		}
		return printer.print(target);
	}

	public Doc printMetadataAccess(MetadataAccessExpression expr) {
		Reference reference = ModelPrinter.required(expr, expr.getReference(), "reference");
		Doc target = printer.print(reference);
		if (Precedence.operatorOf(expr) == null) {
			return target;
		}
		return group(concat(target, indent(SOFTLINE, operator(".metadata"))));
	}

	public Doc printInvocation(InvocationExpression expr) {
		if (expr.isArrow()) {
			return printArrow(expr);
		}
		String id = ctx.groupId("arg-list");
		argumentLists.put(expr, id);
		return concat(printer.print(expr.getFunction()), printArgumentList(expr, id));
	}

	private Doc printArgumentList(InvocationExpression expr, String id) {
		List<Doc> args = printer.printAll(expr.getArguments(), null);
		return group(concat(
				text("("),
				indent(SOFTLINE, join(concat(COMMA, LINE), args)),
				SOFTLINE,
				text(")")), id);
	}

	private Doc printArrow(InvocationExpression expr) {
		Expression target = expr.getTarget();
		Doc printedTarget = paren(printer.print(target),
				Precedence.of(target).isLowerThan(Precedence.ACCESS) &&
						Precedence.operatorOf(target) != Operator.COMMA);
		Doc function = indent(operator("->"), printer.print(expr.getFunction()));

		if (expr.getBody() != null) {
			return group(concat(printedTarget, function, SPACE, printer.print(expr.getBody())));
		}
		if (expr.getFunctionReference() != null) {
			return fill(printedTarget, SOFTLINE, function, indent(LINE),
					indent(printer.print(expr.getFunctionReference())));
		}

		String id = ctx.groupId("arg-list");
		argumentLists.put(expr, id);
		return concat(printedTarget, function, printArgumentList(expr, id));
	}

	public Doc printArgument(Argument arg) {
		Expression value = ModelPrinter.required(arg, arg.getValue(), "value");
		Doc rhs = printer.print(value);
		if (!arg.isNamed()) {
			return rhs;
		}

		String listId = argumentLists.get(arg.getOwner());
		String id = ctx.groupId("assignment");
		Doc space = ifBreak(SPACE, EMPTY, listId);
		if (Precedence.operatorOf(value) != Operator.COMMA) {
			rhs = indentIfBreak(concat(ifBreak(LINE, EMPTY, listId), rhs), id);
		} else {
			rhs = concat(space, rhs);
		}
		return group(concat(printer.print(arg.getParameter()), space, text("="), rhs), id);
	}

	/**
	 * {@code { in x; x > 0 }} as the argument of arrow invocations.
	 */
	public Doc printBodyExpression(BodyExpression body) {
		return group(printer.namespaces().printChildrenBlock(body, body.getMembers(), new BlockOptions()
				.result(body.getResult())
				.forceEmptyBrackets(true)));
	}

	/**
	 * Parameters of body expressions, e.g. {@code in x}.
	 */
	public Doc printBodyParameter(Feature parameter) {
		NamespacePrinter namespaces = printer.namespaces();
		return namespaces.printGenericFeature(namespaces.kermlFeatureModifiers(parameter), null, parameter,
				new DeclarationOptions());
	}

	public Doc printTrigger(TriggerInvocationExpression expr) {
		ctx.assertSysML(expr);
		Expression argument = ModelPrinter.required(expr, expr.getArgument(), "argument");
		return printAssignmentExpression(Collections.<Doc>singletonList(keyword(expr.getKind().getKeyword())),
				argument);
	}

	// literals

	public Doc printLiteral(String value, String type) {
		return text(value, type);
	}

	public Doc printString(LiteralString literal) {
		return text(quote(literal.getValue()), "string");
	}

	/**
	 * Double quotes a string value, escaping only what a string literal cannot
	 * hold as is. Other characters, "/" included, are written unchanged.
	 */
	static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2);
		sb.append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"':
					sb.append("\\\"");
					break;
				case '\\':
					sb.append("\\\\");
					break;
				case '\b':
					sb.append("\\b");
					break;
				case '\t':
					sb.append("\\t");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\f':
					sb.append("\\f");
					break;
				case '\r':
					sb.append("\\r");
					break;
				default:
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		return sb.append('"').toString();
	}

	public Doc printNumber(LiteralNumber literal) {
		String written = writtenNumber(literal);
		if (written != null) {
			return text(written, "number");
		}
		if (literal.isInteger()) {
			return text(BigDecimal.valueOf(literal.getValue()).toBigInteger().toString(), "number");
		}
		return text(formatReal(literal.getValue(), ctx.getFormat().literalReal), "number");
	}

	/**
	 * @return the source text of literal if its value did not change
	 */
	private static String writtenNumber(LiteralNumber literal) {
		if (literal.getCst() == null) {
			return null;
		}
		String text = literal.getCst().getText().trim();
		// sequences may parse the comma as part of the literal
		if (text.endsWith(",")) {
			text = text.substring(0, text.length() - 1).trim();
		}
		try {
			return Double.parseDouble(text) == literal.getValue() ? text : null;
		} catch (NumberFormatException e) {
			return null;
		}
	}

	static String formatReal(double value, LiteralRealFormat format) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("Cannot print real literal " + value);
		}
		BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
		if (format == LiteralRealFormat.EXP) {
			return exponential(decimal);
		}
		double magnitude = Math.abs(value);
		if (magnitude != 0 && (magnitude < 1e-6 || magnitude >= 1e21)) {
			return exponential(decimal);
		}
		return decimal.toPlainString();
	}

	private static String exponential(BigDecimal decimal) {
		if (decimal.signum() == 0) {
			return "0e+0";
		}
		String digits = decimal.unscaledValue().abs().toString();
		int exponent = digits.length() - 1 - decimal.scale();
		StringBuilder printed = new StringBuilder();
		if (decimal.signum() < 0) {
			printed.append('-');
		}
		printed.append(digits.charAt(0));
		if (digits.length() > 1) {
			printed.append('.').append(digits, 1, digits.length());
		}
		printed.append('e').append(exponent < 0 ? "-" : "+").append(Math.abs(exponent));
		return printed.toString();
	}

	public Doc printNull(NullExpression expr) {
		Doc inner = printer.notes().printInnerNotes(expr, null, LINE);
		if (!isEmpty(inner)) {
			inner = concat(SPACE, inner);
		}
		NullExpressionFormat format = FormatPreservation.resolveKeyword(expr, ctx.getFormat().nullExpression, "null",
				NullExpressionFormat.NULL, NullExpressionFormat.BRACKETS);
		if (format == NullExpressionFormat.NULL) {
			return group(concat(keyword("null"), inner));
		}
		return group(concat(text("("), text(")"), inner));
	}
}
