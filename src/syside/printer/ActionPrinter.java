package syside.printer;

import syside.doc.Doc;
import syside.model.*;
import syside.model.expression.Expression;
import syside.model.expression.Operator;
import syside.options.KeywordFormat;
import syside.options.Parenthesize;
import syside.options.PreservableFormatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static syside.doc.DocBuilder.*;

/**
 * Action usages with a textual form of their own: control nodes, accept, send
 * and assignment actions, loops, conditionals and state subactions.
 */
public class ActionPrinter {
	private final ModelPrinter printer;
	private final PrintContext ctx;

	public ActionPrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	static boolean hasFeatureDeclaration(Feature node) {
		return !node.getSpecializations().isEmpty() || !node.getTypeRelationships().isEmpty() ||
				node.hasIdentifiers() || node.getMultiplicity() != null || node.isOrdered() || node.isNonunique();
	}

	/**
	 * @return kw if it should be printed before the declaration of node, or null
	 */
	public static String selectDeclarationKeyword(Feature node, String kw,
	                                              PreservableFormatting<KeywordFormat> option) {
		KeywordFormat format = FormatPreservation.resolveKeyword(node, option, kw, KeywordFormat.ALWAYS,
				KeywordFormat.AS_NEEDED);
		if (format == KeywordFormat.ALWAYS || hasFeatureDeclaration(node)) {
			return kw;
		}
		return null;
	}

	private String actionKeyword(Feature node) {
		return selectDeclarationKeyword(node, "action", ctx.getFormat().actionNodeKeyword);
	}

	public Doc printControlNode(ControlNode node) {
		ctx.assertSysML(node);
		return printer.namespaces().printGenericFeature(printer.usages().occurrenceUsageModifiers(node, false),
				node.getNodeKind().getKeyword(), node, new DeclarationOptions().join(new ActionBodyJoiner()));
	}

	/**
	 * Prints {@code [action name] kw suffix}. The suffix moves to the next line
	 * as a whole when the declaration before it does not fit.
	 */
	private Doc printActionSubtype(Usage node, Doc suffix, String kw, boolean declarationOnly) {
		Doc sfx = group(concat(keyword(kw), SPACE, group(suffix)));
		Consumer<List<Doc>> append = declaration -> {
			if (!declaration.isEmpty()) {
				String id = ctx.groupId("action-subtype");
				declaration.add(group(concat(indent(LINE), indentIfBreak(sfx, id)), id));
			} else {
				declaration.add(sfx);
			}
		};
		return printer.usages().printGenericOccurrenceUsage(
				declarationOnly ? Collections.<Doc>emptyList() : null,
				actionKeyword(node),
				node,
				new DeclarationOptions()
						.appendToDeclaration(append)
						.skipChildren(declarationOnly)
						.join(new ActionBodyJoiner()),
				false);
	}

	public Doc printAssignmentAction(AssignmentActionUsage node, boolean declarationOnly) {
		Element target = ModelPrinter.required(node, node.getTarget(), "target");
		Expression value = ModelPrinter.required(node, node.getAssignedValue(), "assigned value");

		Doc printedTarget = target instanceof FeatureChain
				? printer.print(target, null, (chain, previous) -> indent(printer.printConstruct(chain, previous)))
				: printer.print(target);
		Doc suffix = concat(
				printedTarget,
				printer.expressions().printAssignmentExpression(listOf(SPACE, text(":=")), value));
		return printActionSubtype(node, suffix, "assign", declarationOnly);
	}

	private static List<Doc> listOf(Doc... docs) {
		List<Doc> list = new ArrayList<>();
		Collections.addAll(list, docs);
		return list;
	}

	private Doc printPayload(Usage payload) {
		List<Heritage> specializations = payload.getSpecializations();
		boolean typingOnly = !payload.hasIdentifiers() && specializations.size() == 1 &&
				specializations.get(0).getKind() == HeritageKind.FEATURE_TYPING && payload.getValue() == null;
		return printer.print(payload, null, (param, previous) -> printer.namespaces().printGenericNamespace(param,
				new DeclarationOptions()
						.modifiers(Collections.<Doc>emptyList())
						.keyword(null)
						.skipChildren(true)
						.skipFirstSpecializationKeyword(typingOnly)
						.appendToDeclaration(printer.namespaces().featureValueAppender(param))));
	}

	/**
	 * Prints {@code payload [via receiver]}.
	 */
	Doc printAccepterParameterPart(AcceptActionUsage node) {
		Usage payload = ModelPrinter.required(node, node.getPayload(), "payload parameter");
		List<Doc> suffix = new ArrayList<>();
		suffix.add(printPayload(payload));
		if (node.getReceiver() != null) {
			suffix.add(indent(LINE, keyword("via "), printer.print(node.getReceiver())));
		}
		return concat(suffix);
	}

	public Doc printAcceptAction(AcceptActionUsage node, boolean declarationOnly) {
		return printActionSubtype(node, printAccepterParameterPart(node), "accept", declarationOnly);
	}

	public Doc printSendAction(SendActionUsage node, boolean declarationOnly) {
		Expression payload = ModelPrinter.required(node, node.getPayload(), "payload");
		List<Doc> suffix = new ArrayList<>();
		suffix.add(printer.print(payload));
		if (node.getSender() != null) {
			suffix.add(indent(LINE, keyword("via "), printer.print(node.getSender())));
		}
		if (node.getReceiver() != null) {
			suffix.add(indent(LINE, keyword("to "), printer.print(node.getReceiver())));
		}
		return printActionSubtype(node, concat(suffix), "send", declarationOnly);
	}

	// control flow

	private Doc printControlFlow(Usage node, Doc suffix) {
		return printer.usages().printGenericOccurrenceUsage(null, actionKeyword(node), node,
				new DeclarationOptions()
						.appendToDeclaration(declaration -> {
							if (!declaration.isEmpty()) {
								declaration.add(LINE);
							}
							declaration.add(suffix);
						})
						.skipChildren(true),
				false);
	}

	/**
	 * Prints a nested action body, e.g. the {@code then} branch of an if action.
	 *
	 * @param mustBreak break the body if it is followed by another clause
	 * @param leading prefix the body with the separator from the clause before it
	 */
	private Doc printActionBody(Usage body, boolean mustBreak, boolean leading) {
		return printer.print(body, null, (param, previous) -> {
			String kw = actionKeyword(param);
			Doc printed = printer.namespaces().printGenericFeature(Collections.<Doc>emptyList(), kw, param,
					new DeclarationOptions()
							.forceBrackets(true)
							.noAppend()
							.forceBreakChildren(mustBreak)
							.join(new ActionBodyJoiner()));
			if (mustBreak) {
				printed = ifBreak(printed, group(printed));
			}
			if (!leading) {
				return printed;
			}
			// the body itself stays unindented
			return kw != null ? concat(indent(LINE), printed) : concat(SPACE, printed);
		});
	}

	/**
	 * Prints {@code kw condition}, parenthesizing the condition as configured.
	 */
	public Doc printCondition(Doc kw, Expression condition, Parenthesize parenthesize) {
		Doc expr = printer.print(condition);
		if (Precedence.operatorOf(condition) == Operator.COMMA) {
			// sequences bring their own parentheses
			parenthesize = Parenthesize.NEVER;
		}

		switch (parenthesize) {
			case ALWAYS:
				expr = group(concat(text("("), indent(SOFTLINE, expr), SOFTLINE, text(")")));
				break;
			case ON_BREAK:
				expr = group(concat(ifBreak(text("("), EMPTY), indent(SOFTLINE, expr), SOFTLINE,
						ifBreak(text(")"), EMPTY)));
				break;
			case NEVER:
				return printer.expressions().printAssignmentExpression(listOf(kw), condition, expr);
			default:
				throw new syside.Unreachable();
		}

		String id = ctx.groupId("condition");
		return concat(kw, group(indent(LINE), id), indentIfBreak(expr, id));
	}

	public Doc printWhileLoop(WhileLoopActionUsage node) {
		Usage body = ModelPrinter.required(node, node.getBody(), "while loop body");
		boolean mustBreak = node.getUntil() != null;
		List<Doc> suffix = new ArrayList<>();
		if (node.getCondition() == null) {
			suffix.add(keyword("loop "));
			suffix.add(printActionBody(body, mustBreak, false));
		} else {
			suffix.add(group(printCondition(keyword("while"), node.getCondition(),
					ctx.getFormat().whileLoopParenthesizeCondition)));
			suffix.add(printActionBody(body, mustBreak, true));
		}

		if (node.getUntil() != null) {
			suffix.add(group(concat(
					printCondition(keyword(" until"), node.getUntil(), ctx.getFormat().whileLoopParenthesizeUntil),
					SEMICOLON)));
		}
		return printControlFlow(node, group(concat(suffix)));
	}

	public Doc printForLoop(ForLoopActionUsage node) {
		Usage variable = ModelPrinter.required(node, node.getVariable(), "for loop variable");
		Expression sequence = ModelPrinter.required(node, node.getSequence(), "for loop sequence");
		Usage body = ModelPrinter.required(node, node.getBody(), "for loop body");

		Doc printedVariable = printer.print(variable, null, (v, previous) -> printer.namespaces().printGenericFeature(
				Collections.<Doc>emptyList(), null, v, new DeclarationOptions().noAppend().skipChildren(true)));
		Doc suffix = group(concat(
				keyword("for "),
				group(indent(printedVariable, LINE, keyword("in "), printer.print(sequence))),
				printActionBody(body, false, true)));
		return printControlFlow(node, suffix);
	}

	public Doc printIfAction(IfActionUsage node) {
		return printControlFlow(node, printIfClauses(node));
	}

	private Doc printIfClauses(IfActionUsage node) {
		Expression condition = ModelPrinter.required(node, node.getCondition(), "if condition");
		Usage then = ModelPrinter.required(node, node.getThenBody(), "if then branch");
		Usage otherwise = node.getElseBody();

		List<Doc> suffix = new ArrayList<>();
		suffix.add(group(printCondition(keyword("if"), condition, ctx.getFormat().ifParenthesizeCondition)));
		suffix.add(printActionBody(then, otherwise != null || node.getOwner() instanceof IfActionUsage, true));

		if (otherwise != null) {
			suffix.add(keyword(" else"));
			if (otherwise instanceof IfActionUsage) {
				suffix.add(SPACE);
				suffix.add(printer.print((IfActionUsage) otherwise, null,
						(nested, previous) -> printIfAction(nested)));
			} else {
				suffix.add(printActionBody(otherwise, true, true));
			}
		}
		return group(concat(suffix));
	}

	// state subactions

	/**
	 * @return the declaration of a subaction, or null if it has no dedicated
	 * short form
	 */
	private Doc printSubactionDeclaration(Element node) {
		if (node instanceof AcceptActionUsage) {
			return printAcceptAction((AcceptActionUsage) node, true);
		}
		if (node instanceof SendActionUsage) {
			return printSendAction((SendActionUsage) node, true);
		}
		if (node instanceof AssignmentActionUsage) {
			return printAssignmentAction((AssignmentActionUsage) node, true);
		}
		if (UsagePrinter.isUsage(node, UsageKind.PERFORM_ACTION)) {
			return printer.usages().printPerformAction((Usage) node, true);
		}
		return null;
	}

	static boolean isEmptyAction(Element node) {
		if (!(node instanceof Feature)) {
			return false;
		}
		Feature feature = (Feature) node;
		return !hasFeatureDeclaration(feature) && feature.getMembers().isEmpty() && feature.getValue() == null &&
				feature.getPrefixes().isEmpty();
	}

	/**
	 * Prints the short form of a subaction of a state or transition with its
	 * children, or returns null if node has no short form.
	 *
	 * @param semicolon printed instead of an empty children block
	 */
	Doc printSubaction(Element node, Doc semicolon) {
		Doc declaration = printSubactionDeclaration(node);
		if (declaration == null) {
			return null;
		}
		Namespace namespace = (Namespace) node;
		return group(concat(declaration, printer.namespaces().printChildrenBlock(namespace, namespace.getMembers(),
				new BlockOptions()
						.insertSpace(true)
						.semicolon(semicolon)
						.result(namespace instanceof Type ? ((Type) namespace).getResult() : null)
						.join(new ActionBodyJoiner()))));
	}

	public Doc printStateSubaction(OwningMembership node, Element previousSibling) {
		ctx.assertSysML(node);
		Element element = ModelPrinter.required(node, node.getElement(), "subaction");
		String kw = node.getKind().getKeyword();

		boolean empty = isEmptyAction(element);
		Doc target = printer.print(element, previousSibling, (e, previous) -> {
			if (empty) {
				return EMPTY;
			}
			Doc subaction = printSubaction(e, SEMICOLON);
			return subaction != null ? subaction : printer.printConstruct(e, previous);
		});
		Doc contents = empty
				? concat(keyword(kw), target, SEMICOLON)
				: concat(keyword(kw), SPACE, target);
		return printer.relationships().printWithVisibility(node, contents);
	}
}
