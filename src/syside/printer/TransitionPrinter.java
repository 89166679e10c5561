package syside.printer;

import syside.doc.Doc;
import syside.model.AcceptActionUsage;
import syside.model.Connector;
import syside.model.ConnectorEnd;
import syside.model.DefinitionKind;
import syside.model.Element;
import syside.model.MembershipKind;
import syside.model.OwningMembership;
import syside.model.TransitionUsage;
import syside.model.Usage;
import syside.model.UsageKind;
import syside.model.expression.Expression;
import syside.options.KeywordFormat;

import java.util.ArrayList;
import java.util.List;

import static syside.doc.DocBuilder.*;

/**
 * Prints succession usages and transition usages in their shorthand forms
 * inside action and state bodies.
 */
public class TransitionPrinter {
	private final ModelPrinter printer;
	private final PrintContext ctx;

	public TransitionPrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	// successions

	public Doc printSuccessionAsUsage(Connector node, Element previousSibling) {
		ctx.assertSysML(node);
		switch (SuccessionKind.of(node, previousSibling)) {
			case EMPTY:
				return printEmptySuccession(node);
			case TARGET:
				return printTargetSuccession(node);
			case REGULAR:
				return printer.connectors().printSuccessionAsUsage(node);
			case TRANSITION:
				return printSuccessionAfterEntry(node);
			default:
				throw new syside.Unreachable();
		}
	}

	private Doc printMultiplicitySourceEnd(Connector node) {
		if (node.getEnds().isEmpty() || node.getEnds().get(0).getMultiplicity() == null) {
			return null;
		}
		return group(printer.namespaces().printMultiplicityPart(null, node.getEnds().get(0).getMultiplicity()));
	}

	private Doc printEmptySuccession(Connector node) {
		Doc source = printMultiplicitySourceEnd(node);
		if (source == null) {
			return keyword("then");
		}
		return concat(keyword("then "), source);
	}

	private static ConnectorEnd lastEnd(Connector node) {
		List<ConnectorEnd> ends = node.getEnds();
		return ends.get(ends.size() - 1);
	}

	private Doc printTargetSuccession(Connector node) {
		List<Doc> parts = new ArrayList<>();
		Doc source = printMultiplicitySourceEnd(node);
		if (source != null) {
			parts.add(source);
			parts.add(SPACE);
		}
		parts.add(keyword("then "));
		parts.add(printer.print(lastEnd(node)));
		parts.add(printBlock(node));
		return concat(parts);
	}

	private Doc printSuccessionAfterEntry(Connector node) {
		ConnectorEnd target = lastEnd(node);
		// an entry action may be followed by an empty succession as well
		if (!target.isExplicit()) {
			return printEmptySuccession(node);
		}
		return concat(printEmptySuccession(node), SPACE, printer.print(target), SEMICOLON);
	}

	private Doc printBlock(Usage node) {
		return printer.namespaces().printChildrenBlock(node, node.getMembers(),
				new BlockOptions().insertSpace(true).join(new ActionBodyJoiner()));
	}

	// transitions

	enum TransitionKind {
		DEFAULT_TARGET,
		GUARDED_TARGET,
		GUARDED_SUCCESSION,
		TRANSITION,
		TARGET_TRANSITION
	}

	static boolean isState(Element element) {
		return UsagePrinter.isUsage(element, UsageKind.STATE) || UsagePrinter.isUsage(element, UsageKind.EXHIBIT_STATE) ||
				UsagePrinter.isDefinition(element, DefinitionKind.STATE);
	}

	static TransitionKind kindOf(TransitionUsage node, Element previousSibling) {
		if (node.isElse()) {
			return TransitionKind.DEFAULT_TARGET;
		}

		if (isState(node.getOwner())) {
			if (node.getSource() != null) {
				return TransitionKind.TRANSITION;
			}
			if (node.getAccepter() != null || node.getEffect() != null) {
				return TransitionKind.TARGET_TRANSITION;
			}
			if (previousSibling instanceof OwningMembership &&
					((OwningMembership) previousSibling).getKind() == MembershipKind.ENTRY && node.getGuard() != null) {
				return TransitionKind.GUARDED_TARGET;
			}
			return TransitionKind.TARGET_TRANSITION;
		}

		// owned by an action
		return node.getSource() != null ? TransitionKind.GUARDED_SUCCESSION : TransitionKind.GUARDED_TARGET;
	}

	public Doc printTransitionUsage(TransitionUsage node, Element previousSibling) {
		ctx.assertSysML(node);
		switch (kindOf(node, previousSibling)) {
			case DEFAULT_TARGET:
				return concat(printThenElse("else", node), printBlock(node));
			case GUARDED_TARGET:
				return printGuardedTarget(node);
			case GUARDED_SUCCESSION:
				return printGuardedSuccession(node);
			case TRANSITION:
			case TARGET_TRANSITION:
				return printDefaultTransition(node);
			default:
				throw new syside.Unreachable();
		}
	}

	private Doc printAccepter(AcceptActionUsage accepter) {
		return printer.print(accepter, null, (a, previous) ->
				group(concat(keyword("accept "), indent(printer.actions().printAccepterParameterPart(a)))));
	}

	private Doc printGuard(Expression guard) {
		return group(printer.actions().printCondition(keyword("if"), guard,
				ctx.getFormat().transitionUsageParenthesizeGuard));
	}

	private Doc printEffect(Usage effect) {
		return printer.print(effect, null, (e, previous) -> {
			if (ActionPrinter.isEmptyAction(e)) {
				return keyword("do");
			}
			Doc subaction = printer.actions().printSubaction(e, EMPTY);
			return group(concat(keyword("do "), subaction != null ? subaction : printer.printConstruct(e, previous)));
		});
	}

	private Doc printThenElse(String kw, TransitionUsage node) {
		Element target = ModelPrinter.required(node, node.getTarget(), "target");
		return group(concat(keyword(kw), SPACE, printer.print(target)));
	}

	private Doc printGuardedTarget(TransitionUsage node) {
		Expression guard = ModelPrinter.required(node, node.getGuard(), "guard");
		Doc printed = group(concat(printGuard(guard), indent(LINE, printThenElse("then", node))));

		if (isState(node.getOwner())) {
			// only entry transitions take this form inside states
			return concat(printed, SEMICOLON);
		}
		return concat(printed, printBlock(node));
	}

	private Doc printGuardedSuccession(TransitionUsage node) {
		Element source = ModelPrinter.required(node, node.getSource(), "source");
		Expression guard = ModelPrinter.required(node, node.getGuard(), "guard");

		Doc suffix = concat(
				group(concat(keyword("first "), indent(printer.print(source)))),
				LINE,
				group(concat(printGuard(guard), indent(LINE, printThenElse("then", node)))));

		return printer.namespaces().printGenericFeature(new ArrayList<Doc>(),
				ActionPrinter.hasFeatureDeclaration(node) ? "succession" : null, node, new DeclarationOptions()
						.appendToDeclaration(declaration -> {
							if (!declaration.isEmpty()) {
								declaration.add(indent(LINE));
							}
							declaration.add(indent(group(suffix)));
						})
						.join(new ActionBodyJoiner()));
	}

	private Doc printDefaultTransition(TransitionUsage node) {
		List<Doc> parts = new ArrayList<>();
		Doc guard = node.getGuard() != null ? group(printGuard(node.getGuard())) : null;
		Doc effect = node.getEffect() != null ? group(printEffect(node.getEffect())) : null;
		Doc then = group(printThenElse("then", node));

		if (node.getAccepter() != null) {
			parts.add(group(printAccepter(node.getAccepter())));
		}
		if (guard != null) {
			// the guard shares its line with what follows it
			if (effect != null) {
				guard = group(concat(guard, indent(LINE, effect)));
				effect = null;
			} else {
				guard = group(concat(guard, indent(LINE, then)));
				then = null;
			}
			parts.add(guard);
		}
		if (effect != null) {
			parts.add(effect);
		}
		if (then != null) {
			parts.add(then);
		}

		List<Doc> suffixParts = new ArrayList<>();
		for (int i = 0; i < parts.size(); ++i) {
			suffixParts.add(i == 0 ? indent(parts.get(i)) : indent(LINE, parts.get(i)));
		}
		Doc suffix = concat(suffixParts);

		if (node.getSource() != null) {
			String first = ActionPrinter.selectDeclarationKeyword(node, "first",
					ctx.getFormat().transitionUsageFirstKeyword);
			Doc source = printer.print(node.getSource());
			source = first != null
					? group(indent(keyword(first), SPACE, indent(source)))
					: indent(source);
			Doc printedSource = source;

			return printer.namespaces().printGenericFeature(new ArrayList<Doc>(), "transition", node,
					new DeclarationOptions()
							.appendToDeclaration(declaration -> {
								declaration.add(indent(LINE));
								declaration.add(group(concat(printedSource, indent(LINE), suffix)));
							})
							.join(new ActionBodyJoiner()));
		}

		// `transition` is required for an effect without accepter or guard
		boolean required = node.getEffect() != null && node.getGuard() == null && node.getAccepter() == null;
		boolean printKeyword = required || FormatPreservation.resolveKeyword(node,
				ctx.getFormat().transitionUsageKeyword, "transition", KeywordFormat.ALWAYS,
				KeywordFormat.AS_NEEDED) == KeywordFormat.ALWAYS;

		List<Doc> declaration = new ArrayList<>();
		if (printKeyword) {
			declaration.add(keyword("transition"));
			declaration.add(indent(LINE));
		}
		declaration.add(group(suffix));
		return concat(group(concat(declaration)), printBlock(node));
	}
}
