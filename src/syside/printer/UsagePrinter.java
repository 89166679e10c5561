package syside.printer;

import syside.doc.Doc;
import syside.model.*;
import syside.options.KeywordFormat;
import syside.options.PreservableFormatting;
import syside.options.Presence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static syside.doc.DocBuilder.*;

/**
 * SysML definitions and usages.
 */
public class UsagePrinter {
	private final ModelPrinter printer;
	private final PrintContext ctx;

	public UsagePrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	private NamespacePrinter namespaces() {
		return printer.namespaces();
	}

	// modifiers

	public List<Doc> usageModifiers(Usage node, boolean ignoreRef) {
		List<Doc> modifiers = new ArrayList<>();
		if (node.getDirection() != null) {
			modifiers.add(keyword(node.getDirection().getKeyword()));
		}
		// variation implies abstract
		if (node.isVariation()) {
			modifiers.add(keyword("variation"));
		} else if (node.isAbstract()) {
			modifiers.add(keyword("abstract"));
		}
		if (node.isReadonly()) {
			modifiers.add(keyword("readonly"));
		}
		if (node.isDerived()) {
			modifiers.add(keyword("derived"));
		}
		if (node.isEnd()) {
			modifiers.add(keyword("end"));
		}
		if (!ignoreRef && node.isReference() && node.getKind() != UsageKind.REFERENCE) {
			modifiers.add(keyword("ref"));
		}
		return modifiers;
	}

	public List<Doc> occurrenceUsageModifiers(Usage node, boolean ignoreRef) {
		List<Doc> modifiers = usageModifiers(node, ignoreRef);
		if (node.isIndividual()) {
			modifiers.add(keyword("individual"));
		}
		if (node.getPortionKind() != null) {
			modifiers.add(keyword(node.getPortionKind().getKeyword()));
		}
		return modifiers;
	}

	private static List<Doc> variationOrAbstract(boolean variation, boolean isAbstract) {
		List<Doc> modifiers = new ArrayList<>();
		if (variation) {
			modifiers.add(keyword("variation"));
		} else if (isAbstract) {
			modifiers.add(keyword("abstract"));
		}
		return modifiers;
	}

	public List<Doc> definitionModifiers(Definition node) {
		return variationOrAbstract(node.isVariation(), node.isAbstract());
	}

	public List<Doc> occurrenceDefinitionModifiers(Definition node) {
		List<Doc> modifiers = definitionModifiers(node);
		if (node.isIndividual()) {
			modifiers.add(keyword("individual"));
		}
		return modifiers;
	}

	/**
	 * @return true if an explicit {@code ref} should not be printed
	 */
	public boolean shouldIgnoreRef(Usage node, PreservableFormatting<Presence> option) {
		return FormatPreservation.resolveKeyword(node, option, "ref", Presence.ALWAYS, Presence.NEVER) ==
				Presence.NEVER;
	}

	// generic printers

	/**
	 * @param modifiers null to compute usage modifiers
	 */
	public Doc printGenericUsage(List<Doc> modifiers, String kw, Usage node, DeclarationOptions options,
	                             boolean ignoreRef) {
		ctx.assertSysML(node);
		if (options.getJoin() == null) {
			options.join(new ActionBodyJoiner());
		}
		return namespaces().printGenericFeature(modifiers != null ? modifiers : usageModifiers(node, ignoreRef), kw,
				node, options);
	}

	/**
	 * @param modifiers null to compute occurrence usage modifiers
	 */
	public Doc printGenericOccurrenceUsage(List<Doc> modifiers, String kw, Usage node, DeclarationOptions options,
	                                       boolean ignoreRef) {
		ctx.assertSysML(node);
		if (options.getJoin() == null) {
			options.join(new ActionBodyJoiner());
		}
		return namespaces().printGenericFeature(
				modifiers != null ? modifiers : occurrenceUsageModifiers(node, ignoreRef), kw, node, options);
	}

	public Doc printGenericOccurrenceUsage(List<Doc> modifiers, String kw, Usage node) {
		return printGenericOccurrenceUsage(modifiers, kw, node, new DeclarationOptions(), false);
	}

	private Doc printGenericDefinition(List<Doc> modifiers, String kw, Definition node, DeclarationOptions options) {
		ctx.assertSysML(node);
		options.modifiers(modifiers).keyword(kw).result(node.getResult()).join(new ActionBodyJoiner());
		return namespaces().printGenericNamespace(node, options);
	}

	// shorthand

	private static HeritageKind firstSpecializationKind(Type node) {
		List<Heritage> specializations = node.getSpecializations();
		return specializations.isEmpty() ? null : specializations.get(0).getKind();
	}

	/**
	 * @return true if node can be written as its first specialization alone,
	 * e.g. {@code :> a;}
	 */
	public boolean canPrintShorthandUsage(Usage node, HeritageKind firstSpecialization) {
		return node.getPrefixes().isEmpty() &&
				usageModifiers(node, false).isEmpty() &&
				node.getValue() == null &&
				!node.hasIdentifiers() &&
				node.getMultiplicity() == null &&
				!node.isOrdered() &&
				!node.isNonunique() &&
				firstSpecializationKind(node) == firstSpecialization;
	}

	private static List<List<Heritage>> firstAndRest(Type node) {
		List<Heritage> specializations = node.getSpecializations();
		List<List<Heritage>> groups = new ArrayList<>();
		if (specializations.isEmpty()) {
			groups.add(Collections.<Heritage>emptyList());
			groups.add(Collections.<Heritage>emptyList());
		} else {
			groups.add(specializations.subList(0, 1));
			groups.add(specializations.subList(1, specializations.size()));
		}
		return groups;
	}

	public Doc printShorthandUsage(Usage node) {
		List<Doc> parts = new ArrayList<>(namespaces().printSpecializationPart(node, UsagePrinter::firstAndRest,
				true, true));
		parts.add(namespaces().printChildrenBlock(node, node.getMembers(), new BlockOptions().insertSpace(true)));
		return concat(parts);
	}

	// occurrence usage subtypes

	/**
	 * Prints usages like {@code perform action a;} where the last keyword may be
	 * dropped, leaving {@code perform a;}.
	 *
	 * @param keywords required keywords followed by the optional one
	 * @param append appends to the declaration, null to append the feature value
	 * @param declarationOnly print neither modifiers nor children, used by
	 *                        action bodies
	 */
	public Doc printOccurrenceUsageSubtype(List<String> keywords, Usage node, PreservableFormatting<KeywordFormat> format,
	                                       Consumer<List<Doc>> append, boolean declarationOnly, boolean forceBrackets,
	                                       boolean ignoreRef) {
		String optional = keywords.size() > 1 ? keywords.get(keywords.size() - 1) : null;
		List<String> required = optional != null ? keywords.subList(0, keywords.size() - 1) : keywords;
		boolean hasKw = optional != null;
		if (hasKw && !node.hasIdentifiers() && firstSpecializationKind(node) == HeritageKind.REFERENCE_SUBSETTING) {
			String[] words = optional.split(" ");
			hasKw = FormatPreservation.resolveKeyword(node, format, words[words.length - 1], KeywordFormat.ALWAYS,
					KeywordFormat.AS_NEEDED) == KeywordFormat.ALWAYS;
		}

		String kw;
		if (declarationOnly) {
			kw = hasKw ? optional : null;
		} else {
			kw = String.join(" ", hasKw ? keywords : required);
		}

		DeclarationOptions options = new DeclarationOptions()
				.skipFirstSpecializationKeyword(!hasKw)
				.specializations(hasKw ? namespaces().defaultSpecializationGrouper() : UsagePrinter::firstAndRest)
				.appendToDeclaration(append != null ? append : namespaces().featureValueAppender(node))
				.skipChildren(declarationOnly)
				.forceBrackets(forceBrackets);
		return printGenericOccurrenceUsage(declarationOnly ? Collections.<Doc>emptyList() : null, kw, node, options,
				ignoreRef);
	}

	private static List<String> keywords(String... keywords) {
		List<String> list = new ArrayList<>();
		Collections.addAll(list, keywords);
		return list;
	}

	public Doc printAssertConstraint(Usage node, boolean declarationOnly) {
		return printOccurrenceUsageSubtype(keywords(node.isNegated() ? "assert not" : "assert", "constraint"), node,
				ctx.getFormat().assertConstraintUsageKeyword,
				declaration -> {}, declarationOnly, false, false);
	}

	public Doc printEventOccurrence(Usage node, boolean declarationOnly) {
		return printOccurrenceUsageSubtype(keywords("event", "occurrence"), node,
				ctx.getFormat().eventOccurrenceKeyword, null, declarationOnly, false,
				shouldIgnoreRef(node, ctx.getFormat().eventOccurrenceReferenceKeyword));
	}

	public Doc printExhibitState(Usage node, boolean declarationOnly) {
		Consumer<List<Doc>> suffix = null;
		if (node.isParallel()) {
			List<Doc> parts = new ArrayList<>();
			if (node.getValue() != null) {
				parts.add(SPACE);
				parts.add(printer.print(node.getValue()));
			}
			parts.add(indent(LINE, keyword("parallel")));
			suffix = declaration -> declaration.add(concat(parts));
		}
		return printOccurrenceUsageSubtype(keywords("exhibit", "state"), node,
				ctx.getFormat().exhibitStateUsageKeyword, suffix, declarationOnly, node.isParallel(),
				shouldIgnoreRef(node, ctx.getFormat().exhibitStateReferenceKeyword));
	}

	public Doc printIncludeUseCase(Usage node, boolean declarationOnly) {
		return printOccurrenceUsageSubtype(keywords("include", "use case"), node,
				ctx.getFormat().includeUseCaseUsageKeyword, null, declarationOnly, false,
				shouldIgnoreRef(node, ctx.getFormat().includeUseCaseReferenceKeyword));
	}

	public Doc printPerformAction(Usage node, boolean declarationOnly) {
		return printOccurrenceUsageSubtype(keywords("perform", "action"), node,
				ctx.getFormat().performActionUsageKeyword, null, declarationOnly, false,
				shouldIgnoreRef(node, ctx.getFormat().performActionReferenceKeyword));
	}

	public Doc printSatisfyRequirement(Usage node, boolean declarationOnly) {
		List<Doc> suffix = new ArrayList<>();
		if (node.getValue() != null) {
			suffix.add(SPACE);
			suffix.add(printer.print(node.getValue()));
		}
		if (node.getSatisfactionSubject() != null) {
			suffix.add(LINE);
			suffix.add(keyword("by "));
			suffix.add(indent(printer.print(node.getSatisfactionSubject())));
		}
		Presence assertKw = FormatPreservation.resolveKeyword(node, ctx.getFormat().satisfyRequirementAssertKeyword,
				"assert", Presence.ALWAYS, Presence.NEVER);
		String satisfy = (assertKw == Presence.ALWAYS ? "assert " : "") +
				(node.isNegated() ? "not satisfy" : "satisfy");
		return printOccurrenceUsageSubtype(keywords(satisfy, "requirement"), node,
				ctx.getFormat().satisfyRequirementKeyword,
				declaration -> declaration.add(indent(group(concat(suffix)))), declarationOnly, false,
				false);
	}

	// dispatch

	static boolean isDefinition(Element element, DefinitionKind kind) {
		return element instanceof Definition && ((Definition) element).getKind() == kind;
	}

	static boolean isUsage(Element element, UsageKind kind) {
		return element instanceof Usage && ((Usage) element).getKind() == kind;
	}

	private static boolean isInterface(Element element) {
		return isDefinition(element, DefinitionKind.INTERFACE) ||
				(element instanceof Connector && ((Connector) element).getConnectorKind() == ConnectorKind.INTERFACE);
	}

	private static boolean inVariant(Element element) {
		return element.getParent() instanceof OwningMembership &&
				((OwningMembership) element.getParent()).getKind() == MembershipKind.VARIANT;
	}

	private static Consumer<List<Doc>> parallelAppender(boolean parallel) {
		return declaration -> {
			if (parallel) {
				declaration.add(concat(LINE, keyword("parallel")));
			}
		};
	}

	public Doc printDefinition(Definition node) {
		DefinitionKind kind = node.getKind();
		String kw = kind.getKeyword() + " def";
		switch (kind) {
			case ENUMERATION:
				return printGenericDefinition(new ArrayList<Doc>(), kw, node, new DeclarationOptions());
			case ATTRIBUTE:
			case METADATA:
			case PORT:
				return printGenericDefinition(definitionModifiers(node), kw, node, new DeclarationOptions());
			case OCCURRENCE:
				if (node.isIndividual()) {
					KeywordFormat format = FormatPreservation.resolveKeyword(node, ctx.getFormat().occurrenceKeyword,
							"occurrence", KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
					kw = format == KeywordFormat.ALWAYS ? "occurrence def" : "def";
				}
				return printGenericDefinition(occurrenceDefinitionModifiers(node), kw, node, new DeclarationOptions());
			case STATE:
				return printGenericDefinition(occurrenceDefinitionModifiers(node), kw, node, new DeclarationOptions()
						.appendToDeclaration(parallelAppender(node.isParallel()))
						.forceBrackets(node.isParallel()));
			default:
				return printGenericDefinition(occurrenceDefinitionModifiers(node), kw, node, new DeclarationOptions());
		}
	}

	public Doc printUsage(Usage node) {
		switch (node.getKind()) {
			case REFERENCE:
				return printReferenceUsage(node);
			case ATTRIBUTE:
				return printGenericUsage(null, "attribute", node, new DeclarationOptions(),
						shouldIgnoreRef(node, ctx.getFormat().attributeUsageReferenceKeyword));
			case ENUMERATION:
				return printEnumerationUsage(node);
			case METADATA:
				return printGenericUsage(null, "metadata", node, new DeclarationOptions(), false);
			case OCCURRENCE:
				return printOccurrenceUsage(node);
			case PORT:
				return printPortUsage(node);
			case STATE:
				return printGenericOccurrenceUsage(null, "state", node, new DeclarationOptions()
						.appendToDeclaration(parallelAppender(node.isParallel()))
						.forceBrackets(node.isParallel()), false);
			case EVENT_OCCURRENCE:
				return printEventOccurrence(node, false);
			case PERFORM_ACTION:
				return printPerformAction(node, false);
			case EXHIBIT_STATE:
				return printExhibitState(node, false);
			case INCLUDE_USE_CASE:
				return printIncludeUseCase(node, false);
			case ASSERT_CONSTRAINT:
				return printAssertConstraint(node, false);
			case SATISFY_REQUIREMENT:
				return printSatisfyRequirement(node, false);
			default:
				if (node.getKind().getKeyword() == null) {
					throw new syside.Unreachable();
				}
				return printGenericOccurrenceUsage(null, node.getKind().getKeyword(), node);
		}
	}

	private Doc printEnumerationUsage(Usage node) {
		if (!isDefinition(node.getOwner(), DefinitionKind.ENUMERATION)) {
			return printGenericUsage(null, "enum", node, new DeclarationOptions(),
					shouldIgnoreRef(node, ctx.getFormat().attributeUsageReferenceKeyword));
		}
		Presence kw = FormatPreservation.resolveKeyword(node, ctx.getFormat().enumMemberKeyword, "enum",
				Presence.ALWAYS, Presence.NEVER);
		return printGenericUsage(null, kw == Presence.ALWAYS ? "enum" : null, node, new DeclarationOptions(), true);
	}

	private Doc printOccurrenceUsage(Usage node) {
		String kw = "occurrence";
		if (node.isIndividual() || node.getPortionKind() != null) {
			KeywordFormat format = FormatPreservation.resolveKeyword(node, ctx.getFormat().occurrenceKeyword,
					"occurrence", KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
			kw = format == KeywordFormat.ALWAYS ? "occurrence" : null;
		}
		return printGenericOccurrenceUsage(null, kw, node);
	}

	private Doc printPortUsage(Usage node) {
		if (node.isEnd() && isInterface(node.getOwner())) {
			// interface ends print without a keyword
			List<Doc> modifiers = new ArrayList<>();
			if (node.getDirection() != null) {
				modifiers.add(keyword(node.getDirection().getKeyword()));
			}
			modifiers.addAll(variationOrAbstract(node.isVariation(), node.isAbstract()));
			modifiers.add(keyword("end"));
			return namespaces().printGenericFeature(modifiers, null, node, new DeclarationOptions());
		}
		Element owner = node.getOwner();
		boolean ignoreRef = isUsage(owner, UsageKind.PORT) || isDefinition(owner, DefinitionKind.PORT)
				? false
				: shouldIgnoreRef(node, ctx.getFormat().portUsageReferenceKeyword);
		return printGenericOccurrenceUsage(null, "port", node, new DeclarationOptions(), ignoreRef);
	}

	private Doc printReferenceUsage(Usage node) {
		KeywordFormat format = FormatPreservation.resolveKeyword(node, ctx.getFormat().referenceUsageKeyword, "ref",
				KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
		String kw = format == KeywordFormat.ALWAYS ? "ref" : null;

		if (inVariant(node) && kw == null && canPrintShorthandUsage(node, HeritageKind.REFERENCE_SUBSETTING)) {
			return printShorthandUsage(node);
		}
		// variants and interface members need the keyword
		if (inVariant(node) || isInterface(node.getOwner())) {
			kw = "ref";
		}
		return printGenericUsage(null, kw, node, new DeclarationOptions(), false);
	}

	// special memberships

	/**
	 * Prints the target of {@code frame}, {@code require}, {@code assume} and
	 * {@code verify} memberships.
	 */
	public Doc printRequirementMemberTarget(Usage node, String targetKeyword) {
		ctx.assertSysML(node);
		boolean allowShorthand = canPrintShorthandUsage(node, HeritageKind.REFERENCE_SUBSETTING);
		KeywordFormat format = FormatPreservation.resolveKeyword(node, ctx.getFormat().framedConcernKeyword,
				targetKeyword, KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
		String kw = targetKeyword;
		if (format == KeywordFormat.AS_NEEDED && (allowShorthand || !node.getPrefixes().isEmpty())) {
			kw = null;
		}
		if (kw != null || !allowShorthand) {
			return printGenericOccurrenceUsage(Collections.<Doc>emptyList(), kw, node);
		}
		return printShorthandUsage(node);
	}
}
