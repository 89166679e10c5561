package syside.printer;

import syside.doc.Doc;
import syside.doc.Text;
import syside.errors.MissingMemberIssue;
import syside.model.*;
import syside.model.expression.Expression;
import syside.model.expression.TriggerInvocationExpression;
import syside.options.DeclarationFormat;
import syside.options.FormatOptions;
import syside.options.KeywordFormat;
import syside.options.Presence;
import syside.options.PreservableFormatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static syside.doc.DocBuilder.*;

/**
 * Memberships, imports, aliases, dependencies, feature values and relationships
 * declared on their own.
 */
public class RelationshipPrinter {
	private final ModelPrinter printer;
	private final PrintContext ctx;

	public RelationshipPrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	private Doc printBlock(Relationship node) {
		return printer.namespaces().printChildrenBlock(node, node.getMembers(), new BlockOptions().insertSpace(true));
	}

	public Doc printWithVisibility(Relationship node, Doc doc) {
		switch (node.getVisibility()) {
			case PUBLIC: {
				Presence presence = FormatPreservation.resolveKeyword(node, ctx.getFormat().publicKeyword, "public",
						Presence.ALWAYS, Presence.NEVER);
				return presence == Presence.ALWAYS ? concat(keyword("public "), doc) : doc;
			}
			case PROTECTED:
				return concat(keyword("protected "), doc);
			case PRIVATE:
				return concat(keyword("private "), doc);
			default:
				throw new syside.Unreachable();
		}
	}

	// memberships

	private <T extends Element> Doc printGenericMembership(String kw, Relationship node, T element,
	                                                       Element previousSibling, ElementPrinter<? super T> custom) {
		Doc target = custom != null
				? printer.print(element, previousSibling, custom)
				: printer.print(element, previousSibling);
		if (kw == null) {
			return printWithVisibility(node, target);
		}
		return printWithVisibility(node, group(concat(keyword(kw), SPACE, target)));
	}

	public Doc printOwningMembership(OwningMembership node, Element previousSibling) {
		Element element = ModelPrinter.required(node, node.getElement(), "element");
		MembershipKind kind = node.getKind();
		switch (kind) {
			case MEMBER:
				if (!ctx.isSysML() && element instanceof Feature && !(element instanceof MetadataFeature) &&
						!(element instanceof MultiplicityRange) && node.getParent() instanceof Type) {
					return printGenericMembership("member", node, element, previousSibling, null);
				}
				return printGenericMembership(null, node, element, previousSibling, null);
			case FEATURE:
				return printGenericMembership(null, node, element, previousSibling, null);
			case VARIANT:
				ctx.assertSysML(node);
				// enumerated values are variants without the keyword
				return printGenericMembership(UsagePrinter.isDefinition(node.getParent(), DefinitionKind.ENUMERATION)
						? null : kind.getKeyword(), node, element, previousSibling, null);
			case RETURN:
				return printGenericMembership(kind.getKeyword(), node, element, previousSibling, null);
			case ACTOR:
			case SUBJECT:
			case STAKEHOLDER:
				ctx.assertSysML(node);
				return printGenericMembership(kind.getKeyword(), node, requiredFeature(node, element),
						previousSibling, (feature, previous) -> printer.namespaces().printGenericFeature(
								Collections.<Doc>emptyList(), null, feature, new DeclarationOptions()));
			case OBJECTIVE:
				ctx.assertSysML(node);
				return printGenericMembership(kind.getKeyword(), node, requiredFeature(node, element),
						previousSibling, (feature, previous) -> printer.namespaces().printGenericFeature(
								Collections.<Doc>emptyList(), null, feature, new DeclarationOptions()
										.appendToDeclaration(printer.namespaces().featureValueAppender(feature))));
			case FRAMED_CONCERN:
				return printRequirementMember(node, element, previousSibling, "concern");
			case REQUIRE:
			case ASSUME:
				return printRequirementMember(node, element, previousSibling, "constraint");
			case VERIFY:
				return printRequirementMember(node, element, previousSibling, "requirement");
			case ENTRY:
			case DO:
			case EXIT:
				return printer.actions().printStateSubaction(node, previousSibling);
			default:
				throw new syside.Unreachable();
		}
	}

	private static Feature requiredFeature(OwningMembership node, Element element) {
		if (!(element instanceof Feature)) {
			throw new MissingMemberIssue(node, "feature");
		}
		return (Feature) element;
	}

	private Doc printRequirementMember(OwningMembership node, Element element, Element previousSibling,
	                                   String targetKeyword) {
		ctx.assertSysML(node);
		if (!(element instanceof Usage)) {
			throw new MissingMemberIssue(node, "usage");
		}
		return printGenericMembership(node.getKind().getKeyword(), node, (Usage) element, previousSibling,
				(usage, previous) -> printer.usages().printRequirementMemberTarget(usage, targetKeyword));
	}

	public Doc printElementFilter(ElementFilterMembership node) {
		Expression condition = ModelPrinter.required(node, node.getCondition(), "condition");
		Doc contents = concat(
				printer.actions().printCondition(keyword("filter"), condition,
						ctx.getFormat().elementFilterParenthesize),
				SEMICOLON);
		return printWithVisibility(node, group(contents));
	}

	public Doc printAlias(Alias node) {
		Reference target = ModelPrinter.required(node, node.getTarget(), "target");
		return printWithVisibility(node, concat(
				group(concat(
						keyword("alias"),
						indent(Identifiers.printLeadingSpaceIdentifiers(node, ctx)),
						indent(LINE, keyword("for "), indent(printer.print(target))))),
				printBlock(node)));
	}

	public Doc printImport(Import node) {
		Reference target = ModelPrinter.required(node, node.getTarget(), "target");
		List<Doc> declaration = new ArrayList<>();
		declaration.add(keyword(node.isImportAll() ? "import all" : "import"));
		declaration.add(SPACE);
		declaration.add(indent(printer.print(target)));
		if (node.isNamespaceImport()) {
			declaration.add(text("::*"));
		}
		if (node.isRecursive()) {
			declaration.add(text("::**"));
		}

		List<Doc> doc = new ArrayList<>();
		doc.add(group(concat(declaration)));
		List<Doc> filters = new ArrayList<>();
		for (Expression filter : node.getFilters()) {
			filters.add(printer.print(filter, null, (e, previous) -> group(concat(
					text("["),
					indent(SOFTLINE, printer.printConstruct(e, previous)),
					SOFTLINE,
					text("]")))));
		}
		if (!filters.isEmpty()) {
			doc.add(indent(concat(filters)));
		}
		doc.add(printBlock(node));
		return printWithVisibility(node, concat(doc));
	}

	public Doc printDependency(Dependency node) {
		if (node.getClients().isEmpty()) {
			throw new MissingMemberIssue(node, "client");
		}
		if (node.getSuppliers().isEmpty()) {
			throw new MissingMemberIssue(node, "supplier");
		}

		List<Doc> declaration = new ArrayList<>();
		List<Doc> prefixes = printer.namespaces().printPrefixes(node.getPrefixes());
		if (!prefixes.isEmpty()) {
			declaration.add(indent(fill(joinParts(LINE, prefixes))));
			declaration.add(LINE);
		}
		declaration.add(keyword("dependency"));

		List<Doc> from = new ArrayList<>();
		if (node.hasIdentifiers()) {
			declaration.add(indent(Identifiers.printLeadingSpaceIdentifiers(node, ctx)));
			from.add(keyword("from"));
			from.add(LINE);
		} else {
			KeywordFormat format = FormatPreservation.resolveKeyword(node, ctx.getFormat().dependencyFromKeyword,
					"from", KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
			if (format == KeywordFormat.ALWAYS) {
				from.add(keyword("from"));
				from.add(LINE);
			} else {
				from.add(ifBreak(concat(keyword("from"), LINE), EMPTY));
			}
		}
		from.add(join(concat(COMMA, LINE), printer.printAll(node.getClients(), null)));

		Doc to = concat(keyword("to"), LINE, join(concat(COMMA, LINE), printer.printAll(node.getSuppliers(), null)));

		return concat(
				group(concat(
						group(concat(declaration)),
						indent(LINE, group(indent(concat(from)))),
						indent(LINE, group(indent(to))))),
				printBlock(node));
	}

	// relationship ends

	/**
	 * Prints a relationship end. Owned feature chains break before each dot.
	 */
	private Doc printEnd(Element end) {
		if (end instanceof FeatureChain) {
			return printer.print(end, null, (chain, previous) -> indent(printer.printConstruct(chain, previous)));
		}
		return printer.print(end);
	}

	public Doc printHeritageTarget(Heritage node) {
		Element target = ModelPrinter.required(node, node.getTarget(), "target");
		Doc printed = printEnd(target);
		if (node.getKind() == HeritageKind.CONJUGATED_PORT_TYPING) {
			return concat(text("~"), printed);
		}
		return printed;
	}

	public Doc printChaining(FeatureChain node) {
		List<Doc> parts = new ArrayList<>();
		for (Reference chaining : node.getChainings()) {
			Doc target = printer.print(chaining);
			parts.add(parts.isEmpty() ? target : indent(DOT, target));
		}
		if (parts.isEmpty()) {
			throw new MissingMemberIssue(node, "chaining");
		}
		return fill(joinParts(SOFTLINE, parts));
	}

	public Doc printFeatureValue(FeatureValue node) {
		Expression expression = ModelPrinter.required(node, node.getExpression(), "expression");
		if (expression instanceof TriggerInvocationExpression) {
			return printer.print(expression);
		}

		List<Doc> prefix = new ArrayList<>();
		if (node.isDefault()) {
			prefix.add(keyword("default"));
			if (node.isInitial()) {
				prefix.add(text(":="));
			} else {
				KeywordFormat equals = FormatPreservation.resolveKeyword(node, ctx.getFormat().featureValueEquals,
						"=", KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
				if (equals == KeywordFormat.ALWAYS) {
					prefix.add(text("="));
				}
			}
		} else if (node.isInitial()) {
			prefix.add(text(":="));
		} else {
			prefix.add(text("="));
		}
		return printer.expressions().printAssignmentExpression(joinParts(SPACE, prefix), expression);
	}

	// relationships declared on their own

	private static Doc selectToken(Doc kw, Text token, SourceTargetRelationship node,
	                               PreservableFormatting<DeclarationFormat> option) {
		DeclarationFormat format = FormatPreservation.resolveKeyword(node, option, token.getContents(),
				DeclarationFormat.TOKEN,
				DeclarationFormat.KEYWORD);
		return format == DeclarationFormat.TOKEN ? token : kw;
	}

	/**
	 * @return kw, or nothing if the format allows omitting it for unnamed node
	 */
	private static Doc optionalKeyword(SourceTargetRelationship node, String kw,
	                                   PreservableFormatting<KeywordFormat> option) {
		if (option == null) {
			return keyword(kw);
		}
		KeywordFormat format = FormatPreservation.resolveKeyword(node, option, kw, KeywordFormat.ALWAYS,
				KeywordFormat.AS_NEEDED);
		if (format == KeywordFormat.ALWAYS || node.hasIdentifiers()) {
			return keyword(kw);
		}
		return EMPTY;
	}

	public Doc printSourceTargetRelationship(SourceTargetRelationship node) {
		ctx.assertKerML(node);
		FormatOptions options = ctx.getFormat();
		String kw;
		PreservableFormatting<KeywordFormat> kwFormat;
		Doc sourceKw;
		Doc targetKw;
		switch (node.getKind()) {
			case SPECIALIZATION:
				kw = "specialization";
				kwFormat = options.specializationKeywordSpecialization;
				sourceKw = keyword("subtype");
				targetKw = selectToken(keyword("specializes"), text(":>"), node,
						options.declarationSpecialization);
				break;
			case SUBCLASSIFICATION:
				kw = "specialization";
				kwFormat = options.specializationKeywordSubclassification;
				sourceKw = keyword("subclassifier");
				targetKw = selectToken(keyword("specializes"), text(":>"), node,
						options.declarationSubclassification);
				break;
			case SUBSETTING:
				kw = "specialization";
				kwFormat = options.specializationKeywordSubsetting;
				sourceKw = keyword("subset");
				targetKw = selectToken(keyword("subsets"), text(":>"), node, options.declarationSubsetting);
				break;
			case REDEFINITION:
				kw = "specialization";
				kwFormat = options.specializationKeywordRedefinition;
				sourceKw = keyword("redefinition");
				targetKw = selectToken(keyword("redefines"), text(":>>"), node,
						options.declarationRedefinition);
				break;
			case FEATURE_TYPING:
				kw = "specialization";
				kwFormat = options.specializationKeywordFeatureTyping;
				sourceKw = keyword("typing");
				targetKw = selectToken(keyword("typed by"), text(":"), node,
						options.declarationFeatureTyping);
				break;
			case CONJUGATION:
				kw = "conjugation";
				kwFormat = options.conjugationKeyword;
				sourceKw = keyword("conjugate");
				targetKw = selectToken(keyword("conjugates"), text("~"), node,
						options.declarationConjugation);
				break;
			case DISJOINING:
				kw = "disjoining";
				kwFormat = options.disjoiningKeyword;
				sourceKw = keyword("disjoint");
				targetKw = keyword("from");
				break;
			case FEATURE_INVERTING:
				kw = "inverting";
				kwFormat = options.invertingKeyword;
				sourceKw = keyword("inverse");
				targetKw = keyword("of");
				break;
			case TYPE_FEATURING:
				kw = "featuring";
				kwFormat = null;
				sourceKw = optionalKeyword(node, "of", options.featuringOfKeyword);
				targetKw = keyword("by");
				break;
			default:
				throw new syside.Unreachable(node.getKind().toString());
		}

		List<Doc> declaration = new ArrayList<>();
		Doc prefix = optionalKeyword(node, kw, kwFormat);
		if (!isEmpty(prefix)) {
			declaration.add(prefix);
		}
		List<Doc> identifiers = Identifiers.printIdentifiers(node, ctx);
		if (!identifiers.isEmpty()) {
			declaration.add(concat(identifiers));
		}

		Element source = ModelPrinter.required(node, node.getSource(), "source");
		Element target = ModelPrinter.required(node, node.getTarget(), "target");
		return concat(
				group(concat(
						group(join(SPACE, declaration)),
						indent(declaration.isEmpty() ? EMPTY : LINE),
						indent(group(concat(
								sourceKw,
								isEmpty(sourceKw) ? EMPTY : SPACE,
								printEnd(source),
								LINE,
								targetKw,
								SPACE,
								printEnd(target)))))),
				printBlock(node));
	}
}
