package syside.printer;

import syside.doc.Doc;
import syside.doc.Text;
import syside.model.*;
import syside.model.expression.Expression;
import syside.options.DeclarationFormat;
import syside.options.KeywordFormat;
import syside.options.MultiplicityPlacement;
import syside.options.OrderedNonuniquePriority;
import syside.options.PreservableFormatting;
import syside.options.Presence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static syside.doc.DocBuilder.*;

/**
 * Declarations and bodies of namespaces, types and KerML features.
 *
 * A declaration is printed as up to three groups: modifiers with metadata
 * prefixes, the keyword with identifiers and the declared relationships. The
 * outer group breaks between them first.
 */
public class NamespacePrinter {
	private final ModelPrinter printer;
	private final PrintContext ctx;

	public NamespacePrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	// children

	public Doc printChildrenBlock(Element node, List<? extends Element> children, BlockOptions options) {
		if (children.isEmpty() && options.getResult() == null) {
			if (options.isForceEmptyBrackets()) {
				return emptyBrackets(node, options);
			}
			Presence brackets = FormatPreservation.resolveKeyword(node, ctx.getFormat().emptyNamespaceBrackets,
					"{", Presence.ALWAYS, Presence.NEVER);
			return brackets == Presence.ALWAYS ? emptyBrackets(node, options) : emptySemicolon(node, options);
		}

		Doc linebreak = options.isForceBreak() ? HARDLINE : ctx.getFormat().bracketSpacing ? LINE : SOFTLINE;

		List<Doc> printed = options.getPrinter() != null
				? printer.printAll(children, null, options.getPrinter())
				: printer.printAll(children, null);
		Doc joined = options.getJoin() != null
				? options.getJoin().join(children, printed, Collections.<Element>emptyList())
				: join(linebreak, printed);

		if (options.getResult() != null) {
			Element last = children.isEmpty() ? null : children.get(children.size() - 1);
			Doc result = printer.print(options.getResult(), last);
			joined = printed.isEmpty() ? result : concat(joined, linebreak, result);
		}

		List<Doc> contents = new ArrayList<>();
		contents.add(text("{"));
		contents.add(indent(linebreak, joined));
		contents.add(linebreak);
		contents.add(text("}"));

		Element first = children.isEmpty() ? options.getResult() : children.get(0);
		if (SourceRanges.startsOnNewLine(node, first)) {
			contents.add(BREAK_PARENT);
		}

		if (options.isInsertSpace()) {
			return concat(SPACE, concat(contents));
		}
		return concat(contents);
	}

	private Doc emptyBrackets(Element node, BlockOptions options) {
		List<Note> notes = printer.notes().innerNotes(node, NotePrinter.CHILDREN);
		Doc contents;
		if (!notes.isEmpty()) {
			Doc body = printer.notes().printInnerNotes(notes, options.isForceBreak() ? HARDLINE : LINE);
			contents = group(concat(text("{"), indent(LINE, body), LINE, text("}")));
		} else if (options.isForceBreak()) {
			contents = concat(text("{"), HARDLINE, text("}"));
		} else {
			contents = text("{}");
		}
		return options.isInsertSpace() ? concat(SPACE, contents) : contents;
	}

	private Doc emptySemicolon(Element node, BlockOptions options) {
		Doc token = options.getSemicolon() != null ? options.getSemicolon() : SEMICOLON;
		List<Note> notes = printer.notes().innerNotes(node, NotePrinter.CHILDREN);
		if (notes.isEmpty()) {
			return token;
		}
		return group(concat(token, LINE, printer.notes().printInnerNotes(notes, LINE)));
	}

	// declarations

	/**
	 * Prints metadata prefixes {@code #M}, leaving separators to the caller.
	 */
	public List<Doc> printPrefixes(List<Reference> prefixes) {
		List<Doc> printed = new ArrayList<>();
		for (Reference prefix : prefixes) {
			boolean leadingNotes = false;
			for (Note note : prefix.getNotes()) {
				leadingNotes |= note.getPlacement() == Note.Placement.LEADING;
			}
			printed.add(concat(text(leadingNotes ? "# " : "#"), indent(printer.print(prefix))));
		}
		return printed;
	}

	private List<Doc> printLeadingParts(Namespace node, List<Doc> modifiers, String kw) {
		List<Doc> groups = new ArrayList<>();

		List<Doc> prefix = new ArrayList<>(modifiers);
		prefix.addAll(printPrefixes(node.getPrefixes()));
		if (!prefix.isEmpty()) {
			groups.add(indent(fill(joinParts(LINE, prefix))));
		}

		List<Doc> id = new ArrayList<>();
		if (kw != null) {
			id.add(keyword(kw));
		}
		List<Doc> identifiers = Identifiers.printIdentifiers(node, ctx);
		if (!identifiers.isEmpty()) {
			id.add(concat(identifiers));
		}
		if (!id.isEmpty()) {
			groups.add(group(indent(join(SPACE, id))));
		}

		List<Doc> parts = new ArrayList<>();
		switch (groups.size()) {
			case 0:
				break;
			case 1:
				parts.add(groups.get(0));
				break;
			default:
				// relationships break before modifiers and identifiers
				parts.add(group(join(LINE, groups)));
		}
		return parts;
	}

	private static class RelationshipFormat {
		final Text keyword;
		final Text token;
		final PreservableFormatting<DeclarationFormat> format;
		final boolean groupable;
		final Doc separator;
		final boolean merge;

		RelationshipFormat(String keyword, String token, PreservableFormatting<DeclarationFormat> format,
		                   boolean groupable, Doc separator, boolean merge) {
			this.keyword = syside.doc.DocBuilder.keyword(keyword);
			this.token = token == null ? null : text(token);
			this.format = format;
			this.groupable = groupable;
			this.separator = separator;
			this.merge = merge;
		}
	}

	private RelationshipFormat formatOf(Heritage heritage) {
		switch (heritage.getKind()) {
			case CONJUGATED_PORT_TYPING:
				ctx.assertSysML(heritage);
				return new RelationshipFormat("defined by", ":", ctx.getFormat().declarationConjugatedPortTyping,
						true, null, false);
			case CONJUGATION:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("conjugates", "~", ctx.getFormat().declarationConjugation, false,
						null, false);
			case FEATURE_TYPING:
				return new RelationshipFormat(ctx.isSysML() ? "defined by" : "typed by", ":",
						ctx.getFormat().declarationFeatureTyping, true, null, false);
			case REDEFINITION:
				return new RelationshipFormat("redefines", ":>>", ctx.getFormat().declarationRedefinition, true,
						null, false);
			case REFERENCE_SUBSETTING:
				return new RelationshipFormat("references", "::>",
						ctx.getFormat().declarationReferenceSubsetting, false, null, false);
			case SPECIALIZATION:
				return new RelationshipFormat("specializes", ":>", ctx.getFormat().declarationSpecialization, true,
						null, false);
			case SUBCLASSIFICATION:
				return new RelationshipFormat("specializes", ":>", ctx.getFormat().declarationSubclassification,
						true, null, false);
			case SUBSETTING:
				return new RelationshipFormat("subsets", ":>", ctx.getFormat().declarationSubsetting, true, null,
						false);
			case DIFFERENCING:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("differences", null, null, true, null,
						ctx.getFormat().mergeDifferencing);
			case DISJOINING:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("disjoint from", null, null, true, null,
						ctx.getFormat().mergeDeclarationDisjoining);
			case FEATURE_CHAINING:
				// SysML prints chains through the chained elements
				ctx.assertKerML(heritage);
				return new RelationshipFormat("chains", null, null, true, concat(SOFTLINE, DOT),
						ctx.getFormat().mergeFeatureChaining);
			case INTERSECTING:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("intersects", null, null, true, null,
						ctx.getFormat().mergeIntersecting);
			case UNIONING:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("unions", null, null, true, null, ctx.getFormat().mergeUnioning);
			case FEATURE_INVERTING:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("inverse of", null, null, false, null, false);
			case TYPE_FEATURING:
				ctx.assertKerML(heritage);
				return new RelationshipFormat("featured by", null, null, true, null,
						ctx.getFormat().mergeDeclarationTypeFeaturing);
			default:
				throw new syside.Unreachable();
		}
	}

	private Doc selectToken(Type node, Heritage heritage, RelationshipFormat info) {
		if (info.token == null) {
			return info.keyword;
		}
		DeclarationFormat format = FormatPreservation.resolve(node, info.format,
				cst -> declarationToken(node, heritage, info),
				token -> {
					if (token == null) {
						return info.format.getFallback();
					}
					if (token.getText().equals(info.token.getContents())) {
						return DeclarationFormat.TOKEN;
					}
					String kw = info.keyword.getContents();
					if (token.getText().equals(kw) || kw.endsWith(" " + token.getText())) {
						return DeclarationFormat.KEYWORD;
					}
					// most likely a comma
					return info.format.getFallback();
				});
		return format == DeclarationFormat.TOKEN ? info.token : info.keyword;
	}

	private static Token declarationToken(Type node, Heritage heritage, RelationshipFormat info) {
		if (heritage.getCst() != null && !heritage.getCst().getTokens().isEmpty()) {
			Token first = heritage.getCst().getTokens().get(0);
			String text = first.getText();
			if (text.equals(info.token.getContents()) || info.keyword.getContents().startsWith(text)) {
				return first;
			}
		}
		Element located = heritage.getCst() != null ? heritage : heritage.getTarget();
		return FormatPreservation.previousToken(node, located);
	}

	private static class RelationshipGroup {
		Doc token = null;
		final List<Doc> parts = new ArrayList<>();
	}

	/**
	 * Prints relationships of a declaration as once indented groups, joining
	 * consecutive relationships of the same kind with commas.
	 *
	 * @param skipFirstKeyword print the first group without its keyword or token
	 */
	public List<Doc> printDeclaredRelationships(Type node, List<Heritage> heritage, boolean skipFirstKeyword) {
		if (heritage.isEmpty()) {
			return new ArrayList<>();
		}

		Map<HeritageKind, RelationshipGroup> merged = new EnumMap<>(HeritageKind.class);
		List<RelationshipGroup> groups = new ArrayList<>();
		for (int i = 0; i < heritage.size(); ++i) {
			Heritage current = heritage.get(i);
			RelationshipFormat info = formatOf(current);
			Doc token = selectToken(node, current, info);

			RelationshipGroup subgroup;
			if (info.merge) {
				subgroup = merged.computeIfAbsent(current.getKind(), k -> new RelationshipGroup());
			} else if (info.groupable && i > 0 && heritage.get(i - 1).getKind() == current.getKind()) {
				subgroup = groups.get(groups.size() - 1);
			} else {
				subgroup = new RelationshipGroup();
			}

			if (subgroup.parts.isEmpty()) {
				groups.add(subgroup);
				if (i != 0 || !skipFirstKeyword) {
					subgroup.token = token;
				}
			} else if (info.separator != null) {
				subgroup.parts.add(info.separator);
			} else {
				subgroup.parts.add(COMMA);
				subgroup.parts.add(LINE);
			}
			subgroup.parts.add(printer.print(current));
		}

		List<Doc> printed = new ArrayList<>();
		for (int i = 0; i < groups.size(); ++i) {
			RelationshipGroup g = groups.get(i);
			Doc sub = g.token != null
					? group(concat(g.token, indent(LINE, group(concat(g.parts)))))
					: indent(group(concat(g.parts)));
			printed.add(i == 0 ? sub : group(concat(LINE, sub)));
		}
		return printed;
	}

	// multiplicity

	private Doc printBounds(MultiplicityRange range) {
		Expression upper = ModelPrinter.required(range, range.getUpper(), "upper bound");
		Doc bounds;
		if (range.getLower() != null) {
			bounds = concat(printer.print(range.getLower()), text(".."), printer.print(upper));
		} else {
			bounds = printer.print(upper);
		}
		return concat(text("["), indent(SOFTLINE, bounds), SOFTLINE, text("]"));
	}

	/**
	 * Prints the multiplicity of node followed by {@code ordered} and
	 * {@code nonunique}.
	 *
	 * @param node the owning type, may be null for a multiplicity member
	 * @return null if there is nothing to print
	 */
	public Doc printMultiplicityPart(Type node, MultiplicityRange range) {
		Doc printed = range == null ? null : printer.print(range, null, (r, previous) -> printBounds(r));
		return printMultiplicityPart(node, printed);
	}

	private Doc printMultiplicityPart(Type node, Doc range) {
		List<Doc> props = new ArrayList<>();
		if (node instanceof Feature) {
			Feature feature = (Feature) node;
			if (feature.isOrdered()) {
				props.add(keyword("ordered"));
			}
			if (feature.isNonunique()) {
				props.add(keyword("nonunique"));
			}
			if (props.size() > 1) {
				OrderedNonuniquePriority priority = FormatPreservation.resolve(feature,
						ctx.getFormat().orderedNonuniquePriority, NamespacePrinter::firstOrderingKeyword,
						token -> token != null && token.getText().equals("nonunique")
								? OrderedNonuniquePriority.NONUNIQUE
								: OrderedNonuniquePriority.ORDERED);
				if (priority == OrderedNonuniquePriority.NONUNIQUE) {
					Collections.reverse(props);
				}
			}
		}

		if (range == null) {
			if (props.isEmpty()) {
				return null;
			}
			return group(join(SPACE, props));
		}

		Doc printed = range;
		if (!props.isEmpty()) {
			printed = concat(printed, SPACE, join(SPACE, props));
		}
		return group(printed);
	}

	private static Token firstOrderingKeyword(ConcreteSyntax cst) {
		Token ordered = cst.findKeyword("ordered");
		Token nonunique = cst.findKeyword("nonunique");
		if (ordered == null) {
			return nonunique;
		}
		if (nonunique == null) {
			return ordered;
		}
		return ordered.getLocation().getStartOffset() < nonunique.getLocation().getStartOffset()
				? ordered : nonunique;
	}

	public SpecializationGrouper defaultSpecializationGrouper() {
		return node -> {
			MultiplicityPlacement placement = ctx.getFormat().multiplicityPlacement;
			boolean orderedNonunique = node instanceof Feature && ((Feature) node).isOrdered() &&
					((Feature) node).isNonunique();
			if ((node.getMultiplicity() == null && !orderedNonunique) ||
					(!ctx.isSysML() && !(node instanceof Feature))) {
				// KerML types always start with the multiplicity
				placement = MultiplicityPlacement.FIRST;
			}

			List<Heritage> specializations = node.getSpecializations();
			List<List<Heritage>> groups = new ArrayList<>();
			switch (placement) {
				case FIRST_SPECIALIZATION:
					if (!specializations.isEmpty()) {
						groups.add(specializations.subList(0, 1));
						groups.add(specializations.subList(1, specializations.size()));
						return groups;
					}
					// fallthrough
				case FIRST:
					groups.add(Collections.<Heritage>emptyList());
					groups.add(specializations);
					return groups;
				case LAST:
				default:
					groups.add(specializations);
					groups.add(Collections.<Heritage>emptyList());
					return groups;
			}
		};
	}

	/**
	 * Prints the specialization part of a declaration with the multiplicity
	 * attached to the group the grouper puts it after.
	 */
	public List<Doc> printSpecializationPart(Type node, SpecializationGrouper grouper, boolean skipFirstKeyword,
	                                         boolean ignoreMultiplicity) {
		Doc multi = ignoreMultiplicity ? null : printMultiplicityPart(node, node.getMultiplicity());

		boolean skip = skipFirstKeyword;
		List<List<Doc>> groups = new ArrayList<>();
		for (List<Heritage> heritage : grouper.group(node)) {
			List<Doc> printed = printDeclaredRelationships(node, heritage, skip);
			// skipping carries over to the first non-empty group
			skip &= printed.isEmpty();
			groups.add(printed);
		}

		boolean allEmpty = true;
		for (List<Doc> g : groups) {
			allEmpty &= g.isEmpty();
		}
		List<Doc> parts = new ArrayList<>();
		if (allEmpty) {
			if (multi != null) {
				parts.add(indent(multi));
			}
			return parts;
		}

		// multiplicity is usually short, keep it on the line of its neighbour
		if (multi != null) {
			List<Doc> lhs = groups.get(0);
			if (lhs.isEmpty()) {
				List<Doc> rhs = groups.get(1);
				rhs.set(0, concat(multi, LINE, rhs.get(0)));
			} else {
				lhs.set(lhs.size() - 1, concat(lhs.get(lhs.size() - 1), LINE, multi));
			}
		}

		for (List<Doc> g : groups) {
			if (g.isEmpty()) {
				continue;
			}
			List<Doc> contents = new ArrayList<>();
			for (Doc sub : g) {
				contents.add(group(sub));
			}
			parts.add(parts.isEmpty() ? indent(concat(contents)) : indent(LINE, concat(contents)));
		}
		return parts;
	}

	// namespaces

	/**
	 * Prints the declaration of node followed by its children block.
	 */
	public Doc printGenericNamespace(Namespace node, DeclarationOptions options) {
		List<Doc> declaration = printLeadingParts(node, options.getModifiers(), options.getKeyword());

		if (node instanceof Type) {
			Type type = (Type) node;
			SpecializationGrouper grouper = options.getSpecializations() != null
					? options.getSpecializations()
					: defaultSpecializationGrouper();
			List<Doc> specialization = printSpecializationPart(type, grouper,
					options.isSkipFirstSpecializationKeyword(), options.isIgnoreMultiplicity());

			List<Doc> other = printDeclaredRelationships(type, type.getTypeRelationships(), false);
			if (!other.isEmpty()) {
				if (!specialization.isEmpty()) {
					specialization.add(indent(LINE));
				}
				specialization.add(indent(group(concat(other))));
			}

			if (!specialization.isEmpty()) {
				if (!declaration.isEmpty()) {
					declaration.add(indent(LINE));
				}
				declaration.add(group(concat(specialization)));
			}
		}

		if (options.getAppendToDeclaration() != null) {
			if (!declaration.isEmpty()) {
				Doc grouped = group(concat(declaration));
				declaration = new ArrayList<>();
				declaration.add(grouped);
			}
			options.getAppendToDeclaration().accept(declaration);
		}
		if (options.isSkipChildren()) {
			return group(concat(declaration));
		}

		Doc children = printChildrenBlock(node, node.getMembers(), new BlockOptions()
				.result(options.getResult())
				.insertSpace(!declaration.isEmpty())
				.forceEmptyBrackets(options.isForceBrackets())
				.forceBreak(options.isForceBreakChildren())
				.join(options.getJoin()));
		return concat(group(concat(declaration)), children);
	}

	/**
	 * Namespaces and packages.
	 */
	public Doc printNonTypeNamespace(String modifiers, String kw, Namespace node) {
		DeclarationOptions options = new DeclarationOptions().keyword(kw);
		if (modifiers != null) {
			options.modifiers(keyword(modifiers));
		}
		return printGenericNamespace(node, options);
	}

	/**
	 * KerML types that are not features.
	 */
	public Doc printType(Type node, String kw) {
		DeclarationOptions options = new DeclarationOptions()
				.keyword(node.isSufficient() ? kw + " all" : kw)
				.result(node.getResult());
		if (node.isAbstract()) {
			options.modifiers(keyword("abstract"));
		}
		return printGenericNamespace(node, options);
	}

	// features

	public List<Doc> kermlFeatureModifiers(Feature node) {
		List<Doc> modifiers = new ArrayList<>();
		if (node.getDirection() != null) {
			modifiers.add(keyword(node.getDirection().getKeyword()));
		}
		if (node.isAbstract()) {
			modifiers.add(keyword("abstract"));
		}
		// portion implies composite
		if (node.isPortion()) {
			modifiers.add(keyword("portion"));
		} else if (node.isComposite()) {
			modifiers.add(keyword("composite"));
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
		return modifiers;
	}

	/**
	 * @return a suffix printing the value of node after a space
	 */
	public Consumer<List<Doc>> featureValueAppender(Feature node) {
		return declaration -> {
			if (node.getValue() == null) {
				return;
			}
			if (!declaration.isEmpty()) {
				declaration.add(SPACE);
			}
			declaration.add(printer.print(node.getValue()));
		};
	}

	/**
	 * Prints a feature of either language. Unless the options set another suffix,
	 * the feature value is appended to the declaration.
	 */
	public Doc printGenericFeature(List<Doc> modifiers, String kw, Feature node, DeclarationOptions options) {
		options.modifiers(modifiers).keyword(kw);
		if (options.getResult() == null) {
			options.result(node.getResult());
		}
		if (options.getAppendToDeclaration() == null) {
			options.appendToDeclaration(featureValueAppender(node));
		}
		return printGenericNamespace(node, options);
	}

	public Doc printKerMLFeature(Feature node, String kw) {
		return printKerMLFeature(node, kw, new DeclarationOptions());
	}

	public Doc printKerMLFeature(Feature node, String kw, DeclarationOptions options) {
		ctx.assertKerML(node);
		String printed = kw;
		if (node.isSufficient()) {
			printed = kw != null ? kw + " all" : "all";
		}
		return printGenericFeature(kermlFeatureModifiers(node), printed, node, options);
	}

	private static boolean hasExplicitSpecializations(Type node) {
		return !node.getSpecializations().isEmpty();
	}

	public Doc printFeature(Feature node) {
		KeywordFormat format = FormatPreservation.resolveKeyword(node, ctx.getFormat().featureKeyword, "feature",
				KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED);
		String kw = "feature";
		if (format == KeywordFormat.AS_NEEDED && (!node.getPrefixes().isEmpty() || node.isSufficient() ||
				node.hasIdentifiers() || hasExplicitSpecializations(node))) {
			// the declaration already starts a feature
			kw = null;
		}
		return printKerMLFeature(node, kw);
	}

	public Doc printInvariant(Feature node) {
		String kw;
		if (node.isNegated()) {
			kw = "inv false";
		} else {
			Presence format = FormatPreservation.resolveKeyword(node, ctx.getFormat().invariantTrueKeyword, "true",
					Presence.ALWAYS, Presence.NEVER);
			kw = format == Presence.ALWAYS ? "inv true" : "inv";
		}
		return printKerMLFeature(node, kw);
	}

	/**
	 * Prints a KerML {@code multiplicity} member.
	 */
	public Doc printMultiplicityMember(MultiplicityRange node) {
		ctx.assertKerML(node);
		Doc part = printMultiplicityPart(null, printBounds(node));
		return concat(
				group(concat(
						keyword("multiplicity"),
						indent(Identifiers.printLeadingSpaceIdentifiers(node, ctx)),
						SPACE,
						indent(part))),
				printChildrenBlock(node, Collections.<Element>emptyList(), new BlockOptions().insertSpace(true)));
	}
}
