package syside.printer;

import org.json.JSONObject;
import syside.doc.Doc;
import syside.errors.MissingMemberIssue;
import syside.model.Comment;
import syside.model.Documentation;
import syside.model.Element;
import syside.model.Feature;
import syside.model.Heritage;
import syside.model.HeritageKind;
import syside.model.MetadataFeature;
import syside.model.Note;
import syside.model.OwningMembership;
import syside.model.Reference;
import syside.model.TextualRepresentation;
import syside.model.Token;
import syside.options.DeclarationFormat;
import syside.options.FormatOptions;
import syside.options.KeywordFormat;
import syside.options.MetadataKeyword;
import syside.options.PreservableFormatting;
import syside.options.Presence;
import syside.options.RedefinesFormat;

import java.util.ArrayList;
import java.util.List;

import static syside.doc.DocBuilder.*;

/**
 * Prints comments, documentation, textual representations and metadata
 * features.
 */
public class AnnotationPrinter {
	private static final String BODY = "annotationBody";

	private final ModelPrinter printer;
	private final PrintContext ctx;

	public AnnotationPrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	/**
	 * Prints body as a block comment with every line prefixed by {@code " * "}.
	 *
	 * @param preserveTrailingWhitespace print line breaks as literal lines so
	 *                                   that trailing whitespace is not trimmed
	 */
	static Doc printBody(String body, boolean preserveTrailingWhitespace) {
		Doc linebreak = preserveTrailingWhitespace ? LITERALLINE : HARDLINE;
		List<Doc> parts = new ArrayList<>();
		parts.add(text("/*", BODY));
		parts.add(linebreak);
		for (String line : body.split("\n", -1)) {
			if (line.isEmpty()) {
				parts.add(text(" *", BODY));
			} else {
				parts.add(text(" * ", BODY));
				parts.add(text(line, BODY));
			}
			parts.add(linebreak);
		}
		parts.add(text(" */", BODY));
		// literal lines reset indentation to the enclosing root
		return markAsRoot(concat(parts));
	}

	private List<Doc> printAbout(List<Reference> about, boolean mustBreak) {
		List<Doc> parts = new ArrayList<>();
		if (about.isEmpty()) {
			return parts;
		}
		List<Doc> targets = new ArrayList<>();
		for (Reference target : about) {
			targets.add(printer.print(target));
		}
		parts.add(indent(mustBreak || ctx.getFormat().commentAboutBreak == KeywordFormat.ALWAYS ? HARDLINE : LINE));
		parts.add(group(indent(keyword("about"), indent(LINE, join(concat(COMMA, LINE), targets)))));
		return parts;
	}

	/**
	 * @return true if the optional leading kw should be printed
	 */
	private static boolean startsWithKeyword(Element node, String kw, PreservableFormatting<KeywordFormat> option) {
		return FormatPreservation.resolve(node, option, cst -> cst.startsWith(kw) ? cst.getTokens().get(0) : null,
				token -> token != null ? KeywordFormat.ALWAYS : KeywordFormat.AS_NEEDED) == KeywordFormat.ALWAYS;
	}

	public Doc printComment(Comment node) {
		List<Doc> parts = new ArrayList<>();
		Doc identifiers = Identifiers.printLeadingSpaceIdentifiers(node, ctx);
		List<Reference> about = node.getAbout();
		if (startsWithKeyword(node, "comment", ctx.getFormat().commentKeyword) || node.hasIdentifiers() ||
				!about.isEmpty()) {
			parts.add(keyword("comment"));
			parts.add(indent(identifiers));
		}

		List<Note> inner = printer.notes().innerNotes(node, NotePrinter.CHILDREN);
		boolean mustBreak = !inner.isEmpty() && inner.get(inner.size() - 1).getKind() == Note.Kind.LINE;
		if (!inner.isEmpty()) {
			parts.add(SPACE);
			parts.add(indent(printer.notes().printInnerNotes(inner, LINE)));
		}

		parts.addAll(printAbout(about, mustBreak));

		return concat(
				group(concat(parts)),
				parts.isEmpty() ? EMPTY : HARDLINE,
				printBody(node.getBody(), ctx.getFormat().markdownComments));
	}

	public Doc printDocumentation(Documentation node) {
		List<Doc> parts = new ArrayList<>();
		parts.add(keyword("doc"));
		parts.add(indent(Identifiers.printLeadingSpaceIdentifiers(node, ctx)));

		Doc inner = printer.notes().printInnerNotes(node, NotePrinter.CHILDREN, LINE);
		if (!isEmpty(inner)) {
			parts.add(LINE);
			parts.add(indent(inner));
		}

		return concat(group(concat(parts)), HARDLINE, printBody(node.getBody(), ctx.getFormat().markdownComments));
	}

	/**
	 * Bodies are printed as they are, only the comment delimiters are
	 * normalized.
	 */
	public Doc printTextualRepresentation(TextualRepresentation node) {
		FormatOptions options = ctx.getFormat();
		List<Doc> parts = new ArrayList<>();
		if (node.hasIdentifiers() || startsWithKeyword(node, "rep", options.textualRepresentationKeyword)) {
			parts.add(keyword("rep"));
			parts.add(indent(Identifiers.printLeadingSpaceIdentifiers(node, ctx)));
		}

		List<Doc> declaration = new ArrayList<>();
		declaration.add(group(concat(parts)));
		Doc languageBreak = parts.isEmpty()
				? EMPTY
				: options.textualRepresentationLanguageBreak == KeywordFormat.ALWAYS ? HARDLINE : LINE;
		declaration.add(indent(languageBreak, keyword("language "),
				text(JSONObject.quote(node.getLanguage()), "string")));

		Doc inner = printer.notes().printInnerNotes(node, NotePrinter.CHILDREN, LINE);
		if (!isEmpty(inner)) {
			declaration.add(LINE);
			declaration.add(inner);
		}

		// the body language may be whitespace sensitive
		return concat(group(concat(declaration)), HARDLINE, printBody(node.getBody(), true));
	}

	public Doc printMetadataFeature(MetadataFeature node) {
		MetadataKeyword format = FormatPreservation.resolveKeyword(node, ctx.getFormat().metadataFeatureKeyword,
				"metadata", MetadataKeyword.METADATA, MetadataKeyword.AT);
		List<Doc> prefix = new ArrayList<>();
		prefix.add(format == MetadataKeyword.METADATA ? keyword("metadata ") : text("@"));

		List<Doc> heritage = new ArrayList<>();
		List<Doc> identifiers = Identifiers.printIdentifiers(node, ctx);
		if (!identifiers.isEmpty()) {
			prefix.addAll(identifiers);
			prefix.add(indent(LINE));
			DeclarationFormat typing = FormatPreservation.resolve(node, ctx.getFormat().declarationFeatureTyping,
					cst -> cst.findKeyword(":"),
					token -> token != null ? DeclarationFormat.TOKEN : DeclarationFormat.KEYWORD);
			heritage.add(typing == DeclarationFormat.TOKEN
					? text(": ")
					: keyword(ctx.isSysML() ? "defined by " : "typed by "));
		}
		heritage.add(printer.print(ModelPrinter.required(node, node.getType(), "metadata type")));

		List<Doc> declaration = new ArrayList<>();
		declaration.add(group(concat(group(concat(prefix)), indent(group(concat(heritage))))));
		declaration.addAll(printAbout(node.getAbout(), false));

		return concat(group(concat(declaration)), printMetadataBody(node));
	}

	private Doc printMetadataBody(Feature node) {
		return printer.namespaces().printChildrenBlock(node, node.getMembers(),
				new BlockOptions().insertSpace(true).printer(this::printMetadataBodyElement));
	}

	/**
	 * Features in metadata bodies start with a redefinition that may omit its
	 * keyword and token.
	 */
	private Doc printMetadataBodyElement(Element node, Element previousSibling) {
		if (!(node instanceof OwningMembership) || !(((OwningMembership) node).getElement() instanceof Feature)) {
			return printer.printConstruct(node, previousSibling);
		}
		OwningMembership membership = (OwningMembership) node;
		Feature target = (Feature) membership.getElement();
		List<Heritage> heritage = target.getSpecializations();
		if (heritage.isEmpty() || heritage.get(0).getKind() != HeritageKind.REDEFINITION) {
			throw new MissingMemberIssue(target, "leading redefinition");
		}
		Heritage redefinition = heritage.get(0);
		String kw = ctx.isSysML() ? "ref" : "feature";

		Doc feature = printer.print(target, null, (f, previous) -> {
			RedefinesFormat redefines = FormatPreservation.resolve(f, ctx.getFormat().metadataBodyFeatureRedefines,
					cst -> firstNonKeyword(cst.getTokens(), kw), AnnotationPrinter::classifyRedefines);
			List<Doc> relationships = new ArrayList<>();
			relationships.add(concat(printRedefines(redefines), printer.relationships().printHeritageTarget(redefinition)));
			relationships.addAll(printer.namespaces().printDeclaredRelationships(f, heritage.subList(1, heritage.size()),
					false));

			Presence keywordFormat = FormatPreservation.resolveKeyword(f, ctx.getFormat().metadataBodyFeatureKeyword,
					kw, Presence.ALWAYS, Presence.NEVER);
			List<Doc> parts = new ArrayList<>();
			if (keywordFormat == Presence.ALWAYS) {
				parts.add(keyword(kw));
				parts.add(SPACE);
			}
			parts.add(group(indent(join(LINE, relationships))));
			if (f.getValue() != null) {
				parts.add(SPACE);
				parts.add(printer.print(f.getValue()));
			}
			return concat(group(concat(parts)), printMetadataBody(f));
		});
		return printer.relationships().printWithVisibility(membership, feature);
	}

	private static Token firstNonKeyword(List<Token> tokens, String kw) {
		for (Token token : tokens) {
			if (!token.getText().equals(kw)) {
				return token;
			}
		}
		return null;
	}

	private static RedefinesFormat classifyRedefines(Token token) {
		if (token == null) {
			return RedefinesFormat.NONE;
		}
		switch (token.getText()) {
			case ":>>":
				return RedefinesFormat.TOKEN;
			case "redefines":
				return RedefinesFormat.KEYWORD;
			default:
				return RedefinesFormat.NONE;
		}
	}

	private static Doc printRedefines(RedefinesFormat format) {
		switch (format) {
			case KEYWORD:
				return keyword("redefines ");
			case TOKEN:
				return text(":>> ");
			case NONE:
				return EMPTY;
			default:
				throw new syside.Unreachable();
		}
	}
}
