package syside.printer;

import syside.doc.Doc;
import syside.doc.Text;
import syside.errors.MissingReferenceIssue;
import syside.model.*;
import syside.model.Package;
import syside.model.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import static syside.doc.DocBuilder.*;

/**
 * Names and qualified references.
 */
public class Identifiers {
	private Identifiers() {}

	private static final Pattern BASIC_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public static final String DECLARATION = "declaration";

	/**
	 * @return the highlighting type of names referring to element
	 */
	public static String semanticType(Element element) {
		if (element instanceof Package || (element instanceof Namespace && !(element instanceof Type))) {
			return "namespace";
		}
		if (element instanceof Expression) {
			return "function";
		}
		if (element instanceof Feature) {
			return "property";
		}
		if (element instanceof Type) {
			return "type";
		}
		return "variable";
	}

	/**
	 * Escapes and quotes name unless it is a basic name that is not reserved.
	 */
	public static String quote(String name, PrintContext ctx, boolean forceQuotes) {
		if (!forceQuotes && BASIC_NAME.matcher(name).matches() && !ctx.getKeywords().contains(name)) {
			return name;
		}
		StringBuilder quoted = new StringBuilder("'");
		for (int i = 0; i < name.length(); ++i) {
			char c = name.charAt(i);
			switch (c) {
				case '\'':
					quoted.append("\\'");
					break;
				case '\\':
					quoted.append("\\\\");
					break;
				case '\b':
					quoted.append("\\b");
					break;
				case '\f':
					quoted.append("\\f");
					break;
				case '\t':
					quoted.append("\\t");
					break;
				case '\n':
					quoted.append("\\n");
					break;
				case '\r':
					quoted.append("\\r");
					break;
				default:
					quoted.append(c);
			}
		}
		return quoted.append('\'').toString();
	}

	/**
	 * Reverses {@link #quote}: strips quotes and escapes from a name as written.
	 */
	public static String unquote(String written) {
		if (written.length() < 2 || !written.startsWith("'") || !written.endsWith("'")) {
			return written;
		}
		StringBuilder name = new StringBuilder();
		for (int i = 1; i < written.length() - 1; ++i) {
			char c = written.charAt(i);
			if (c == '\\' && i + 1 < written.length() - 1) {
				char next = written.charAt(++i);
				switch (next) {
					case 'b':
						name.append('\b');
						break;
					case 'f':
						name.append('\f');
						break;
					case 't':
						name.append('\t');
						break;
					case 'n':
						name.append('\n');
						break;
					case 'r':
						name.append('\r');
						break;
					default:
						name.append(next);
				}
			} else {
				name.append(c);
			}
		}
		return name.toString();
	}

	public static Text printIdentifier(String name, PrintContext ctx, String type, boolean forceQuotes,
	                                   String... modifiers) {
		String printed = quote(name, ctx, forceQuotes);
		if (!ctx.isHighlighting() || type == null) {
			return text(printed);
		}
		return text(printed, type, modifiers);
	}

	private static boolean wasQuoted(Element element, String name, PrintContext ctx) {
		if (ctx.getFormat().stripUnnecessaryQuotes || element.getCst() == null) {
			return false;
		}
		String quoted = quote(name, ctx, true);
		for (Token token : element.getCst().getTokens()) {
			if (token.getText().equals(quoted)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Prints the short name in angle brackets followed by the regular name.
	 *
	 * @return an empty list if element has no declared names
	 */
	public static List<Doc> printIdentifiers(Element element, PrintContext ctx) {
		if (!element.hasIdentifiers()) {
			return Collections.emptyList();
		}
		String type = semanticType(element);
		List<Doc> doc = new ArrayList<>();
		String shortName = element.getDeclaredShortName();
		String name = element.getDeclaredName();
		if (shortName != null) {
			doc.add(group(concat(
					text("<"),
					indent(SOFTLINE, printIdentifier(shortName, ctx, type, wasQuoted(element, shortName, ctx),
							DECLARATION)),
					// a broken short name puts the closing bracket on its own line
					ifBreak(HARDLINE_WITHOUT_BREAK_PARENT, EMPTY),
					text(">"))));
			if (name != null) {
				doc.add(SPACE);
			}
		}
		if (name != null) {
			doc.add(printIdentifier(name, ctx, type, wasQuoted(element, name, ctx), DECLARATION));
		}
		return doc;
	}

	/**
	 * Prints identifiers preceded by a space, or nothing if there are none.
	 */
	public static Doc printLeadingSpaceIdentifiers(Element element, PrintContext ctx) {
		List<Doc> ids = printIdentifiers(element, ctx);
		if (ids.isEmpty()) {
			return EMPTY;
		}
		List<Doc> parts = new ArrayList<>();
		parts.add(SPACE);
		parts.addAll(ids);
		return concat(parts);
	}

	/**
	 * Prints a qualified name, allowing breaks before each "::".
	 *
	 * @param scope the element reported when neither text nor target exist
	 */
	public static Doc printReference(Reference reference, Element scope, PrintContext ctx) {
		List<String> parts = reference.getParts();
		Element target = reference.getTarget();
		String type = target != null ? semanticType(target) : null;
		List<Doc> printed = new ArrayList<>();
		if (!parts.isEmpty()) {
			for (String part : parts) {
				String name = unquote(part);
				boolean forceQuotes = !ctx.getFormat().stripUnnecessaryQuotes && part.startsWith("'");
				addPart(printed, printIdentifier(name, ctx, type, forceQuotes));
			}
			return fill(printed);
		}
		if (target == null) {
			throw new MissingReferenceIssue(scope);
		}
		List<String> names = new ArrayList<>();
		for (Element e = target; e != null; e = e.getOwner()) {
			if (e.getName() != null) {
				names.add(0, e.getName());
			}
		}
		if (names.isEmpty()) {
			throw new MissingReferenceIssue(scope);
		}
		for (String name : names) {
			addPart(printed, printIdentifier(name, ctx, type, false));
		}
		return fill(printed);
	}

	private static void addPart(List<Doc> printed, Doc part) {
		if (printed.isEmpty()) {
			printed.add(part);
		} else {
			printed.add(indent(SOFTLINE));
			printed.add(indent(DOUBLE_COLON, part));
		}
	}
}
