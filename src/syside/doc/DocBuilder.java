package syside.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class DocBuilder {
	private DocBuilder() {}

	public static final String KEYWORD = "keyword";

	public static final Text EMPTY = new Text("");
	public static final Text SPACE = new Text(" ");
	public static final Text DOT = new Text(".");
	public static final Text COMMA = new Text(",");
	public static final Text SEMICOLON = new Text(";");
	public static final Text DOUBLE_COLON = new Text("::");

	public static final Line LINE = new Line(Line.Mode.AUTO);
	public static final Line SOFTLINE = new Line(Line.Mode.SOFT);
	public static final Line HARDLINE_WITHOUT_BREAK_PARENT = new Line(Line.Mode.HARD);
	public static final Line LITERALLINE_WITHOUT_BREAK_PARENT = new Line(Line.Mode.LITERAL);
	public static final BreakParent BREAK_PARENT = new BreakParent();
	public static final LineSuffixBoundary LINE_SUFFIX_BOUNDARY = new LineSuffixBoundary();
	public static final Doc HARDLINE = new Concat(Arrays.asList(HARDLINE_WITHOUT_BREAK_PARENT, BREAK_PARENT));
	public static final Doc LITERALLINE = new Concat(Arrays.asList(LITERALLINE_WITHOUT_BREAK_PARENT, BREAK_PARENT));

	// text

	public static Text text(String contents) {
		return new Text(contents);
	}

	public static Text text(String contents, String type, String... modifiers) {
		return new Text(contents, type, Arrays.asList(modifiers));
	}

	public static Text keyword(String contents) {
		return new Text(contents, KEYWORD, Collections.emptyList());
	}

	// composition

	public static Doc concat(Doc... parts) {
		return new Concat(Arrays.asList(parts));
	}

	public static Doc concat(List<? extends Doc> parts) {
		return new Concat(new ArrayList<>(parts));
	}

	public static Group group(Doc contents) {
		return new Group(contents, null, false);
	}

	public static Group group(Doc contents, String id) {
		return new Group(contents, id, false);
	}

	public static Group group(Doc contents, String id, boolean shouldBreak) {
		return new Group(contents, id, shouldBreak);
	}

	public static Indent indent(Doc contents) {
		return new Indent(contents);
	}

	public static Indent indent(Doc... contents) {
		return new Indent(concat(contents));
	}

	public static IndentIfBreak indentIfBreak(Doc contents, String groupId) {
		return new IndentIfBreak(contents, groupId, false);
	}

	public static IndentIfBreak indentIfBreak(Doc contents, String groupId, boolean negate) {
		return new IndentIfBreak(contents, groupId, negate);
	}

	public static IfBreak ifBreak(Doc onBreak, Doc onFlat) {
		return new IfBreak(onBreak, onFlat, null);
	}

	public static IfBreak ifBreak(Doc onBreak, Doc onFlat, String groupId) {
		return new IfBreak(onBreak, onFlat, groupId);
	}

	public static Fill fill(List<? extends Doc> parts) {
		return new Fill(new ArrayList<>(parts));
	}

	public static Fill fill(Doc... parts) {
		return fill(Arrays.asList(parts));
	}

	/**
	 * Returns a fill of left's parts followed by items if left is a fill, otherwise a
	 * new fill starting with left.
	 */
	public static Fill appendFill(Doc left, Doc... items) {
		List<Doc> parts = new ArrayList<>();
		if (left instanceof Fill) {
			parts.addAll(((Fill) left).getParts());
		} else {
			parts.add(left);
		}
		parts.addAll(Arrays.asList(items));
		return new Fill(parts);
	}

	public static Doc unwrapIndent(Doc doc) {
		if (doc instanceof Indent) {
			return ((Indent) doc).getContents();
		}
		return doc;
	}

	public static Doc label(String name, Doc contents) {
		if (name == null) {
			return contents;
		}
		return new Label(name, contents);
	}

	public static String getLabel(Doc doc) {
		if (doc instanceof Label) {
			return ((Label) doc).getName();
		}
		return null;
	}

	/**
	 * Applies contents to the doc under a label and re-applies the same label.
	 */
	public static Doc inheritLabel(Doc doc, Function<Doc, Doc> contents) {
		if (doc instanceof Label) {
			Label l = (Label) doc;
			return new Label(l.getName(), contents.apply(l.getContents()));
		}
		return contents.apply(doc);
	}

	/**
	 * Literal lines inside contents continue at the current indentation instead of
	 * the first column.
	 */
	public static Root markAsRoot(Doc contents) {
		return new Root(contents);
	}

	public static LineSuffix lineSuffix(Doc contents) {
		return new LineSuffix(contents);
	}

	public static List<Doc> joinParts(Doc separator, List<? extends Doc> docs) {
		List<Doc> joined = new ArrayList<>();
		for (Doc doc : docs) {
			if (!joined.isEmpty()) {
				joined.add(separator);
			}
			joined.add(doc);
		}
		return joined;
	}

	public static Doc join(Doc separator, List<? extends Doc> docs) {
		return new Concat(joinParts(separator, docs));
	}

	/**
	 * Wraps contents in round brackets, indenting the contents.
	 */
	public static Doc parens(Doc contents) {
		return concat(text("("), indent(contents), text(")"));
	}

	public static boolean isEmpty(Doc doc) {
		if (doc instanceof Text) {
			return ((Text) doc).getContents().isEmpty();
		}
		if (doc instanceof Concat) {
			for (Doc part : ((Concat) doc).getParts()) {
				if (!isEmpty(part)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}
}
