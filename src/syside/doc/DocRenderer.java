package syside.doc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lays out a {@link Doc} within the configured line width.
 *
 * The renderer walks an explicit command stack of (indentation, mode, doc). Groups
 * are measured against the remaining width together with everything that follows
 * them up to the next possible line break in break mode.
 */
public class DocRenderer {

	private enum Mode {
		BREAK,
		FLAT,
	}

	private static final class Indentation {
		final String value;
		final int length;
		final Indentation root;

		Indentation(String value, int length, Indentation root) {
			this.value = value;
			this.length = length;
			this.root = root;
		}
	}

	private static final class Command {
		final Indentation indent;
		final Mode mode;
		final Doc doc;

		Command(Indentation indent, Mode mode, Doc doc) {
			this.indent = indent;
			this.mode = mode;
			this.doc = doc;
		}
	}

	private final PrinterConfig config;
	private final Text lineEnd;
	private final Map<Group, Boolean> broken = new IdentityHashMap<>();
	private final Map<String, Mode> groupModeMap = new HashMap<>();
	private final List<Command> stack = new ArrayList<>();
	private final List<Command> lineSuffixes = new ArrayList<>();
	private final List<Text> out = new ArrayList<>();
	private int position = 0;
	private boolean shouldRemeasure = false;

	private DocRenderer(PrinterConfig config) {
		this.config = config;
		this.lineEnd = new Text(config.getLineEnd());
	}

	public static PrintResult render(Doc doc, PrinterConfig config) {
		DocRenderer renderer = new DocRenderer(config);
		renderer.propagateBreaks(doc);
		renderer.format(doc);
		return renderer.collect();
	}

	public static String print(Doc doc, PrinterConfig config) {
		return render(doc, config).getText();
	}

	public static String print(Doc doc) {
		return print(doc, PrinterConfig.defaults());
	}

	private boolean isBroken(Group group) {
		return group.shouldBreak() || broken.getOrDefault(group, false);
	}

	private Indentation makeIndent(Indentation indentation) {
		StringBuilder value = new StringBuilder(indentation.value);
		if (config.useSpaces()) {
			for (int i = 0; i < config.getTabWidth(); ++i) {
				value.append(' ');
			}
		} else {
			value.append('\t');
		}
		return new Indentation(value.toString(), indentation.length + config.getTabWidth(), indentation.root);
	}

	private void push(Indentation indent, Mode mode, Doc doc) {
		stack.add(new Command(indent, mode, doc));
	}

	private Command pop() {
		return stack.remove(stack.size() - 1);
	}

	// break propagation

	private void propagateBreaks(Doc doc) {
		doc.accept(new BreakPropagationVisitor());
	}

	private final class BreakPropagationVisitor extends DocVisitor<Boolean, RuntimeException> {
		@Override
		public Boolean visit(Text text) {
			return false;
		}

		@Override
		public Boolean visit(Concat concat) {
			return visitAll(concat.getParts());
		}

		@Override
		public Boolean visit(Line line) {
			return false;
		}

		@Override
		public Boolean visit(Group group) {
			Boolean known = broken.get(group);
			if (known != null) {
				return known || group.shouldBreak();
			}
			boolean inner = group.getContents().accept(this);
			broken.put(group, inner);
			return inner || group.shouldBreak();
		}

		@Override
		public Boolean visit(Indent indent) {
			return indent.getContents().accept(this);
		}

		@Override
		public Boolean visit(IndentIfBreak indentIfBreak) {
			return indentIfBreak.getContents().accept(this);
		}

		@Override
		public Boolean visit(IfBreak ifBreak) {
			boolean onBreak = ifBreak.getOnBreak().accept(this);
			boolean onFlat = ifBreak.getOnFlat().accept(this);
			return onBreak || onFlat;
		}

		@Override
		public Boolean visit(Fill fill) {
			return visitAll(fill.getParts());
		}

		@Override
		public Boolean visit(Label label) {
			return label.getContents().accept(this);
		}

		@Override
		public Boolean visit(Root root) {
			return root.getContents().accept(this);
		}

		@Override
		public Boolean visit(BreakParent breakParent) {
			return true;
		}

		@Override
		public Boolean visit(LineSuffix lineSuffix) {
			return lineSuffix.getContents().accept(this);
		}

		@Override
		public Boolean visit(LineSuffixBoundary lineSuffixBoundary) {
			return false;
		}

		private boolean visitAll(List<Doc> docs) {
			boolean result = false;
			for (Doc doc : docs) {
				// every part has to be visited so that nested groups are marked
				if (doc.accept(this)) {
					result = true;
				}
			}
			return result;
		}
	}

	// measuring

	private boolean fits(Command next, List<Command> restCommands, int width, boolean mustBeFlat) {
		if (width == Integer.MAX_VALUE) {
			return true;
		}
		FitsVisitor visitor = new FitsVisitor(width, mustBeFlat, !lineSuffixes.isEmpty());
		int restIdx = restCommands.size();
		visitor.commands.add(next);
		while (visitor.width >= 0) {
			if (visitor.commands.isEmpty()) {
				if (restIdx == 0) {
					return true;
				}
				visitor.commands.add(restCommands.get(--restIdx));
				continue;
			}
			Command command = visitor.commands.remove(visitor.commands.size() - 1);
			visitor.current = command;
			Boolean result = command.doc.accept(visitor);
			if (result != null) {
				return result;
			}
		}
		return false;
	}

	/**
	 * Returns true or false once the outcome of a fit check is known, null to keep
	 * measuring.
	 */
	private final class FitsVisitor extends DocVisitor<Boolean, RuntimeException> {
		final List<Command> commands = new ArrayList<>();
		final boolean mustBeFlat;
		int width;
		boolean hasLineSuffix;
		Command current;

		FitsVisitor(int width, boolean mustBeFlat, boolean hasLineSuffix) {
			this.width = width;
			this.mustBeFlat = mustBeFlat;
			this.hasLineSuffix = hasLineSuffix;
		}

		private void pushAll(List<Doc> docs) {
			for (int i = docs.size() - 1; i >= 0; --i) {
				commands.add(new Command(current.indent, current.mode, docs.get(i)));
			}
		}

		@Override
		public Boolean visit(Text text) {
			width -= text.getWidth();
			if (width < 0) {
				return false;
			}
			return null;
		}

		@Override
		public Boolean visit(Concat concat) {
			pushAll(concat.getParts());
			return null;
		}

		@Override
		public Boolean visit(Line line) {
			if (current.mode == Mode.BREAK || line.isHard()) {
				return true;
			}
			if (line.getMode() != Line.Mode.SOFT) {
				width--;
			}
			return null;
		}

		@Override
		public Boolean visit(Group group) {
			boolean groupBroken = isBroken(group);
			if (mustBeFlat && groupBroken) {
				return false;
			}
			commands.add(new Command(current.indent, groupBroken ? Mode.BREAK : Mode.FLAT, group.getContents()));
			return null;
		}

		@Override
		public Boolean visit(Indent indent) {
			commands.add(new Command(makeIndent(current.indent), current.mode, indent.getContents()));
			return null;
		}

		@Override
		public Boolean visit(IndentIfBreak indentIfBreak) {
			commands.add(new Command(current.indent, current.mode, indentIfBreak.getContents()));
			return null;
		}

		@Override
		public Boolean visit(IfBreak ifBreak) {
			Mode groupMode = ifBreak.getGroupId() != null
					? groupModeMap.getOrDefault(ifBreak.getGroupId(), Mode.FLAT)
					: current.mode;
			Doc contents = groupMode == Mode.BREAK ? ifBreak.getOnBreak() : ifBreak.getOnFlat();
			commands.add(new Command(current.indent, current.mode, contents));
			return null;
		}

		@Override
		public Boolean visit(Fill fill) {
			pushAll(fill.getParts());
			return null;
		}

		@Override
		public Boolean visit(Label label) {
			commands.add(new Command(current.indent, current.mode, label.getContents()));
			return null;
		}

		@Override
		public Boolean visit(Root root) {
			commands.add(new Command(current.indent, current.mode, root.getContents()));
			return null;
		}

		@Override
		public Boolean visit(BreakParent breakParent) {
			return false;
		}

		@Override
		public Boolean visit(LineSuffix lineSuffix) {
			hasLineSuffix = true;
			return null;
		}

		@Override
		public Boolean visit(LineSuffixBoundary lineSuffixBoundary) {
			if (hasLineSuffix) {
				return false;
			}
			return null;
		}
	}

	// output

	/**
	 * Removes trailing spaces and tabs from the output.
	 *
	 * @return the number of removed characters
	 */
	private int trim() {
		int trimmed = 0;
		while (!out.isEmpty()) {
			int index = out.size() - 1;
			Text last = out.get(index);
			String contents = last.getContents();
			int end = contents.length();
			while (end > 0 && (contents.charAt(end - 1) == ' ' || contents.charAt(end - 1) == '\t')) {
				end--;
			}
			trimmed += contents.length() - end;
			if (end > 0) {
				if (end != contents.length()) {
					out.set(index, new Text(contents.substring(0, end), last.getType(), last.getModifiers()));
				}
				break;
			}
			out.remove(index);
		}
		return trimmed;
	}

	private void format(Doc doc) {
		FormatVisitor visitor = new FormatVisitor();
		push(new Indentation("", 0, null), Mode.BREAK, doc);
		while (!stack.isEmpty()) {
			visitor.current = pop();
			visitor.current.doc.accept(visitor);

			if (stack.isEmpty() && !lineSuffixes.isEmpty()) {
				flushLineSuffixes();
			}
		}

		if (config.addFinalNewline()) {
			boolean endsWithNewline = false;
			for (int i = out.size() - 1; i >= 0; --i) {
				String contents = out.get(i).getContents();
				if (!contents.isEmpty()) {
					endsWithNewline = contents.endsWith(config.getLineEnd());
					break;
				}
			}
			if (!endsWithNewline) {
				out.add(new Text(config.getLineEnd()));
			}
		}
	}

	private void flushLineSuffixes() {
		List<Command> suffixes = new ArrayList<>(lineSuffixes);
		Collections.reverse(suffixes);
		stack.addAll(suffixes);
		lineSuffixes.clear();
	}

	private final class FormatVisitor extends DocVisitor<Void, RuntimeException> {
		Command current;

		@Override
		public Void visit(Text text) {
			out.add(text);
			position += text.getWidth();
			return null;
		}

		@Override
		public Void visit(Concat concat) {
			List<Doc> parts = concat.getParts();
			for (int i = parts.size() - 1; i >= 0; --i) {
				push(current.indent, current.mode, parts.get(i));
			}
			return null;
		}

		@Override
		public Void visit(Line line) {
			if (current.mode == Mode.FLAT) {
				if (line.getMode() == Line.Mode.AUTO) {
					out.add(DocBuilder.SPACE);
					position++;
					return null;
				}
				if (line.getMode() == Line.Mode.SOFT) {
					return null;
				}
				shouldRemeasure = true;
			}

			if (!lineSuffixes.isEmpty()) {
				push(current.indent, current.mode, line);
				flushLineSuffixes();
				return null;
			}

			if (line.getMode() == Line.Mode.LITERAL) {
				out.add(new Text(config.getLineEnd()));
				position = 0;
				Indentation root = current.indent.root;
				if (root != null && root.length > 0) {
					out.add(new Text(root.value));
					position = root.length;
				}
				return null;
			}

			trim();
			out.add(lineEnd);
			position = 0;
			if (current.indent.length > 0) {
				out.add(new Text(current.indent.value));
				position = current.indent.length;
			}
			return null;
		}

		@Override
		public Void visit(Group group) {
			Indentation indent = current.indent;
			if (current.mode == Mode.FLAT && !shouldRemeasure) {
				push(indent, isBroken(group) ? Mode.BREAK : Mode.FLAT, group.getContents());
			} else {
				shouldRemeasure = false;
				Command next = new Command(indent, Mode.FLAT, group.getContents());
				int remainder = config.getLineWidth() - position;
				if (!isBroken(group) && fits(next, stack, remainder, false)) {
					stack.add(next);
				} else {
					push(indent, Mode.BREAK, group.getContents());
				}
			}
			if (group.getId() != null) {
				groupModeMap.put(group.getId(), stack.get(stack.size() - 1).mode);
			}
			return null;
		}

		@Override
		public Void visit(Indent indent) {
			push(makeIndent(current.indent), current.mode, indent.getContents());
			return null;
		}

		@Override
		public Void visit(IndentIfBreak indentIfBreak) {
			Mode groupMode = groupModeOf(indentIfBreak.getGroupId());
			boolean indented = (groupMode == Mode.BREAK) != indentIfBreak.isNegated();
			Doc contents = indentIfBreak.getContents();
			push(current.indent, current.mode, indented ? new Indent(contents) : contents);
			return null;
		}

		@Override
		public Void visit(IfBreak ifBreak) {
			Mode groupMode = groupModeOf(ifBreak.getGroupId());
			push(current.indent, current.mode, groupMode == Mode.FLAT ? ifBreak.getOnFlat() : ifBreak.getOnBreak());
			return null;
		}

		private Mode groupModeOf(String groupId) {
			if (groupId == null) {
				return current.mode;
			}
			return groupModeMap.getOrDefault(groupId, current.mode);
		}

		@Override
		public Void visit(Fill fill) {
			List<Doc> parts = fill.getParts();
			if (parts.isEmpty()) {
				return null;
			}
			Indentation indent = current.indent;
			int remainder = config.getLineWidth() - position;
			Doc content = parts.get(0);

			Command flatContent = new Command(indent, Mode.FLAT, content);
			Command breakContent = new Command(indent, Mode.BREAK, content);
			boolean flatContentFits = fits(flatContent, Collections.emptyList(), remainder, true);

			if (parts.size() == 1) {
				stack.add(flatContentFits ? flatContent : breakContent);
				return null;
			}

			Doc whitespace = parts.get(1);
			Command flatWs = new Command(indent, Mode.FLAT, whitespace);
			Command breakWs = new Command(indent, Mode.BREAK, whitespace);
			if (parts.size() == 2) {
				if (flatContentFits) {
					stack.add(flatWs);
					stack.add(flatContent);
				} else {
					stack.add(breakWs);
					stack.add(breakContent);
				}
				return null;
			}

			List<Doc> rest = parts.subList(2, parts.size());
			Command remaining = new Command(indent, current.mode, new Fill(rest));
			Doc secondContent = rest.get(0);
			Command combinedFlatContent = new Command(indent, Mode.FLAT,
					DocBuilder.concat(content, whitespace, secondContent));
			boolean combinedFits = fits(combinedFlatContent, Collections.emptyList(), remainder, true);

			stack.add(remaining);
			if (combinedFits) {
				stack.add(flatWs);
				stack.add(flatContent);
			} else {
				stack.add(breakWs);
				stack.add(flatContentFits ? flatContent : breakContent);
			}
			return null;
		}

		@Override
		public Void visit(Label label) {
			push(current.indent, current.mode, label.getContents());
			return null;
		}

		@Override
		public Void visit(Root root) {
			Indentation indent = current.indent;
			push(new Indentation(indent.value, indent.length, indent), current.mode, root.getContents());
			return null;
		}

		@Override
		public Void visit(BreakParent breakParent) {
			return null;
		}

		@Override
		public Void visit(LineSuffix lineSuffix) {
			lineSuffixes.add(new Command(current.indent, current.mode, lineSuffix.getContents()));
			return null;
		}

		@Override
		public Void visit(LineSuffixBoundary lineSuffixBoundary) {
			if (!lineSuffixes.isEmpty()) {
				push(current.indent, current.mode, DocBuilder.HARDLINE_WITHOUT_BREAK_PARENT);
			}
			return null;
		}
	}

	private PrintResult collect() {
		StringBuilder text = new StringBuilder();
		List<SemanticRange> highlighting = new ArrayList<>();
		for (Text part : out) {
			if (config.isHighlighting() && part.getType() != null && !part.getContents().isEmpty()) {
				highlighting.add(new SemanticRange(text.length(), text.length() + part.getContents().length(),
						part.getType(), part.getModifiers()));
			}
			text.append(part.getContents());
		}
		return new PrintResult(text.toString(), highlighting);
	}
}
