package syside.printer;

import syside.doc.Doc;
import syside.errors.UnprintedNoteIssue;
import syside.errors.WhilePrintingElement;
import syside.model.Element;
import syside.model.Note;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;

import static syside.doc.DocBuilder.*;

/**
 * Places notes around and inside printed elements. Every note goes through
 * {@link #printNote} exactly once so that the context can tell which notes are
 * still missing.
 */
public class NotePrinter {
	/**
	 * Label of inner notes that belong inside a children block.
	 */
	public static final String CHILDREN = "children";

	private final PrintContext ctx;

	public NotePrinter(PrintContext ctx) {
		this.ctx = ctx;
	}

	public Doc printNote(Note note) {
		ctx.markPrinted(note);
		String highlight = ctx.isHighlighting() ? "comment" : null;
		if (note.getKind() == Note.Kind.LINE) {
			return noteText("//" + note.getText(), highlight);
		}
		String[] lines = note.getText().split("\n", -1);
		if (lines.length == 1) {
			return noteText("//*" + note.getText() + "*/", highlight);
		}

		List<Doc> parts = new ArrayList<>();
		if (isStarAligned(lines)) {
			parts.add(noteText("//*" + lines[0].trim(), highlight));
			for (int i = 1; i < lines.length; ++i) {
				parts.add(HARDLINE);
				String trimmed = lines[i].trim();
				boolean last = i == lines.length - 1;
				if (last && trimmed.isEmpty()) {
					parts.add(noteText("  */", highlight));
				} else {
					parts.add(noteText("  " + trimmed + (last ? "*/" : ""), highlight));
				}
			}
			return concat(parts);
		}

		parts.add(noteText("//*" + lines[0], highlight));
		for (int i = 1; i < lines.length; ++i) {
			parts.add(LITERALLINE);
			parts.add(noteText(lines[i] + (i == lines.length - 1 ? "*/" : ""), highlight));
		}
		return markAsRoot(concat(parts));
	}

	private static Doc noteText(String contents, String highlight) {
		return highlight == null ? text(contents) : text(contents, highlight);
	}

	private static boolean isStarAligned(String[] lines) {
		for (int i = 1; i < lines.length; ++i) {
			String trimmed = lines[i].trim();
			if (trimmed.isEmpty() && i == lines.length - 1) {
				continue;
			}
			if (!trimmed.startsWith("*")) {
				return false;
			}
		}
		return true;
	}

	private static boolean hasLabel(Note note, String label) {
		if (label == null || label.equals(CHILDREN)) {
			return note.getLabel() == null || note.getLabel().equals(CHILDREN);
		}
		return label.equals(note.getLabel());
	}

	/**
	 * @return unprinted inner notes of element carrying label, notes without a
	 * label belong to {@link #CHILDREN}
	 */
	public List<Note> innerNotes(Element element, String label) {
		List<Note> notes = new ArrayList<>();
		for (Note note : element.getNotes()) {
			if (note.getPlacement() == Note.Placement.INNER && !ctx.isPrinted(note) && hasLabel(note, label)) {
				notes.add(note);
			}
		}
		return notes;
	}

	/**
	 * Prints notes one after another. Line notes are always followed by a forced
	 * break, block notes by separator.
	 */
	public Doc printInnerNotes(List<Note> notes, Doc separator) {
		if (notes.isEmpty()) {
			return EMPTY;
		}
		List<Doc> parts = new ArrayList<>();
		for (int i = 0; i < notes.size(); ++i) {
			Note note = notes.get(i);
			parts.add(printNote(note));
			if (i + 1 < notes.size()) {
				parts.add(note.getKind() == Note.Kind.LINE ? HARDLINE : separator);
			} else if (note.getKind() == Note.Kind.LINE) {
				parts.add(BREAK_PARENT);
			}
		}
		return concat(parts);
	}

	public Doc printInnerNotes(Element element, String label, Doc separator) {
		return printInnerNotes(innerNotes(element, label), separator);
	}

	/**
	 * Appends inner notes that the element printer did not place. Reports the
	 * first miss of each element kind.
	 */
	public Doc printMissedInnerNotes(Doc doc, Element element) {
		List<Note> missed = new ArrayList<>();
		boolean fromSource = false;
		for (Note note : element.getNotes()) {
			if (note.getPlacement() == Note.Placement.INNER && !ctx.isPrinted(note)) {
				missed.add(note);
				fromSource |= note.getSegment() != null && !note.getSegment().isUnknown();
			}
		}
		if (missed.isEmpty()) {
			return doc;
		}

		// notes attached programmatically can be anywhere, only report notes from source text
		if (fromSource && ctx.shouldWarn(element.getKindName())) {
			UnprintedNoteIssue issue = new UnprintedNoteIssue(element, missed);
			ctx.getLogger().log(Level.WARNING, issue.getMessage());
			ctx.getIssues().withContext(new WhilePrintingElement(element)).warning(issue);
		}

		List<Doc> notes = new ArrayList<>();
		for (Note note : missed) {
			notes.add(printNote(note));
		}
		return inheritLabel(doc, contents -> concat(contents, HARDLINE, join(HARDLINE, notes)));
	}

	/**
	 * Prints leading notes before doc and trailing notes after it.
	 */
	public Doc surround(Doc doc, Element element) {
		List<Doc> leading = new ArrayList<>();
		List<Doc> trailing = new ArrayList<>();
		for (Note note : element.getNotes()) {
			if (note.getPlacement() == Note.Placement.LEADING) {
				leading.add(printNote(note));
				leading.add(leadingSeparator(note));
			} else if (note.getPlacement() == Note.Placement.TRAILING) {
				trailing.addAll(printTrailing(note));
			}
		}
		if (leading.isEmpty() && trailing.isEmpty()) {
			return doc;
		}
		return inheritLabel(doc, contents -> {
			List<Doc> parts = new ArrayList<>(leading);
			parts.add(contents);
			parts.addAll(trailing);
			return concat(parts);
		});
	}

	private static Doc leadingSeparator(Note note) {
		if (note.getKind() == Note.Kind.BLOCK && note.getNewLinesAfter() == 0) {
			return SPACE;
		}
		if (note.getNewLinesAfter() > 1) {
			return concat(HARDLINE, HARDLINE);
		}
		return HARDLINE;
	}

	private List<Doc> printTrailing(Note note) {
		Doc printed = printNote(note);
		if (note.getNewLinesBefore() == 0) {
			if (note.getKind() == Note.Kind.LINE) {
				return Arrays.asList(lineSuffix(concat(SPACE, printed)), BREAK_PARENT);
			}
			return Arrays.asList(SPACE, printed);
		}
		List<Doc> parts = new ArrayList<>();
		parts.add(HARDLINE);
		if (note.getNewLinesBefore() > 1) {
			parts.add(HARDLINE);
		}
		parts.add(printed);
		if (note.getKind() == Note.Kind.LINE) {
			parts.add(BREAK_PARENT);
		}
		return parts;
	}

	/**
	 * @return true if any leading note asks to keep the element as written
	 */
	public static boolean hasFormatIgnore(Element element) {
		if (element.getCst() == null) {
			return false;
		}
		for (Note note : element.getNotes()) {
			if (note.getPlacement() == Note.Placement.LEADING && note.getText().contains("syside-format ignore")) {
				return true;
			}
		}
		return false;
	}
}
