package syside.printer;

import syside.model.Element;
import syside.model.Note;
import syside.model.Relationship;
import syside.model.Token;
import syside.util.SourceLocation;

import java.util.List;

/**
 * Source extents of elements including their leading and trailing notes.
 */
public class SourceRanges {
	private SourceRanges() {}

	private static boolean isKnown(SourceLocation location) {
		return location != null && !location.isUnknown();
	}

	private static SourceLocation own(Element element) {
		if (element.getCst() != null) {
			return element.getCst().getLocation();
		}
		if (element instanceof Relationship && ((Relationship) element).getElement() != null) {
			return own(((Relationship) element).getElement());
		}
		return SourceLocation.unknown();
	}

	/**
	 * @return the location of the concrete syntax of element, without notes
	 */
	public static SourceLocation location(Element element) {
		return own(element);
	}

	public static SourceLocation start(Element element) {
		for (Note note : element.getNotes()) {
			if (note.getPlacement() == Note.Placement.LEADING && isKnown(note.getSegment())) {
				return note.getSegment();
			}
		}
		return own(element);
	}

	public static SourceLocation end(Element element) {
		List<Note> notes = element.getNotes();
		for (int i = notes.size() - 1; i >= 0; --i) {
			Note note = notes.get(i);
			if (note.getPlacement() == Note.Placement.TRAILING && isKnown(note.getSegment())) {
				return note.getSegment();
			}
		}
		return own(element);
	}

	public static boolean hasSource(Element element) {
		return isKnown(own(element));
	}

	/**
	 * @return the number of line breaks between the end of previous and the start
	 * of next, or -1 if either has no source
	 */
	public static int newLinesBetween(Element previous, Element next) {
		SourceLocation end = end(previous);
		SourceLocation start = start(next);
		if (!isKnown(end) || !isKnown(start)) {
			return -1;
		}
		return Math.max(0, start.getStartLine() - end.getEndLine());
	}

	/**
	 * @return true if child starts on a later line than the last token of owner
	 * before it
	 */
	public static boolean startsOnNewLine(Element owner, Element child) {
		SourceLocation start = own(child);
		if (!isKnown(start) || owner.getCst() == null) {
			return false;
		}
		Token previous = null;
		for (Token token : owner.getCst().getTokens()) {
			if (token.getLocation().getEndOffset() > start.getStartOffset()) {
				break;
			}
			previous = token;
		}
		return previous != null && start.getStartLine() > previous.getLocation().getEndLine();
	}

	/**
	 * @return the combined extent of elements with source, or an unknown location
	 */
	public static SourceLocation extent(List<? extends Element> elements) {
		SourceLocation first = SourceLocation.unknown();
		SourceLocation last = SourceLocation.unknown();
		for (Element element : elements) {
			if (!hasSource(element)) {
				continue;
			}
			if (first.isUnknown()) {
				first = start(element);
			}
			last = end(element);
		}
		if (first.isUnknown()) {
			return first;
		}
		return first.combine(last);
	}
}
