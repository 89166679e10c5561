package syside.model;

import syside.util.SourceLocation;

/**
 * A free-floating comment attached to an element. Notes are not elements of the
 * model and never change its meaning.
 */
public class Note {
	public enum Kind {
		LINE,
		BLOCK,
	}

	public enum Placement {
		LEADING,
		INNER,
		TRAILING,
	}

	private final Kind kind;
	private final String text;
	private final Placement placement;
	private final String label;
	private final SourceLocation segment;
	private final int newLinesBefore;
	private final int newLinesAfter;

	/**
	 * @param text the note text without the leading "//" or the surrounding "//*" and "*&#47;"
	 * @param label printer specific position inside the element, only used by inner notes
	 * @param newLinesBefore number of line breaks between the preceding token and this note
	 * @param newLinesAfter number of line breaks between this note and the following token
	 */
	public Note(Kind kind, String text, Placement placement, String label, SourceLocation segment,
	            int newLinesBefore, int newLinesAfter) {
		this.kind = kind;
		this.text = text;
		this.placement = placement;
		this.label = label;
		this.segment = segment;
		this.newLinesBefore = newLinesBefore;
		this.newLinesAfter = newLinesAfter;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public Placement getPlacement() {
		return placement;
	}

	public String getLabel() {
		return label;
	}

	public SourceLocation getSegment() {
		return segment;
	}

	public int getNewLinesBefore() {
		return newLinesBefore;
	}

	public int getNewLinesAfter() {
		return newLinesAfter;
	}

	@Override
	public String toString() {
		return "Note [" + kind + " " + placement + (label != null ? " #" + label : "") + ": " + text + "]";
	}
}
