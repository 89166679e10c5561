package syside;

import syside.util.SourceLocation;

/**
 * Text printed for a selection and the source range it replaces.
 */
public class RangePrintResult {
	private final String text;
	private final int level;
	private final SourceLocation range;

	public RangePrintResult(String text, int level, SourceLocation range) {
		this.text = text;
		this.level = level;
		this.range = range;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the indentation level of the first printed line, which the text
	 * itself does not carry
	 */
	public int getLevel() {
		return level;
	}

	public SourceLocation getRange() {
		return range;
	}
}
