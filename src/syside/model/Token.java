package syside.model;

import syside.util.SourceLocatable;
import syside.util.SourceLocation;

/**
 * A keyword, symbol or name token of an element's concrete syntax.
 */
public class Token extends SourceLocatable {
	private final String text;
	private final SourceLocation location;

	public Token(String text, SourceLocation location) {
		this.text = text;
		this.location = location;
	}

	public String getText() {
		return text;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String toString() {
		return "Token [" + text + "]";
	}
}
