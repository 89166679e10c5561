package syside.printer;

import syside.model.Element;
import syside.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Sibling elements to reprint for a selection, with the source range their
 * printed text replaces.
 */
public class ElementRange {
	private final List<Element> elements;
	private final SourceLocation range;
	private final int level;
	private final List<Element> leading;
	private final boolean unformatted;

	public ElementRange(List<Element> elements, SourceLocation range, int level, List<Element> leading,
	                    boolean unformatted) {
		this.elements = elements;
		this.range = range;
		this.level = level;
		this.leading = leading != null ? leading : Collections.<Element>emptyList();
		this.unformatted = unformatted;
	}

	public List<Element> getElements() {
		return elements;
	}

	public SourceLocation getRange() {
		return range;
	}

	/**
	 * @return the indentation level of the elements
	 */
	public int getLevel() {
		return level;
	}

	/**
	 * @return siblings before the elements that are not reprinted
	 */
	public List<Element> getLeading() {
		return leading;
	}

	public Element getPreviousSibling() {
		return leading.isEmpty() ? null : leading.get(leading.size() - 1);
	}

	/**
	 * @return true if only the space between the elements is formatted, which
	 * happens when the selection lies between two siblings
	 */
	public boolean isUnformatted() {
		return unformatted;
	}
}
