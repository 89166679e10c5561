package syside.errors;

import syside.model.Element;

/**
 * An issue raised for a specific element. The element location, if it has one,
 * is appended to the formatted message.
 */
public abstract class ElementIssue extends Issue {
	private final Element element;

	protected ElementIssue(Element element) {
		this.element = element;
	}

	public Element getElement() {
		return element;
	}

	/**
	 * @return " on line L, character: C" with 1-based numbers, or an empty string
	 * for elements without concrete syntax
	 */
	public String getPosition() {
		if (element == null) {
			return "";
		}
		return element.describePosition();
	}
}
