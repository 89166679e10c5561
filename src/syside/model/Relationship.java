package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of memberships, imports and other relationships that may appear as members
 * of a namespace. Relationships may carry a body of their own annotations.
 */
public abstract class Relationship extends Element {
	private Visibility visibility = Visibility.PUBLIC;
	private final List<Relationship> members = new ArrayList<>();

	public Visibility getVisibility() {
		return visibility;
	}

	public void setVisibility(Visibility visibility) {
		this.visibility = visibility;
	}

	public List<Relationship> getMembers() {
		return members;
	}

	public void addMember(Relationship member) {
		members.add(adopt(member));
	}

	/**
	 * @return the element this relationship introduces into its namespace, if any
	 */
	public Element getElement() {
		return null;
	}

	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>(members);
	}
}
