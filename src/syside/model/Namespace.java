package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An element with members. A namespace without a parent is the root of a document.
 */
public class Namespace extends Element {
	private final List<Reference> prefixes = new ArrayList<>();
	private final List<Relationship> members = new ArrayList<>();

	public List<Reference> getPrefixes() {
		return prefixes;
	}

	public void addPrefix(Reference prefix) {
		prefixes.add(adopt(prefix));
	}

	public List<Relationship> getMembers() {
		return members;
	}

	public void addMember(Relationship member) {
		members.add(adopt(member));
	}

	public boolean isRoot() {
		return getParent() == null;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>(prefixes);
		owned.addAll(members);
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
