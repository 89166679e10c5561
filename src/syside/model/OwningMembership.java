package syside.model;

import java.util.ArrayList;
import java.util.List;

public class OwningMembership extends Relationship {
	private final MembershipKind kind;
	private final Element element;

	public OwningMembership(MembershipKind kind, Element element) {
		this.kind = kind;
		this.element = adopt(element);
	}

	public MembershipKind getKind() {
		return kind;
	}

	@Override
	public Element getElement() {
		return element;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		owned.add(element);
		owned.addAll(super.getOwnedElements());
		return owned;
	}

	@Override
	public String getKindName() {
		return kind == MembershipKind.MEMBER ? "OwningMembership" : "OwningMembership(" + kind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
