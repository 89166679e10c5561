package syside.model;

import java.util.ArrayList;
import java.util.List;

public class Alias extends Relationship {
	private final Reference target;

	public Alias(String name, String shortName, Reference target) {
		setDeclaredName(name);
		setDeclaredShortName(shortName);
		this.target = adopt(target);
	}

	public Reference getTarget() {
		return target;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		owned.add(target);
		owned.addAll(super.getOwnedElements());
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
