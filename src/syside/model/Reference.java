package syside.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A possibly qualified name. Parts are kept as written in the source, quotes
 * included. Synthesized references may only have a resolved target.
 */
public class Reference extends Element {
	private final List<String> parts;
	private final Element target;

	public Reference(List<String> parts, Element target) {
		this.parts = parts == null ? Collections.emptyList() : new ArrayList<>(parts);
		this.target = target;
	}

	public List<String> getParts() {
		return parts;
	}

	public Element getTarget() {
		return target;
	}

	@Override
	public List<Element> getOwnedElements() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
