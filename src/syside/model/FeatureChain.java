package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A dotted chain of feature references, e.g. {@code a.b.c}.
 */
public class FeatureChain extends Element {
	private final List<Reference> chainings = new ArrayList<>();

	public FeatureChain(List<Reference> chainings) {
		adoptAll(this.chainings, chainings);
	}

	public List<Reference> getChainings() {
		return chainings;
	}

	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>(chainings);
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
