package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One end of a connector. An end without a reference is implied by the context,
 * e.g. the source of a {@code then} succession shorthand.
 */
public class ConnectorEnd extends Element {
	private final Element reference;
	private MultiplicityRange multiplicity;

	public ConnectorEnd(String name, Element reference) {
		setDeclaredName(name);
		this.reference = adopt(reference);
	}

	public Element getReference() {
		return reference;
	}

	public boolean isExplicit() {
		return reference != null;
	}

	public MultiplicityRange getMultiplicity() {
		return multiplicity;
	}

	public void setMultiplicity(MultiplicityRange multiplicity) {
		this.multiplicity = adopt(multiplicity);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		if (multiplicity != null) {
			owned.add(multiplicity);
		}
		if (reference != null) {
			owned.add(reference);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
