package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;
import syside.model.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code x.metadata}. As the right side of {@code @@} and {@code meta} only the
 * reference is written.
 */
public class MetadataAccessExpression extends Expression {
	private final Reference reference;

	public MetadataAccessExpression(Reference reference) {
		this.reference = adopt(reference);
	}

	public Reference getReference() {
		return reference;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		owned.add(reference);
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
