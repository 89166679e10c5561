package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A relationship declared on its own, e.g. {@code specialization S subtype A specializes B;}.
 */
public class SourceTargetRelationship extends Relationship {
	private final HeritageKind kind;
	private final Element source;
	private final Element target;

	public SourceTargetRelationship(HeritageKind kind, Element source, Element target) {
		this.kind = kind;
		this.source = adopt(source);
		this.target = adopt(target);
	}

	public HeritageKind getKind() {
		return kind;
	}

	public Element getSource() {
		return source;
	}

	public Element getTarget() {
		return target;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		owned.add(source);
		owned.add(target);
		owned.addAll(super.getOwnedElements());
		return owned;
	}

	@Override
	public String getKindName() {
		return "SourceTargetRelationship(" + kind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
