package syside.model;

import java.util.Collections;
import java.util.List;

/**
 * A relationship declared inside a type declaration, e.g. {@code :> Base}.
 * The target is either a {@link Reference} or a {@link FeatureChain}.
 */
public class Heritage extends Element {
	private final HeritageKind kind;
	private final Element target;

	public Heritage(HeritageKind kind, Element target) {
		this.kind = kind;
		this.target = adopt(target);
	}

	public HeritageKind getKind() {
		return kind;
	}

	public Element getTarget() {
		return target;
	}

	@Override
	public List<Element> getOwnedElements() {
		return Collections.singletonList(target);
	}

	@Override
	public String getKindName() {
		return "Heritage(" + kind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
