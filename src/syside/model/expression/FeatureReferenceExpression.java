package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A reference to a feature used as an expression. Without a target it is a self
 * reference, which prints as nothing, e.g. the left side of {@code istype T}.
 */
public class FeatureReferenceExpression extends Expression {
	private final Element target;

	public FeatureReferenceExpression(Element target) {
		this.target = adopt(target);
	}

	/**
	 * @return a {@link syside.model.Reference}, a {@link syside.model.FeatureChain}
	 * or null
	 */
	public Element getTarget() {
		return target;
	}

	public boolean isSelfReference() {
		return target == null;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		if (target != null) {
			owned.add(target);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
