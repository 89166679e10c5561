package syside.model;

import syside.model.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code filter <condition>;} member of a package.
 */
public class ElementFilterMembership extends Relationship {
	private final Expression condition;

	public ElementFilterMembership(Expression condition) {
		this.condition = adopt(condition);
	}

	public Expression getCondition() {
		return condition;
	}

	@Override
	public Element getElement() {
		return condition;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		owned.add(condition);
		owned.addAll(super.getOwnedElements());
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
