package syside.model;

import syside.model.expression.Expression;

import java.util.Collections;
import java.util.List;

/**
 * {@code = expr}, {@code := expr} or {@code default [=|:=] expr}.
 */
public class FeatureValue extends Element {
	private final Expression expression;
	private final boolean isDefault;
	private final boolean initial;

	public FeatureValue(Expression expression, boolean isDefault, boolean initial) {
		this.expression = adopt(expression);
		this.isDefault = isDefault;
		this.initial = initial;
	}

	public Expression getExpression() {
		return expression;
	}

	public boolean isDefault() {
		return isDefault;
	}

	public boolean isInitial() {
		return initial;
	}

	@Override
	public List<Element> getOwnedElements() {
		return Collections.singletonList(expression);
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
