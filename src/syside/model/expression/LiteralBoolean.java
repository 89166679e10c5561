package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.List;

public class LiteralBoolean extends Expression {
	private final boolean value;

	public LiteralBoolean(boolean value) {
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>();
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
