package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A string literal. The value is unescaped.
 */
public class LiteralString extends Expression {
	private final String value;

	public LiteralString(String value) {
		this.value = value;
	}

	public String getValue() {
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
