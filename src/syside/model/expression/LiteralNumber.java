package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.List;

public class LiteralNumber extends Expression {
	private final double value;
	private final boolean integer;

	public LiteralNumber(double value, boolean integer) {
		this.value = value;
		this.integer = integer;
	}

	public double getValue() {
		return value;
	}

	public boolean isInteger() {
		return integer;
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
