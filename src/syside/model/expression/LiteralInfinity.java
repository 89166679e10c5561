package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.List;

public class LiteralInfinity extends Expression {
	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>();
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
