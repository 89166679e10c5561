package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;
import syside.model.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * A positional or named ({@code name = value}) invocation argument.
 */
public class Argument extends Element {
	private final Reference name;
	private final Expression value;

	public Argument(Reference name, Expression value) {
		this.name = adopt(name);
		this.value = adopt(value);
	}

	public Reference getParameter() {
		return name;
	}

	public boolean isNamed() {
		return name != null;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		if (name != null) {
			owned.add(name);
		}
		if (value != null) {
			owned.add(value);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
