package syside.model;

import syside.model.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [lower..upper]} or {@code [upper]}. When owned through a membership it is
 * printed as a {@code multiplicity} member declaration.
 */
public class MultiplicityRange extends Element {
	private final Expression lower;
	private final Expression upper;

	public MultiplicityRange(Expression lower, Expression upper) {
		this.lower = adopt(lower);
		this.upper = adopt(upper);
	}

	public Expression getLower() {
		return lower;
	}

	public Expression getUpper() {
		return upper;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		if (lower != null) {
			owned.add(lower);
		}
		if (upper != null) {
			owned.add(upper);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
