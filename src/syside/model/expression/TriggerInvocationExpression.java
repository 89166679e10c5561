package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code when cond}, {@code at time} or {@code after delay}, used as the payload
 * value of accept actions.
 */
public class TriggerInvocationExpression extends Expression {
	public enum Kind {
		WHEN,
		AT,
		AFTER;

		public String getKeyword() {
			return name().toLowerCase();
		}
	}

	private final Kind kind;
	private final Expression argument;

	public TriggerInvocationExpression(Kind kind, Expression argument) {
		this.kind = kind;
		this.argument = adopt(argument);
	}

	public Kind getKind() {
		return kind;
	}

	public Expression getArgument() {
		return argument;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		if (argument != null) {
			owned.add(argument);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
