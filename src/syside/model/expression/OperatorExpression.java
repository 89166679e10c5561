package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An expression applying an operator to its arguments.
 *
 * Binary operators have two arguments, the conditional has three (test, then and
 * else) and unary operators one. Right-hand arguments of {@code .}, {@code .?} and
 * collect are {@link FeatureReferenceExpression}s or {@link BodyExpression}s.
 */
public class OperatorExpression extends Expression {
	private final Operator operator;
	private final List<Expression> arguments = new ArrayList<>();

	public OperatorExpression(Operator operator, List<? extends Expression> arguments) {
		this.operator = operator;
		adoptAll(this.arguments, arguments);
	}

	public Operator getOperator() {
		return operator;
	}

	public List<Expression> getArguments() {
		return Collections.unmodifiableList(arguments);
	}

	public boolean isUnary() {
		return arguments.size() == 1;
	}

	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>(arguments);
	}

	@Override
	public String getKindName() {
		return "OperatorExpression(" + operator + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
