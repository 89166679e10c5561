package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;
import syside.model.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code f(a, b = c)} or one of the arrow forms: {@code x->f(a)}, {@code x->f { ... }}
 * and {@code x->f g}. Arrow invocations have a target.
 */
public class InvocationExpression extends Expression {
	private final Reference function;
	private Expression target;
	private final List<Argument> arguments = new ArrayList<>();
	private BodyExpression body;
	private Reference functionReference;

	public InvocationExpression(Reference function) {
		this.function = adopt(function);
	}

	public Reference getFunction() {
		return function;
	}

	public Expression getTarget() {
		return target;
	}

	public void setTarget(Expression target) {
		this.target = adopt(target);
	}

	public boolean isArrow() {
		return target != null;
	}

	public List<Argument> getArguments() {
		return arguments;
	}

	public void addArgument(Argument argument) {
		arguments.add(adopt(argument));
	}

	public BodyExpression getBody() {
		return body;
	}

	public void setBody(BodyExpression body) {
		this.body = adopt(body);
	}

	public Reference getFunctionReference() {
		return functionReference;
	}

	public void setFunctionReference(Reference functionReference) {
		this.functionReference = adopt(functionReference);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		if (target != null) {
			owned.add(target);
		}
		owned.add(function);
		owned.addAll(arguments);
		if (body != null) {
			owned.add(body);
		}
		if (functionReference != null) {
			owned.add(functionReference);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
