package syside.model.expression;

import syside.model.Element;
import syside.model.ElementVisitor;
import syside.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code { in x; x > 0 }}: parameter and other members followed by a result
 * expression.
 */
public class BodyExpression extends Expression {
	private final List<Relationship> members = new ArrayList<>();
	private Expression result;

	public List<Relationship> getMembers() {
		return members;
	}

	public void addMember(Relationship member) {
		members.add(adopt(member));
	}

	public Expression getResult() {
		return result;
	}

	public void setResult(Expression result) {
		this.result = adopt(result);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>(members);
		if (result != null) {
			owned.add(result);
		}
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
