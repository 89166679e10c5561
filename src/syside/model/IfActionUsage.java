package syside.model;

import syside.model.expression.Expression;

import java.util.List;

/**
 * {@code if condition { ... } else ...}. The else clause is either another
 * {@link IfActionUsage} or an action body.
 */
public class IfActionUsage extends Usage {
	private Expression condition;
	private Usage thenBody;
	private Usage elseBody;

	public IfActionUsage() {
		super(UsageKind.ACTION_SUBTYPE);
	}

	public Expression getCondition() {
		return condition;
	}

	public void setCondition(Expression condition) {
		this.condition = adopt(condition);
	}

	public Usage getThenBody() {
		return thenBody;
	}

	public void setThenBody(Usage thenBody) {
		this.thenBody = adopt(thenBody);
	}

	public Usage getElseBody() {
		return elseBody;
	}

	public void setElseBody(Usage elseBody) {
		this.elseBody = adopt(elseBody);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		for (Element e : new Element[]{condition, thenBody, elseBody}) {
			if (e != null) {
				owned.add(e);
			}
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "IfActionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
