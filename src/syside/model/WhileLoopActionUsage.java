package syside.model;

import syside.model.expression.Expression;

import java.util.List;

/**
 * {@code while condition { ... } until condition;}, or {@code loop { ... }} when
 * there is no while condition.
 */
public class WhileLoopActionUsage extends Usage {
	private Expression condition;
	private Usage body;
	private Expression until;

	public WhileLoopActionUsage() {
		super(UsageKind.ACTION_SUBTYPE);
	}

	public Expression getCondition() {
		return condition;
	}

	public void setCondition(Expression condition) {
		this.condition = adopt(condition);
	}

	public Usage getBody() {
		return body;
	}

	public void setBody(Usage body) {
		this.body = adopt(body);
	}

	public Expression getUntil() {
		return until;
	}

	public void setUntil(Expression until) {
		this.until = adopt(until);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		for (Element e : new Element[]{condition, body, until}) {
			if (e != null) {
				owned.add(e);
			}
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "WhileLoopActionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
