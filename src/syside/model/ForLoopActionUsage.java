package syside.model;

import syside.model.expression.Expression;

import java.util.List;

public class ForLoopActionUsage extends Usage {
	private Usage variable;
	private Expression sequence;
	private Usage body;

	public ForLoopActionUsage() {
		super(UsageKind.ACTION_SUBTYPE);
	}

	public Usage getVariable() {
		return variable;
	}

	public void setVariable(Usage variable) {
		this.variable = adopt(variable);
	}

	public Expression getSequence() {
		return sequence;
	}

	public void setSequence(Expression sequence) {
		this.sequence = adopt(sequence);
	}

	public Usage getBody() {
		return body;
	}

	public void setBody(Usage body) {
		this.body = adopt(body);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		for (Element e : new Element[]{variable, sequence, body}) {
			if (e != null) {
				owned.add(e);
			}
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "ForLoopActionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
