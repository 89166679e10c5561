package syside.model;

import syside.model.expression.Expression;

import java.util.List;

/**
 * {@code accept payload via receiver}. The payload is a parameter declaration,
 * possibly with a trigger value.
 */
public class AcceptActionUsage extends Usage {
	private Usage payload;
	private Expression receiver;

	public AcceptActionUsage() {
		super(UsageKind.ACTION_SUBTYPE);
	}

	public Usage getPayload() {
		return payload;
	}

	public void setPayload(Usage payload) {
		this.payload = adopt(payload);
	}

	public Expression getReceiver() {
		return receiver;
	}

	public void setReceiver(Expression receiver) {
		this.receiver = adopt(receiver);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		if (payload != null) {
			owned.add(payload);
		}
		if (receiver != null) {
			owned.add(receiver);
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "AcceptActionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
