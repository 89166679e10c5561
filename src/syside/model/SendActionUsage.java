package syside.model;

import syside.model.expression.Expression;

import java.util.List;

public class SendActionUsage extends Usage {
	private Expression payload;
	private Expression sender;
	private Expression receiver;

	public SendActionUsage() {
		super(UsageKind.ACTION_SUBTYPE);
	}

	public Expression getPayload() {
		return payload;
	}

	public void setPayload(Expression payload) {
		this.payload = adopt(payload);
	}

	public Expression getSender() {
		return sender;
	}

	public void setSender(Expression sender) {
		this.sender = adopt(sender);
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
		for (Element e : new Element[]{payload, sender, receiver}) {
			if (e != null) {
				owned.add(e);
			}
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "SendActionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
