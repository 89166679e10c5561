package syside.model;

import syside.model.expression.Expression;

import java.util.List;

/**
 * A transition in a state body or a guarded succession in an action body.
 *
 * The source is null for the shorthand forms that start from the preceding
 * sibling. The target is the element after {@code then}, or after {@code else}
 * for default transitions.
 */
public class TransitionUsage extends Usage {
	private Element source;
	private AcceptActionUsage accepter;
	private Expression guard;
	private Usage effect;
	private Element target;
	private boolean isElse;

	public TransitionUsage() {
		super(UsageKind.TRANSITION);
	}

	public Element getSource() {
		return source;
	}

	public void setSource(Element source) {
		this.source = adopt(source);
	}

	public AcceptActionUsage getAccepter() {
		return accepter;
	}

	public void setAccepter(AcceptActionUsage accepter) {
		this.accepter = adopt(accepter);
	}

	public Expression getGuard() {
		return guard;
	}

	public void setGuard(Expression guard) {
		this.guard = adopt(guard);
	}

	public Usage getEffect() {
		return effect;
	}

	public void setEffect(Usage effect) {
		this.effect = adopt(effect);
	}

	public Element getTarget() {
		return target;
	}

	public void setTarget(Element target) {
		this.target = adopt(target);
	}

	public boolean isElse() {
		return isElse;
	}

	public void setElse(boolean isElse) {
		this.isElse = isElse;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		for (Element e : new Element[]{source, accepter, guard, effect, target}) {
			if (e != null) {
				owned.add(e);
			}
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "TransitionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
