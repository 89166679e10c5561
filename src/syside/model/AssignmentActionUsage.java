package syside.model;

import syside.model.expression.Expression;

import java.util.List;

/**
 * {@code assign target := value}. The target is a {@link Reference} or a
 * {@link FeatureChain}.
 */
public class AssignmentActionUsage extends Usage {
	private Element target;
	private Expression value;

	public AssignmentActionUsage() {
		super(UsageKind.ACTION_SUBTYPE);
	}

	public Element getTarget() {
		return target;
	}

	public void setTarget(Element target) {
		this.target = adopt(target);
	}

	public Expression getAssignedValue() {
		return value;
	}

	public void setAssignedValue(Expression value) {
		this.value = adopt(value);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		if (target != null) {
			owned.add(target);
		}
		if (value != null) {
			owned.add(value);
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "AssignmentActionUsage";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
