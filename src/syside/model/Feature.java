package syside.model;

import java.util.List;

public class Feature extends Type {
	private final FeatureKind featureKind;
	private FeatureDirection direction;
	private boolean composite;
	private boolean portion;
	private boolean readonly;
	private boolean derived;
	private boolean end;
	private boolean ordered;
	private boolean nonunique;
	private boolean negated;
	private FeatureValue value;

	public Feature(FeatureKind featureKind) {
		this.featureKind = featureKind;
	}

	public FeatureKind getFeatureKind() {
		return featureKind;
	}

	public FeatureDirection getDirection() {
		return direction;
	}

	public void setDirection(FeatureDirection direction) {
		this.direction = direction;
	}

	public boolean isComposite() {
		return composite;
	}

	public void setComposite(boolean composite) {
		this.composite = composite;
	}

	public boolean isPortion() {
		return portion;
	}

	public void setPortion(boolean portion) {
		this.portion = portion;
	}

	public boolean isReadonly() {
		return readonly;
	}

	public void setReadonly(boolean readonly) {
		this.readonly = readonly;
	}

	public boolean isDerived() {
		return derived;
	}

	public void setDerived(boolean derived) {
		this.derived = derived;
	}

	public boolean isEnd() {
		return end;
	}

	public void setEnd(boolean end) {
		this.end = end;
	}

	public boolean isOrdered() {
		return ordered;
	}

	public void setOrdered(boolean ordered) {
		this.ordered = ordered;
	}

	public boolean isNonunique() {
		return nonunique;
	}

	public void setNonunique(boolean nonunique) {
		this.nonunique = nonunique;
	}

	/**
	 * @return true for {@code inv false} invariants, {@code assert not} constraints
	 * and {@code not satisfy} requirements
	 */
	public boolean isNegated() {
		return negated;
	}

	public void setNegated(boolean negated) {
		this.negated = negated;
	}

	public FeatureValue getValue() {
		return value;
	}

	public void setValue(FeatureValue value) {
		this.value = adopt(value);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		if (value != null) {
			owned.add(value);
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "Feature(" + featureKind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
