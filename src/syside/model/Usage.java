package syside.model;

import syside.model.expression.Expression;

import java.util.List;

/**
 * A SysML usage. Subclasses cover connectors, actions and transitions.
 */
public class Usage extends Feature {
	private final UsageKind kind;
	private boolean reference;
	private boolean variation;
	private boolean individual;
	private PortionKind portionKind;
	private boolean parallel;
	private Expression satisfactionSubject;

	public Usage(UsageKind kind) {
		super(FeatureKind.FEATURE);
		this.kind = kind;
	}

	public UsageKind getKind() {
		return kind;
	}

	/**
	 * @return true if the usage was declared with an explicit {@code ref}
	 */
	public boolean isReference() {
		return reference;
	}

	public void setReference(boolean reference) {
		this.reference = reference;
	}

	public boolean isVariation() {
		return variation;
	}

	public void setVariation(boolean variation) {
		this.variation = variation;
	}

	public boolean isIndividual() {
		return individual;
	}

	public void setIndividual(boolean individual) {
		this.individual = individual;
	}

	public PortionKind getPortionKind() {
		return portionKind;
	}

	public void setPortionKind(PortionKind portionKind) {
		this.portionKind = portionKind;
	}

	public boolean isParallel() {
		return parallel;
	}

	public void setParallel(boolean parallel) {
		this.parallel = parallel;
	}

	/**
	 * @return the {@code by} expression of a satisfy requirement usage
	 */
	public Expression getSatisfactionSubject() {
		return satisfactionSubject;
	}

	public void setSatisfactionSubject(Expression satisfactionSubject) {
		this.satisfactionSubject = adopt(satisfactionSubject);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		if (satisfactionSubject != null) {
			owned.add(satisfactionSubject);
		}
		return owned;
	}

	@Override
	public String getKindName() {
		return "Usage(" + kind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
