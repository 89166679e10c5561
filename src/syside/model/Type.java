package syside.model;

import syside.model.expression.Expression;

import java.util.ArrayList;
import java.util.List;

public class Type extends Namespace {
	private boolean isAbstract;
	private boolean sufficient;
	private final List<Heritage> heritage = new ArrayList<>();
	private MultiplicityRange multiplicity;
	private Expression result;

	public boolean isAbstract() {
		return isAbstract;
	}

	public void setAbstract(boolean isAbstract) {
		this.isAbstract = isAbstract;
	}

	public boolean isSufficient() {
		return sufficient;
	}

	public void setSufficient(boolean sufficient) {
		this.sufficient = sufficient;
	}

	public List<Heritage> getHeritage() {
		return heritage;
	}

	public void addHeritage(Heritage h) {
		heritage.add(adopt(h));
	}

	public List<Heritage> getSpecializations() {
		List<Heritage> specializations = new ArrayList<>();
		for (Heritage h : heritage) {
			if (h.getKind().isSpecialization()) {
				specializations.add(h);
			}
		}
		return specializations;
	}

	public List<Heritage> getTypeRelationships() {
		List<Heritage> relationships = new ArrayList<>();
		for (Heritage h : heritage) {
			if (!h.getKind().isSpecialization()) {
				relationships.add(h);
			}
		}
		return relationships;
	}

	public MultiplicityRange getMultiplicity() {
		return multiplicity;
	}

	public void setMultiplicity(MultiplicityRange multiplicity) {
		this.multiplicity = adopt(multiplicity);
	}

	/**
	 * @return the result expression of a function-like body, printed last in the body
	 */
	public Expression getResult() {
		return result;
	}

	public void setResult(Expression result) {
		this.result = adopt(result);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>(getPrefixes());
		owned.addAll(heritage);
		if (multiplicity != null) {
			owned.add(multiplicity);
		}
		owned.addAll(getMembers());
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
