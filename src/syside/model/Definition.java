package syside.model;

/**
 * A SysML definition.
 */
public class Definition extends Type {
	private final DefinitionKind kind;
	private boolean variation;
	private boolean individual;
	private boolean parallel;

	public Definition(DefinitionKind kind) {
		this.kind = kind;
	}

	public DefinitionKind getKind() {
		return kind;
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

	public boolean isParallel() {
		return parallel;
	}

	public void setParallel(boolean parallel) {
		this.parallel = parallel;
	}

	@Override
	public String getKindName() {
		return "Definition(" + kind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
