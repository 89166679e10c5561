package syside.model;

/**
 * A KerML classifier.
 */
public class Classifier extends Type {
	private final ClassifierKind kind;

	public Classifier(ClassifierKind kind) {
		this.kind = kind;
	}

	public ClassifierKind getKind() {
		return kind;
	}

	@Override
	public String getKindName() {
		return "Classifier(" + kind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
