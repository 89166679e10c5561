package syside.doc;

import java.util.List;

/**
 * A plain sequence of docs printed one after another.
 */
public class Concat extends Doc {
	private final List<Doc> parts;

	public Concat(List<Doc> parts) {
		this.parts = parts;
	}

	public List<Doc> getParts() {
		return parts;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
