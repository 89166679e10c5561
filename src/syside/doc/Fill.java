package syside.doc;

import java.util.List;

/**
 * Alternating content and separator parts. Separators are broken one at a time,
 * only where the following content would not fit.
 */
public class Fill extends Doc {
	private final List<Doc> parts;

	public Fill(List<Doc> parts) {
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
