package syside.doc;

/**
 * A node of the layout document. Docs are immutable and may be shared between
 * several parents, the renderer never mutates them.
 */
public abstract class Doc {

	public abstract <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return DocFormatter.format(this);
	}
}
