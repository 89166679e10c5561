package syside.doc;

/**
 * Flushes pending line suffixes with a hard break.
 */
public class LineSuffixBoundary extends Doc {
	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
