package syside.doc;

/**
 * Forces every enclosing group to break.
 */
public class BreakParent extends Doc {
	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
