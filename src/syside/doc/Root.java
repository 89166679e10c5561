package syside.doc;

/**
 * Makes the current indentation the target of literal lines inside contents.
 */
public class Root extends Doc {
	private final Doc contents;

	public Root(Doc contents) {
		this.contents = contents;
	}

	public Doc getContents() {
		return contents;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
