package syside.doc;

/**
 * Marks contents with a name. Transparent to the renderer.
 */
public class Label extends Doc {
	private final String name;
	private final Doc contents;

	public Label(String name, Doc contents) {
		this.name = name;
		this.contents = contents;
	}

	public String getName() {
		return name;
	}

	public Doc getContents() {
		return contents;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
