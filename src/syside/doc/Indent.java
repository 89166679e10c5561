package syside.doc;

public class Indent extends Doc {
	private final Doc contents;

	public Indent(Doc contents) {
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
