package syside.doc;

/**
 * Contents deferred until just before the next line break, used for trailing line
 * notes.
 */
public class LineSuffix extends Doc {
	private final Doc contents;

	public LineSuffix(Doc contents) {
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
