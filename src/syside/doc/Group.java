package syside.doc;

/**
 * Contents that are laid out either completely flat or completely broken. The
 * optional id lets {@link IfBreak} and {@link IndentIfBreak} look up the mode the
 * group was rendered in.
 */
public class Group extends Doc {
	private final Doc contents;
	private final String id;
	private final boolean shouldBreak;

	public Group(Doc contents, String id, boolean shouldBreak) {
		this.contents = contents;
		this.id = id;
		this.shouldBreak = shouldBreak;
	}

	public Doc getContents() {
		return contents;
	}

	public String getId() {
		return id;
	}

	public boolean shouldBreak() {
		return shouldBreak;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
