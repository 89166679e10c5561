package syside.doc;

/**
 * Indents contents only if the group identified by groupId was broken, or only if
 * it was flat when negated.
 */
public class IndentIfBreak extends Doc {
	private final Doc contents;
	private final String groupId;
	private final boolean negate;

	public IndentIfBreak(Doc contents, String groupId, boolean negate) {
		this.contents = contents;
		this.groupId = groupId;
		this.negate = negate;
	}

	public Doc getContents() {
		return contents;
	}

	public String getGroupId() {
		return groupId;
	}

	public boolean isNegated() {
		return negate;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
