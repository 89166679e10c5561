package syside.doc;

/**
 * Prints onBreak or onFlat depending on the mode of the enclosing group, or of the
 * group with groupId if one is given.
 */
public class IfBreak extends Doc {
	private final Doc onBreak;
	private final Doc onFlat;
	private final String groupId;

	public IfBreak(Doc onBreak, Doc onFlat, String groupId) {
		this.onBreak = onBreak;
		this.onFlat = onFlat;
		this.groupId = groupId;
	}

	public Doc getOnBreak() {
		return onBreak;
	}

	public Doc getOnFlat() {
		return onFlat;
	}

	public String getGroupId() {
		return groupId;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
