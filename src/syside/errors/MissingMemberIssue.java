package syside.errors;

import syside.model.Element;

/**
 * A required member of an element is missing, e.g. the target of an assignment.
 */
public class MissingMemberIssue extends ElementIssue {
	private final String member;

	public MissingMemberIssue(Element element, String member) {
		super(element);
		this.member = member;
	}

	public String getMember() {
		return member;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
