package syside.errors;

import syside.model.Element;

/**
 * A reference that has neither a resolved target nor any text to print.
 */
public class MissingReferenceIssue extends ElementIssue {
	public MissingReferenceIssue(Element scope) {
		super(scope);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
