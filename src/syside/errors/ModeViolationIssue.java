package syside.errors;

import syside.model.Element;
import syside.options.LanguageMode;

/**
 * An element that only exists in one language was printed in the other.
 */
public class ModeViolationIssue extends ElementIssue {
	private final LanguageMode required;

	public ModeViolationIssue(Element element, LanguageMode required) {
		super(element);
		this.required = required;
	}

	public LanguageMode getRequired() {
		return required;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
