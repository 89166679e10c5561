package syside.errors;

/**
 * An issue together with the activity it was raised in. Wrapping repeatedly
 * builds a chain whose innermost issue is the one the printer reported.
 */
public class IssueWithContext extends Issue {
	private final Issue issue;
	private final Context context;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	/**
	 * @return the issue at the end of the context chain
	 */
	public Issue getRootIssue() {
		Issue current = issue;
		while (current instanceof IssueWithContext) {
			current = ((IssueWithContext) current).getIssue();
		}
		return current;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
