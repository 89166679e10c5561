package syside.errors;

public class NestedIssueContext extends IssueContext {

	private final IssueContext outer;
	private final Context context;

	NestedIssueContext(IssueContext outer, Context context) {
		this.outer = outer;
		this.context = context;
	}

	@Override
	public void report(Severity severity, Issue issue) {
		outer.report(severity, issue.withContext(context));
	}

	@Override
	public boolean hasErrors() {
		return outer.hasErrors();
	}

}
