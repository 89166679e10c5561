package syside.errors;

/**
 * Receives the issues raised while options are loaded or a model is printed.
 *
 * Printers report through this instead of throwing when the output can still be
 * produced, e.g. a source comment that had to be appended after its element.
 */
public abstract class IssueContext {

	public enum Severity {
		WARNING,
		ERROR,
	}

	public abstract void report(Severity severity, Issue issue);

	public void error(Issue issue) {
		report(Severity.ERROR, issue);
	}

	public void warning(Issue issue) {
		report(Severity.WARNING, issue);
	}

	/**
	 * @return true if any issue of {@link Severity#ERROR} reached the root context
	 */
	public abstract boolean hasErrors();

	/**
	 * @return a context that wraps every issue reported through it in {@code context}
	 * before passing it on to this one
	 */
	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
