package syside.options;

import syside.errors.Issue;

/**
 * Thrown when format options or printer settings cannot be loaded.
 */
public class FormatOptionException extends Exception {
	private static final long serialVersionUID = 4211947301786290187L;

	private final Issue issue;

	public FormatOptionException(Issue issue) {
		super(issue.getMessage());
		this.issue = issue;
	}

	public FormatOptionException(Issue issue, Throwable cause) {
		super(issue.getMessage(), cause);
		this.issue = issue;
	}

	public Issue getIssue() {
		return issue;
	}
}
