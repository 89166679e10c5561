package syside.errors;

public class InvalidFormatOptionIssue extends Issue {
	private final String key;
	private final String value;
	private final String expected;
	private final String reason;

	public InvalidFormatOptionIssue(String key, String value, String expected) {
		this.key = key;
		this.value = value;
		this.expected = expected;
		this.reason = null;
	}

	public InvalidFormatOptionIssue(String key, String reason) {
		this.key = key;
		this.value = null;
		this.expected = null;
		this.reason = reason;
	}

	public String getKey() {
		return key;
	}

	/**
	 * @return the rejected value, null if the issue only has a reason
	 */
	public String getValue() {
		return value;
	}

	public String getExpected() {
		return expected;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
