package syside.errors;

public class UnknownFormatOptionIssue extends Issue {
	private final String key;

	public UnknownFormatOptionIssue(String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
