package syside.model;

public enum FeatureKind {
	FEATURE("feature"),
	STEP("step"),
	EXPRESSION("expr"),
	BOOLEAN_EXPRESSION("bool"),
	INVARIANT("inv");

	private final String keyword;

	FeatureKind(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
