package syside.model;

public enum ControlNodeKind {
	DECISION("decide"),
	FORK("fork"),
	JOIN("join"),
	MERGE("merge");

	private final String keyword;

	ControlNodeKind(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
