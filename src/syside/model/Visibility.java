package syside.model;

public enum Visibility {
	PUBLIC("public"),
	PROTECTED("protected"),
	PRIVATE("private");

	private final String keyword;

	Visibility(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
