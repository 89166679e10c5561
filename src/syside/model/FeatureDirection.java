package syside.model;

public enum FeatureDirection {
	IN("in"),
	OUT("out"),
	INOUT("inout");

	private final String keyword;

	FeatureDirection(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
