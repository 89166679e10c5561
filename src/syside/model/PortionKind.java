package syside.model;

public enum PortionKind {
	SNAPSHOT("snapshot"),
	TIMESLICE("timeslice");

	private final String keyword;

	PortionKind(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
