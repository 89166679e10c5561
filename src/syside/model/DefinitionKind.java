package syside.model;

public enum DefinitionKind {
	ATTRIBUTE("attribute", false),
	ENUMERATION("enum", false),
	OCCURRENCE("occurrence", true),
	ITEM("item", true),
	PART("part", true),
	PORT("port", true),
	CONNECTION("connection", true),
	FLOW("flow", true),
	INTERFACE("interface", true),
	ALLOCATION("allocation", true),
	ACTION("action", true),
	STATE("state", true),
	CALCULATION("calc", true),
	CONSTRAINT("constraint", true),
	REQUIREMENT("requirement", true),
	CONCERN("concern", true),
	CASE("case", true),
	ANALYSIS_CASE("analysis", true),
	VERIFICATION_CASE("verification", true),
	USE_CASE("use case", true),
	VIEW("view", true),
	VIEWPOINT("viewpoint", true),
	RENDERING("rendering", true),
	METADATA("metadata", false);

	private final String keyword;
	private final boolean occurrence;

	DefinitionKind(String keyword, boolean occurrence) {
		this.keyword = keyword;
		this.occurrence = occurrence;
	}

	/**
	 * @return the keyword before {@code def}
	 */
	public String getKeyword() {
		return keyword;
	}

	public boolean isOccurrence() {
		return occurrence;
	}
}
