package syside.model;

public enum UsageKind {
	REFERENCE("ref", false),
	ATTRIBUTE("attribute", false),
	ENUMERATION("enum", false),
	OCCURRENCE("occurrence", true),
	ITEM("item", true),
	PART("part", true),
	PORT("port", true),
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
	EVENT_OCCURRENCE("event occurrence", true),
	PERFORM_ACTION("perform action", true),
	EXHIBIT_STATE("exhibit state", true),
	INCLUDE_USE_CASE("include use case", true),
	ASSERT_CONSTRAINT("assert constraint", true),
	SATISFY_REQUIREMENT("satisfy requirement", true),
	METADATA("metadata", false),
	// connectors, actions and transitions
	CONNECTOR(null, true),
	CONTROL_NODE(null, true),
	ACTION_SUBTYPE(null, true),
	TRANSITION("transition", true);

	private final String keyword;
	private final boolean occurrence;

	UsageKind(String keyword, boolean occurrence) {
		this.keyword = keyword;
		this.occurrence = occurrence;
	}

	public String getKeyword() {
		return keyword;
	}

	public boolean isOccurrence() {
		return occurrence;
	}
}
