package syside.model;

/**
 * The flavour of an owning membership, deciding the keyword printed before the
 * owned element.
 */
public enum MembershipKind {
	MEMBER(null),
	FEATURE(null),
	VARIANT("variant"),
	RETURN("return"),
	ENTRY("entry"),
	DO("do"),
	EXIT("exit"),
	FRAMED_CONCERN("frame"),
	REQUIRE("require"),
	ASSUME("assume"),
	VERIFY("verify"),
	ACTOR("actor"),
	SUBJECT("subject"),
	STAKEHOLDER("stakeholder"),
	OBJECTIVE("objective");

	private final String keyword;

	MembershipKind(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}

	public boolean isStateSubaction() {
		return this == ENTRY || this == DO || this == EXIT;
	}
}
