package syside.model;

public enum ClassifierKind {
	CLASSIFIER("classifier"),
	CLASS("class"),
	DATA_TYPE("datatype"),
	STRUCTURE("struct"),
	ASSOCIATION("assoc"),
	ASSOCIATION_STRUCTURE("assoc struct"),
	BEHAVIOR("behavior"),
	FUNCTION("function"),
	PREDICATE("predicate"),
	INTERACTION("interaction"),
	METACLASS("metaclass");

	private final String keyword;

	ClassifierKind(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}
