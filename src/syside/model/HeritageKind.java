package syside.model;

/**
 * Relationships declared as part of a type declaration, in the order of their
 * textual sections.
 */
public enum HeritageKind {
	SPECIALIZATION(true),
	SUBCLASSIFICATION(true),
	FEATURE_TYPING(true),
	CONJUGATED_PORT_TYPING(true),
	CONJUGATION(true),
	SUBSETTING(true),
	REFERENCE_SUBSETTING(true),
	REDEFINITION(true),
	DISJOINING(false),
	UNIONING(false),
	INTERSECTING(false),
	DIFFERENCING(false),
	FEATURE_CHAINING(false),
	FEATURE_INVERTING(false),
	TYPE_FEATURING(false);

	private final boolean specialization;

	HeritageKind(boolean specialization) {
		this.specialization = specialization;
	}

	/**
	 * @return true for the kinds that are printed in the specialization part of a
	 * declaration, together with the multiplicity
	 */
	public boolean isSpecialization() {
		return specialization;
	}
}
