package syside.options;

/**
 * Where a multiplicity goes relative to the specializations of a declaration.
 */
public enum MultiplicityPlacement implements OptionValue {
	FIRST("first"),
	FIRST_SPECIALIZATION("first-specialization"),
	LAST("last");

	private final String optionValue;

	MultiplicityPlacement(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
