package syside.options;

/**
 * Formatting of real literals that no longer match their source text.
 */
public enum LiteralRealFormat implements OptionValue {
	EXP("exp"),
	PREC("prec"),
	NONE("none");

	private final String optionValue;

	LiteralRealFormat(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
