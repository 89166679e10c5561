package syside.options;

/**
 * Whether an optional keyword is always printed or only where the syntax needs it.
 */
public enum KeywordFormat implements OptionValue {
	ALWAYS("always"),
	AS_NEEDED("as_needed");

	private final String optionValue;

	KeywordFormat(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
