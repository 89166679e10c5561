package syside.options;

/**
 * Keyword ({@code specializes}) or token ({@code :>}) spelling of a declared relationship.
 */
public enum DeclarationFormat implements OptionValue {
	KEYWORD("keyword"),
	TOKEN("token");

	private final String optionValue;

	DeclarationFormat(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
