package syside.options;

public enum NullExpressionFormat implements OptionValue {
	NULL("null"),
	BRACKETS("brackets");

	private final String optionValue;

	NullExpressionFormat(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
