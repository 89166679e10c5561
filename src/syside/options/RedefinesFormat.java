package syside.options;

public enum RedefinesFormat implements OptionValue {
	KEYWORD("keyword"),
	TOKEN("token"),
	NONE("none");

	private final String optionValue;

	RedefinesFormat(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
