package syside.options;

public enum Presence implements OptionValue {
	ALWAYS("always"),
	NEVER("never");

	private final String optionValue;

	Presence(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
