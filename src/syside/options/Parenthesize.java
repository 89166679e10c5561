package syside.options;

public enum Parenthesize implements OptionValue {
	ALWAYS("always"),
	NEVER("never"),
	ON_BREAK("on_break");

	private final String optionValue;

	Parenthesize(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
