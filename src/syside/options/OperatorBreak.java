package syside.options;

public enum OperatorBreak implements OptionValue {
	BEFORE("before"),
	AFTER("after");

	private final String optionValue;

	OperatorBreak(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
