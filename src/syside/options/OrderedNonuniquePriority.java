package syside.options;

/**
 * Which of {@code ordered} and {@code nonunique} is printed first.
 */
public enum OrderedNonuniquePriority implements OptionValue {
	ORDERED("ordered"),
	NONUNIQUE("nonunique");

	private final String optionValue;

	OrderedNonuniquePriority(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
