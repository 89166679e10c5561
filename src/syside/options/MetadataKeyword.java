package syside.options;

public enum MetadataKeyword implements OptionValue {
	AT("@"),
	METADATA("metadata");

	private final String optionValue;

	MetadataKeyword(String optionValue) {
		this.optionValue = optionValue;
	}

	@Override
	public String getOptionValue() {
		return optionValue;
	}
}
