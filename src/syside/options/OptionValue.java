package syside.options;

/**
 * An alternative of a format option, identified in configuration files by its
 * option value.
 */
public interface OptionValue {
	String getOptionValue();
}
