package syside.options;

import java.util.Objects;

/**
 * A format option that either always picks the same alternative or preserves the
 * alternative found in the source, using the fallback for elements without
 * concrete syntax.
 */
public final class PreservableFormatting<T extends Enum<T> & OptionValue> {
	public static final String PRESERVE = "preserve";

	private final T value;
	private final T fallback;

	private PreservableFormatting(T value, T fallback) {
		this.value = value;
		this.fallback = fallback;
	}

	public static <T extends Enum<T> & OptionValue> PreservableFormatting<T> preserve(T fallback) {
		return new PreservableFormatting<>(null, Objects.requireNonNull(fallback));
	}

	public static <T extends Enum<T> & OptionValue> PreservableFormatting<T> fixed(T value) {
		return new PreservableFormatting<>(Objects.requireNonNull(value), value);
	}

	public static <T extends Enum<T> & OptionValue> PreservableFormatting<T> of(T value, T fallback) {
		return new PreservableFormatting<>(value, Objects.requireNonNull(fallback));
	}

	public boolean isPreserve() {
		return value == null;
	}

	/**
	 * @return the fixed alternative, or null when preserving
	 */
	public T getValue() {
		return value;
	}

	public T getFallback() {
		return fallback;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PreservableFormatting<?> that = (PreservableFormatting<?>) o;
		return Objects.equals(value, that.value) && Objects.equals(fallback, that.fallback);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, fallback);
	}

	@Override
	public String toString() {
		return "{default: " + (value == null ? PRESERVE : value.getOptionValue()) +
				", fallback: " + fallback.getOptionValue() + "}";
	}
}
