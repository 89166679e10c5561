package syside.doc;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Literal text, optionally tagged with a semantic highlighting type and modifiers.
 */
public class Text extends Doc {
	private final String contents;
	private final String type;
	private final List<String> modifiers;

	public Text(String contents) {
		this(contents, null, Collections.emptyList());
	}

	public Text(String contents, String type, List<String> modifiers) {
		this.contents = contents;
		this.type = type;
		this.modifiers = modifiers;
	}

	public String getContents() {
		return contents;
	}

	public String getType() {
		return type;
	}

	public List<String> getModifiers() {
		return modifiers;
	}

	public int getWidth() {
		return contents.codePointCount(0, contents.length());
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Text text = (Text) o;
		return contents.equals(text.contents) && Objects.equals(type, text.type) &&
				Objects.equals(modifiers, text.modifiers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(contents, type, modifiers);
	}
}
