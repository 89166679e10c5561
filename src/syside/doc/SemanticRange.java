package syside.doc;

import java.util.List;
import java.util.Objects;

/**
 * A highlighted range of the rendered text, offsets are character offsets into it.
 */
public class SemanticRange {
	private final int start;
	private final int end;
	private final String type;
	private final List<String> modifiers;

	public SemanticRange(int start, int end, String type, List<String> modifiers) {
		this.start = start;
		this.end = end;
		this.type = type;
		this.modifiers = modifiers;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public String getType() {
		return type;
	}

	public List<String> getModifiers() {
		return modifiers;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SemanticRange that = (SemanticRange) o;
		return start == that.start && end == that.end && type.equals(that.type) &&
				Objects.equals(modifiers, that.modifiers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end, type, modifiers);
	}

	@Override
	public String toString() {
		return "SemanticRange [start=" + start + ", end=" + end + ", type=" + type + ", modifiers=" + modifiers + "]";
	}
}
