package syside.util;

/**
 * Anything that can be traced back to a range of its source document: tokens,
 * concrete syntax nodes and the elements built from them.
 */
public abstract class SourceLocatable {

	/**
	 * @return the source range, {@link SourceLocation#unknown()} for synthesized nodes
	 */
	public abstract SourceLocation getLocation();

	public boolean hasKnownLocation() {
		SourceLocation location = getLocation();
		return location != null && !location.isUnknown();
	}

	/**
	 * @return " on line L, character: C" with 1-based numbers, or "" without a location
	 */
	public String describePosition() {
		if (!hasKnownLocation()) {
			return "";
		}
		SourceLocation location = getLocation();
		return " on line " + (location.getStartLine() + 1) + ", character: " + (location.getStartColumn() + 1);
	}

}
