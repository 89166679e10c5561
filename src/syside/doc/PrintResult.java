package syside.doc;

import java.util.List;

public class PrintResult {
	private final String text;
	private final List<SemanticRange> highlighting;

	public PrintResult(String text, List<SemanticRange> highlighting) {
		this.text = text;
		this.highlighting = highlighting;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return ranges in ascending order, empty unless highlighting was enabled
	 */
	public List<SemanticRange> getHighlighting() {
		return highlighting;
	}
}
