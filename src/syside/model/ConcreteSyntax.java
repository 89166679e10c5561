package syside.model;

import syside.util.SourceLocatable;
import syside.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * The parsed source backing an element: its range, original text and the tokens
 * that belong directly to the element (not to its children).
 */
public class ConcreteSyntax extends SourceLocatable {
	private final SourceLocation location;
	private final String text;
	private final List<Token> tokens;

	public ConcreteSyntax(SourceLocation location, String text, List<Token> tokens) {
		this.location = location;
		this.text = text;
		this.tokens = tokens;
	}

	public ConcreteSyntax(SourceLocation location, String text) {
		this(location, text, Collections.emptyList());
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getText() {
		return text;
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public int getOffset() {
		return location.getStartOffset();
	}

	public int getEnd() {
		return location.getEndOffset();
	}

	/**
	 * Finds the first token sequence spelling keyword. Multi-word keywords such as
	 * "typed by" match either a single token or consecutive tokens.
	 *
	 * @return the first token of the match, or null
	 */
	public Token findKeyword(String keyword) {
		String[] words = keyword.split(" ");
		for (int i = 0; i < tokens.size(); ++i) {
			if (tokens.get(i).getText().equals(keyword)) {
				return tokens.get(i);
			}
			if (words.length > 1 && i + words.length <= tokens.size()) {
				boolean matches = true;
				for (int j = 0; j < words.length; ++j) {
					if (!tokens.get(i + j).getText().equals(words[j])) {
						matches = false;
						break;
					}
				}
				if (matches) {
					return tokens.get(i);
				}
			}
		}
		return null;
	}

	public boolean startsWith(String keyword) {
		Token found = findKeyword(keyword);
		return found != null && found == tokens.get(0);
	}
}
