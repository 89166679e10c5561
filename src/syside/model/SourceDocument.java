package syside.model;

import syside.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A text document together with the root namespace built from it.
 */
public class SourceDocument {
	private static final Pattern TOKEN = Pattern.compile(
			"//[^\\n]*|/\\*.*?\\*/" +
					"|'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"" +
					"|[A-Za-z_][A-Za-z0-9_]*" +
					"|\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?" +
					"|:>>|::>|::\\*\\*|::\\*|:>|::|:=|->|\\.\\.|\\.\\?|===|!==|==|!=|<=|>=|\\*\\*|\\S",
			Pattern.DOTALL);

	private final String uri;
	private final String text;
	private Namespace root;

	public SourceDocument(String uri, String text) {
		this.uri = uri;
		this.text = text;
	}

	public String getUri() {
		return uri;
	}

	public String getText() {
		return text;
	}

	public Namespace getRoot() {
		return root;
	}

	public void setRoot(Namespace root) {
		this.root = root;
	}

	public SourceLocation location(int startOffset, int endOffset) {
		return SourceLocation.fromOffsets(uri, text, startOffset, endOffset);
	}

	/**
	 * Attaches concrete syntax spanning [startOffset, endOffset) to element. Tokens
	 * covered by owned elements that already have concrete syntax are left to those
	 * elements, so children have to be located before their parents.
	 */
	public <T extends Element> T locate(T element, int startOffset, int endOffset) {
		List<SourceLocation> owned = new ArrayList<>();
		collectLocated(element, owned);

		List<Token> tokens = new ArrayList<>();
		Matcher m = TOKEN.matcher(text);
		m.region(startOffset, endOffset);
		while (m.find()) {
			String token = m.group();
			if (token.startsWith("//") || token.startsWith("/*")) {
				continue;
			}
			boolean inChild = false;
			for (SourceLocation child : owned) {
				if (m.start() >= child.getStartOffset() && m.end() <= child.getEndOffset()) {
					inChild = true;
					break;
				}
			}
			if (!inChild) {
				tokens.add(new Token(token, location(m.start(), m.end())));
			}
		}
		element.setCst(new ConcreteSyntax(location(startOffset, endOffset), text.substring(startOffset, endOffset),
				tokens));
		return element;
	}

	/**
	 * Locates element at the first occurrence of snippet at or after from.
	 */
	public <T extends Element> T locate(T element, String snippet, int from) {
		int start = text.indexOf(snippet, from);
		if (start < 0) {
			throw new IllegalArgumentException("\"" + snippet + "\" does not occur in " + uri);
		}
		return locate(element, start, start + snippet.length());
	}

	public <T extends Element> T locate(T element, String snippet) {
		return locate(element, snippet, 0);
	}

	private static void collectLocated(Element element, List<SourceLocation> out) {
		for (Element child : element.getOwnedElements()) {
			if (child == null) {
				continue;
			}
			if (child.getCst() != null) {
				out.add(child.getCst().getLocation());
			} else {
				collectLocated(child, out);
			}
		}
	}
}
