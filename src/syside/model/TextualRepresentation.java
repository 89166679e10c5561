package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code rep language "..." /* body *&#47;}. Bodies are opaque and printed as they are.
 */
public class TextualRepresentation extends Element {
	private final String language;
	private final String body;

	public TextualRepresentation(String language, String body) {
		this.language = language;
		this.body = body;
	}

	public String getLanguage() {
		return language;
	}

	public String getBody() {
		return body;
	}

	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>();
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
