package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code comment about a, b /* body *&#47;}. The body is stored without the comment
 * delimiters and without the leading {@code *} of continuation lines.
 */
public class Comment extends Element {
	private final String body;
	private final List<Reference> about = new ArrayList<>();

	public Comment(String body) {
		this.body = body;
	}

	public String getBody() {
		return body;
	}

	public List<Reference> getAbout() {
		return about;
	}

	public void addAbout(Reference target) {
		about.add(adopt(target));
	}

	@Override
	public List<Element> getOwnedElements() {
		return new ArrayList<>(about);
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
