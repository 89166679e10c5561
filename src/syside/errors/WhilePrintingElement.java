package syside.errors;

import syside.model.Element;

public class WhilePrintingElement extends Context {
	private final Element element;

	public WhilePrintingElement(Element element) {
		this.element = element;
	}

	public Element getElement() {
		return element;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
