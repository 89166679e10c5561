package syside.model;

public class Documentation extends Comment {
	public Documentation(String body) {
		super(body);
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
