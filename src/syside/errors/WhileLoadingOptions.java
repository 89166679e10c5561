package syside.errors;

/**
 * Loading format options from a file or a JSON object with the given description.
 */
public class WhileLoadingOptions extends Context {
	private final String source;

	public WhileLoadingOptions(String source) {
		this.source = source;
	}

	public String getSource() {
		return source;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
