package syside.errors;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhilePrintingElement whilePrintingElement) throws E;
	public abstract T visit(WhileLoadingOptions whileLoadingOptions) throws E;

}
