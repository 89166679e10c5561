package syside.doc;

public abstract class DocVisitor<T, E extends Throwable> {
	public abstract T visit(Text text) throws E;
	public abstract T visit(Concat concat) throws E;
	public abstract T visit(Line line) throws E;
	public abstract T visit(Group group) throws E;
	public abstract T visit(Indent indent) throws E;
	public abstract T visit(IndentIfBreak indentIfBreak) throws E;
	public abstract T visit(IfBreak ifBreak) throws E;
	public abstract T visit(Fill fill) throws E;
	public abstract T visit(Label label) throws E;
	public abstract T visit(Root root) throws E;
	public abstract T visit(BreakParent breakParent) throws E;
	public abstract T visit(LineSuffix lineSuffix) throws E;
	public abstract T visit(LineSuffixBoundary lineSuffixBoundary) throws E;
}
