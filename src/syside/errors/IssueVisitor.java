package syside.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(MissingMemberIssue missingMemberIssue) throws E;
	public abstract T visit(ModeViolationIssue modeViolationIssue) throws E;
	public abstract T visit(MissingReferenceIssue missingReferenceIssue) throws E;
	public abstract T visit(UnprintedNoteIssue unprintedNoteIssue) throws E;
	public abstract T visit(UnknownFormatOptionIssue unknownFormatOptionIssue) throws E;
	public abstract T visit(InvalidFormatOptionIssue invalidFormatOptionIssue) throws E;
}
