package syside.formatters;

import syside.errors.*;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(MissingMemberIssue missingMemberIssue) throws IOException {
		out.write("Invalid ");
		out.write(missingMemberIssue.getElement().getKindName());
		out.write(" - missing ");
		out.write(missingMemberIssue.getMember());
		out.write(missingMemberIssue.getPosition());
		return null;
	}

	@Override
	public Void visit(ModeViolationIssue modeViolationIssue) throws IOException {
		out.write(modeViolationIssue.getElement().getKindName());
		out.write(" can only be printed in ");
		out.write(modeViolationIssue.getRequired().getLanguageName());
		out.write(" mode");
		out.write(modeViolationIssue.getPosition());
		return null;
	}

	@Override
	public Void visit(MissingReferenceIssue missingReferenceIssue) throws IOException {
		out.write("Missing reference in ");
		out.write(missingReferenceIssue.getElement().getKindName());
		out.write(missingReferenceIssue.getPosition());
		return null;
	}

	@Override
	public Void visit(UnprintedNoteIssue unprintedNoteIssue) throws IOException {
		out.write(unprintedNoteIssue.getElement().getKindName());
		out.write(" printer did not print ");
		out.write(Integer.toString(unprintedNoteIssue.getNotes().size()));
		out.write(" inner note(s)");
		out.write(unprintedNoteIssue.getPosition());
		return null;
	}

	@Override
	public Void visit(UnknownFormatOptionIssue unknownFormatOptionIssue) throws IOException {
		out.write("unknown format option \"");
		out.write(unknownFormatOptionIssue.getKey());
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(InvalidFormatOptionIssue invalidFormatOptionIssue) throws IOException {
		if (invalidFormatOptionIssue.getReason() != null) {
			out.write("invalid format option \"");
			out.write(invalidFormatOptionIssue.getKey());
			out.write("\": ");
			out.write(invalidFormatOptionIssue.getReason());
			return null;
		}
		out.write("invalid value ");
		out.write(invalidFormatOptionIssue.getValue());
		out.write(" for format option \"");
		out.write(invalidFormatOptionIssue.getKey());
		out.write("\", expected ");
		out.write(invalidFormatOptionIssue.getExpected());
		return null;
	}
}
