package syside.errors;

import syside.model.Element;
import syside.model.Note;

import java.util.List;

/**
 * Some inner notes of an element were not placed by its printer and have been
 * appended after it instead. Reported once per element kind and print.
 */
public class UnprintedNoteIssue extends ElementIssue {
	private final List<Note> notes;

	public UnprintedNoteIssue(Element element, List<Note> notes) {
		super(element);
		this.notes = notes;
	}

	public List<Note> getNotes() {
		return notes;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
