package syside.printer;

import org.junit.Test;
import syside.doc.DocRenderer;
import syside.doc.PrinterConfig;
import syside.errors.TopLevelIssueContext;
import syside.model.ConnectorKind;
import syside.model.Element;
import syside.model.Note;
import syside.model.Usage;
import syside.model.UsageKind;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static syside.model.ModelBuilder.*;
import static syside.model.expression.Operator.PLUS;

public class NoteConservationTest {

	private static void collectNotes(Element element, List<Note> out) {
		if (element == null) {
			return;
		}
		out.addAll(element.getNotes());
		for (Element child : element.getOwnedElements()) {
			collectNotes(child, out);
		}
	}

	private static int occurrences(String text, String part) {
		int count = 0;
		for (int i = text.indexOf(part); i >= 0; i = text.indexOf(part, i + 1)) {
			count++;
		}
		return count;
	}

	// every note reachable from the printed element is printed exactly once
	@Test
	public void testAllNotesPrintedOnce() {
		Usage action = body(usage(UsageKind.ACTION, "a"),
				member(leadingNote(fork("f"), " note-fork")),
				member(trailingNote(then("b1"), " note-then")),
				member(assign(ref("x"), op(PLUS,
						trailingNote(num(1), " note-one"),
						note(num(2), Note.Kind.BLOCK, Note.Placement.LEADING, " note-two ")))),
				member(note(connector(ConnectorKind.CONNECTION, "p", "q"),
						Note.Kind.BLOCK, Note.Placement.TRAILING, " note-connection ")));
		innerNote(action, NotePrinter.CHILDREN, " note-inner ");
		leadingNote(action, " note-action");

		PrintContext ctx = new PrintContext(LanguageMode.SYSML, FormatOptions.defaults(), false, false,
				new TopLevelIssueContext());
		String text = DocRenderer.print(new ModelPrinter(ctx).print(action),
				PrinterConfig.defaults().withAddFinalNewline(false));

		List<Note> notes = new ArrayList<>();
		collectNotes(action, notes);
		assertEquals(7, notes.size());
		for (Note note : notes) {
			assertTrue(note.getText(), ctx.isPrinted(note));
			assertEquals(text, 1, occurrences(text, note.getText().trim()));
		}
		assertEquals(notes.size(), ctx.getPrinted().size());
	}
}
