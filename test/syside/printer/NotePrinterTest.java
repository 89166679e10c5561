package syside.printer;

import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.errors.IssueWithContext;
import syside.errors.TopLevelIssueContext;
import syside.errors.UnprintedNoteIssue;
import syside.model.Element;
import syside.model.Namespace;
import syside.model.Note;
import syside.model.Type;
import syside.options.LanguageMode;
import syside.util.SourceLocation;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static syside.model.ModelBuilder.*;

public class NotePrinterTest {

	private static SysIDEFormatter formatter() {
		return new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
	}

	private static String print(Element element) {
		return formatter().printElement(element);
	}

	@Test
	public void testLeadingLineNote() {
		assertEquals("// lead\ntype A {}", print(leadingNote(type("A"), " lead")));
	}

	// a trailing line note stays on the line of its element
	@Test
	public void testTrailingLineNote() {
		assertEquals("type A {} // trail", print(trailingNote(type("A"), " trail")));
	}

	@Test
	public void testBlockNote() {
		Type a = note(type("A"), Note.Kind.BLOCK, Note.Placement.LEADING, " block ");
		assertEquals("//* block */\ntype A {}", print(a));
	}

	// continuation lines starting with a star are realigned
	@Test
	public void testStarAlignedBlockNote() {
		Type a = note(type("A"), Note.Kind.BLOCK, Note.Placement.LEADING, "\n     * one\n     * two\n   ");
		assertEquals("//*\n  * one\n  * two\n  */\ntype A {}", print(a));
	}

	@Test
	public void testInnerNoteInEmptyBody() {
		Type a = innerNote(type("A"), NotePrinter.CHILDREN, " inner ");
		assertThat(print(a), containsString("//* inner */"));
	}

	private static Type withSourceNote(String name, String text) {
		Type type = type(name);
		type.addNote(new Note(Note.Kind.BLOCK, text, Note.Placement.INNER, "nowhere",
				new SourceLocation("test.kerml", 0, 1, 0, 0, 0, 1), 1, 1));
		return type;
	}

	// notes no printer placed are appended and reported once per element kind
	@Test
	public void testUnprintedNotes() {
		Namespace root = root(member(withSourceNote("A", "x")), member(withSourceNote("B", "y")));
		TopLevelIssueContext issues = new TopLevelIssueContext();
		String printed = formatter().printDocument(root, issues);

		assertThat(printed, containsString("//*x*/"));
		assertThat(printed, containsString("//*y*/"));
		assertEquals(1, issues.getIssues().size());
		assertThat(issues.getIssues().get(0), instanceOf(IssueWithContext.class));
		assertThat(((IssueWithContext) issues.getIssues().get(0)).getIssue(), instanceOf(UnprintedNoteIssue.class));
	}

	// notes attached without a source position are placed silently
	@Test
	public void testUnprintedSynthesizedNotes() {
		Type a = innerNote(type("A"), "nowhere", "x");
		TopLevelIssueContext issues = new TopLevelIssueContext();
		String printed = formatter().printDocument(root(member(a)), issues);

		assertThat(printed, containsString("//*x*/"));
		assertEquals(0, issues.getIssues().size());
	}
}
