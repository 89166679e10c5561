package syside;

import org.junit.Test;
import syside.errors.MissingMemberIssue;
import syside.errors.ModeViolationIssue;
import syside.model.AssignmentActionUsage;
import syside.model.Connector;
import syside.model.ControlNode;
import syside.model.Namespace;
import syside.model.Package;
import syside.model.SourceDocument;
import syside.model.Type;
import syside.model.Usage;
import syside.model.UsageKind;
import syside.options.LanguageMode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static syside.model.ModelBuilder.*;

public class SysIDEFormatterTest {

	private static final String KERML_SOURCE = "package P {\n    type   A;\n    type B;\n}\n";

	private static SourceDocument kermlDocument() {
		SourceDocument document = new SourceDocument("test.kerml", KERML_SOURCE);
		Type a = document.locate(type("A"), "type   A;");
		Type b = document.locate(type("B"), "type B;");
		Package p = document.locate(pkg("P", member(a), member(b)), 0, KERML_SOURCE.length() - 1);
		Namespace root = document.locate(root(member(p)), 0, KERML_SOURCE.length());
		document.setRoot(root);
		return document;
	}

	@Test
	public void testPrintDocumentFinalNewline() {
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
		assertEquals("type A {}\n", formatter.printDocument(root(member(type("A")))));
	}

	// a selection inside a single member reprints that member only
	@Test
	public void testPrintRange() {
		SourceDocument document = kermlDocument();
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
		int offset = KERML_SOURCE.indexOf("A;");

		RangePrintResult result = formatter.printRange(document, offset, offset + 1);

		assertEquals("type A;", result.getText());
		assertEquals(1, result.getLevel());
		assertEquals(KERML_SOURCE.indexOf("type   A;"), result.getRange().getStartOffset());
		assertEquals(KERML_SOURCE.indexOf("type   A;") + "type   A;".length(), result.getRange().getEndOffset());
	}

	// a selection spanning siblings reprints all of them at the scope level
	@Test
	public void testPrintRangeSiblings() {
		SourceDocument document = kermlDocument();
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
		int offset = KERML_SOURCE.indexOf("A;");
		int end = KERML_SOURCE.indexOf("B;") + 1;

		RangePrintResult result = formatter.printRange(document, offset, end);

		assertEquals("type A;\n    type B;", result.getText());
		assertEquals(1, result.getLevel());
		assertEquals(KERML_SOURCE.indexOf("type   A;"), result.getRange().getStartOffset());
		assertEquals(KERML_SOURCE.indexOf("type B;") + "type B;".length(), result.getRange().getEndOffset());
	}

	// a selection between two members keeps their text and only fixes the space between them
	@Test
	public void testPrintRangeBetweenMembers() {
		String text = "package P {\n    type A;\n    type   B;\n\n\n    type C;\n}\n";
		SourceDocument document = new SourceDocument("test.kerml", text);
		Type a = document.locate(type("A"), "type A;");
		Type b = document.locate(type("B"), "type   B;");
		Type c = document.locate(type("C"), "type C;");
		Package p = document.locate(pkg("P", member(a), member(b), member(c)), 0, text.length() - 1);
		document.setRoot(document.locate(root(member(p)), 0, text.length()));
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
		int offset = text.indexOf("\n\n\n") + 1;

		RangePrintResult result = formatter.printRange(document, offset, offset + 1);

		assertEquals("type   B;\n\n    type C;", result.getText());
		assertEquals(1, result.getLevel());
		assertEquals(text.indexOf("type   B;"), result.getRange().getStartOffset());
		assertEquals(text.indexOf("type C;") + "type C;".length(), result.getRange().getEndOffset());
	}

	// successions after a fork that lies before the selection are still indented
	@Test
	public void testPrintRangeKeepsOpenFork() {
		String text = "action a2 {\n    fork f;\n    then b1;\n    then b2;\n}\n";
		SourceDocument document = new SourceDocument("test.sysml", text);
		ControlNode f = document.locate(fork("f"), "fork f;");
		Connector b1 = document.locate(then("b1"), "then b1;");
		Connector b2 = document.locate(then("b2"), "then b2;");
		Usage action = document.locate(body(usage(UsageKind.ACTION, "a2"), member(f), member(b1), member(b2)),
				0, text.length() - 1);
		document.setRoot(document.locate(root(member(action)), 0, text.length()));
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.SYSML));

		RangePrintResult result = formatter.printRange(document, text.indexOf("then b1;"),
				text.indexOf("then b2;") + "then b2;".length());

		assertEquals("then b1;\n        then b2;", result.getText());
		assertEquals(1, result.getLevel());
	}

	@Test
	public void testPrintRangeOutsideRoot() {
		SourceDocument document = kermlDocument();
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
		assertNull(formatter.printRange(document, KERML_SOURCE.length(), KERML_SOURCE.length()));
	}

	@Test
	public void testModeViolation() {
		Usage part = usage(UsageKind.PART, "p");
		try {
			new SysIDEFormatter(new PrintOptions(LanguageMode.KERML)).printElement(part);
			fail("expected a mode violation");
		} catch (ModeViolationIssue e) {
			assertSame(part, e.getElement());
			assertEquals(LanguageMode.SYSML, e.getRequired());
			assertEquals("Usage(PART) can only be printed in SysML mode", e.getMessage());
		}
	}

	// the position of the offending element is reported with 1-based numbers
	@Test
	public void testMissingMember() {
		String text = "action a {\n    assign := 1;\n}\n";
		SourceDocument document = new SourceDocument("test.sysml", text);
		AssignmentActionUsage assignment = document.locate(assign(null, num(1)), "assign := 1;");
		try {
			new SysIDEFormatter(new PrintOptions(LanguageMode.SYSML)).printElement(assignment);
			fail("expected a missing member");
		} catch (MissingMemberIssue e) {
			assertEquals("target", e.getMember());
			assertEquals("Invalid AssignmentActionUsage - missing target on line 2, character: 5", e.getMessage());
		}
	}

	private static Type ignoredType() {
		SourceDocument document = new SourceDocument("test.kerml", "type   A;\n");
		return leadingNote(document.locate(type("A"), "type   A;"), " syside-format ignore");
	}

	@Test
	public void testFormatIgnoreKeepsSourceText() {
		SysIDEFormatter formatter = new SysIDEFormatter(new PrintOptions(LanguageMode.KERML));
		assertEquals("// syside-format ignore\ntype   A;", formatter.printElement(ignoredType()));
	}

	@Test
	public void testForceFormattingOverridesIgnore() {
		SysIDEFormatter formatter = new SysIDEFormatter(
				new PrintOptions(LanguageMode.KERML).withForceFormatting(true));
		assertEquals("// syside-format ignore\ntype A;", formatter.printElement(ignoredType()));
	}
}
