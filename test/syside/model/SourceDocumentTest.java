package syside.model;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static syside.model.ModelBuilder.*;

public class SourceDocumentTest {

	private static List<String> tokens(Element element) {
		List<String> texts = new ArrayList<>();
		for (Token token : element.getCst().getTokens()) {
			texts.add(token.getText());
		}
		return texts;
	}

	// tokens of located children do not belong to the parent
	@Test
	public void testChildTokensExcluded() {
		String text = "package P {\n    type A :> B;\n}";
		SourceDocument document = new SourceDocument("test.kerml", text);
		Type a = document.locate(type("A", specializes("B")), "type A :> B;");
		Package p = document.locate(pkg("P", member(a)), 0, text.length());

		assertEquals(Arrays.asList("type", "A", ":>", "B", ";"), tokens(a));
		assertEquals(Arrays.asList("package", "P", "{", "}"), tokens(p));
		assertNotNull(a.getCst().findKeyword(":>"));
		assertNull(p.getCst().findKeyword(":>"));
	}

	@Test
	public void testLocation() {
		String text = "package P {\n    type A;\n}";
		SourceDocument document = new SourceDocument("test.kerml", text);
		Type a = document.locate(type("A"), "type A;");

		assertEquals(1, a.getLocation().getStartLine());
		assertEquals(4, a.getLocation().getStartColumn());
		assertEquals("type A;", a.getCst().getText());
	}

	// notes are not tokens
	@Test
	public void testNotesSkipped() {
		String text = "type A; // trailing";
		SourceDocument document = new SourceDocument("test.kerml", text);
		Type a = document.locate(type("A"), 0, text.length());

		assertEquals(Arrays.asList("type", "A", ";"), tokens(a));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingSnippet() {
		new SourceDocument("test.kerml", "type A;").locate(type("B"), "type B;");
	}
}
