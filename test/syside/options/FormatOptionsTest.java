package syside.options;

import org.json.JSONObject;
import org.junit.Test;
import syside.errors.InvalidFormatOptionIssue;
import syside.errors.UnknownFormatOptionIssue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;

public class FormatOptionsTest {

	private static Path resource(String name) throws URISyntaxException {
		return Paths.get(FormatOptionsTest.class.getResource("/options/" + name).toURI());
	}

	@Test
	public void testDefaults() {
		FormatOptions options = FormatOptions.defaults();
		assertEquals(PreservableFormatting.preserve(Presence.ALWAYS), options.emptyNamespaceBrackets);
		assertEquals(OperatorBreak.AFTER, options.operatorBreak);
		assertTrue(options.markdownComments);
	}

	// a plain alternative fixes the option, ignoring the source
	@Test
	public void testFixedValue() throws FormatOptionException {
		FormatOptions options = FormatOptions.fromJSON(new JSONObject().put("empty_namespace_brackets", "never"));
		assertEquals(PreservableFormatting.fixed(Presence.NEVER), options.emptyNamespaceBrackets);
		assertFalse(options.emptyNamespaceBrackets.isPreserve());
	}

	// "preserve" keeps the default fallback
	@Test
	public void testPreserve() throws FormatOptionException {
		FormatOptions options = FormatOptions.fromJSON(new JSONObject().put("comment_keyword", "preserve"));
		assertTrue(options.commentKeyword.isPreserve());
		assertEquals(KeywordFormat.AS_NEEDED, options.commentKeyword.getFallback());
	}

	@Test
	public void testPreserveWithFallback() throws FormatOptionException {
		JSONObject value = new JSONObject().put("default", "preserve").put("fallback", "always");
		FormatOptions options = FormatOptions.fromJSON(new JSONObject().put("comment_keyword", value));
		assertEquals(PreservableFormatting.preserve(KeywordFormat.ALWAYS), options.commentKeyword);
	}

	@Test
	public void testUnknownKey() {
		try {
			FormatOptions.fromJSON(new JSONObject().put("no_such_option", 1));
			fail("unknown options must be rejected");
		} catch (FormatOptionException e) {
			assertThat(e.getIssue(), instanceOf(UnknownFormatOptionIssue.class));
			assertEquals("no_such_option", ((UnknownFormatOptionIssue) e.getIssue()).getKey());
		}
	}

	@Test
	public void testUnknownPreservableKey() {
		JSONObject value = new JSONObject().put("fallback", "always").put("other", "never");
		try {
			FormatOptions.fromJSON(new JSONObject().put("comment_keyword", value));
			fail("unknown nested keys must be rejected");
		} catch (FormatOptionException e) {
			assertEquals("comment_keyword.other", ((UnknownFormatOptionIssue) e.getIssue()).getKey());
		}
	}

	@Test
	public void testInvalidAlternative() {
		try {
			FormatOptions.fromJSON(new JSONObject().put("operator_break", "middle"));
			fail("unknown alternatives must be rejected");
		} catch (FormatOptionException e) {
			InvalidFormatOptionIssue issue = (InvalidFormatOptionIssue) e.getIssue();
			assertEquals("operator_break", issue.getKey());
			assertEquals("middle", issue.getValue());
		}
	}

	@Test(expected = FormatOptionException.class)
	public void testInvalidBoolean() throws FormatOptionException {
		FormatOptions.fromJSON(new JSONObject().put("markdown_comments", "yes"));
	}

	@Test
	public void testGet() throws FormatOptionException {
		assertEquals(OperatorBreak.AFTER, FormatOptions.defaults().get("operator_break"));
	}

	// updating a copy leaves the original untouched
	@Test
	public void testCopy() throws FormatOptionException {
		FormatOptions original = FormatOptions.defaults();
		FormatOptions copy = original.copy();
		copy.update(new JSONObject().put("operator_break", "before"));
		assertEquals(OperatorBreak.BEFORE, copy.operatorBreak);
		assertEquals(OperatorBreak.AFTER, original.operatorBreak);
	}

	@Test
	public void testLoad() throws Exception {
		FormatOptions options = FormatOptions.load(resource("format.json"));
		assertEquals(PreservableFormatting.fixed(Presence.NEVER), options.emptyNamespaceBrackets);
		assertEquals(OperatorBreak.BEFORE, options.operatorBreak);
		assertFalse(options.markdownComments);
		assertEquals(PreservableFormatting.preserve(KeywordFormat.ALWAYS), options.commentKeyword);
	}

	@Test(expected = FormatOptionException.class)
	public void testLoadUnknown() throws Exception {
		FormatOptions.load(resource("unknown.json"));
	}

	@Test(expected = FormatOptionException.class)
	public void testLoadMissingFile() throws FormatOptionException {
		FormatOptions.load(Paths.get("does-not-exist.json"));
	}

	// every registered key can be read back and is carried over by copy
	@Test
	public void testEveryKeySurvivesCopy() throws FormatOptionException {
		FormatOptions options = FormatOptions.fromJSON(new JSONObject()
				.put("strip_unnecessary_quotes", false)
				.put("literal_real", "prec")
				.put("public_keyword", new JSONObject().put("fallback", "always")));
		FormatOptions copy = options.copy();
		int count = 0;
		for (String key : FormatOptions.keys()) {
			assertEquals(key, options.get(key), copy.get(key));
			count++;
		}
		assertEquals(90, count);
		assertEquals(false, copy.get("strip_unnecessary_quotes"));
		assertEquals(PreservableFormatting.preserve(Presence.ALWAYS), copy.publicKeyword);
	}
}
