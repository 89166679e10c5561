package syside.errors;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class TopLevelIssueContextTest {

	@Test
	public void testWarningsDoNotCountAsErrors() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.warning(new UnknownFormatOptionIssue("foo"));
		assertFalse(ctx.hasErrors());
		assertFalse(ctx.isEmpty());
		ctx.withContext(new WhileLoadingOptions("fmt.json")).error(new UnknownFormatOptionIssue("bar"));
		assertTrue(ctx.hasErrors());
		assertEquals(1, ctx.getIssues(IssueContext.Severity.WARNING).size());
		assertEquals(1, ctx.getIssues(IssueContext.Severity.ERROR).size());
	}

	@Test
	public void testNestedContextsWrapOutermostLast() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Issue issue = new UnknownFormatOptionIssue("foo");
		ctx.withContext(new WhileLoadingOptions("a.json"))
				.withContext(new WhileLoadingOptions("b.json"))
				.warning(issue);
		Issue reported = ctx.getIssues().get(0);
		assertThat(reported, instanceOf(IssueWithContext.class));
		IssueWithContext outer = (IssueWithContext) reported;
		assertEquals("while loading format options from a.json", outer.getContext().toString());
		assertSame(issue, outer.getRootIssue());
	}

	@Test
	public void testFormat() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.withContext(new WhileLoadingOptions("fmt.json")).warning(new UnknownFormatOptionIssue("foo"));
		ctx.error(new UnknownFormatOptionIssue("bar"));
		assertEquals("1 error(s), 1 warning(s):\n"
				+ "warning: while loading format options from fmt.json\n"
				+ "    unknown format option \"foo\"\n"
				+ "error: unknown format option \"bar\"", ctx.format());
	}

	@Test
	public void testFormatEmpty() {
		assertEquals("No issues.", new TopLevelIssueContext().format());
	}

}
