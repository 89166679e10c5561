package syside.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import syside.Unreachable;
import syside.formatters.IndentingWriter;

/**
 * Collects issues in the order they were reported. One instance belongs to one
 * print or options load; the formatter creates a fresh one when the caller
 * passes none.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();
	private final List<Severity> severities = new ArrayList<>();
	private int errorCount = 0;

	@Override
	public void report(Severity severity, Issue issue) {
		issues.add(issue);
		severities.add(severity);
		if (severity == Severity.ERROR) {
			errorCount++;
		}
	}

	@Override
	public boolean hasErrors() {
		return errorCount > 0;
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public List<Issue> getIssues(Severity severity) {
		List<Issue> result = new ArrayList<>();
		for (int i = 0; i < issues.size(); i++) {
			if (severities.get(i) == severity) {
				result.add(issues.get(i));
			}
		}
		return result;
	}

	public boolean isEmpty() {
		return issues.isEmpty();
	}

	public void format(IndentingWriter out) throws IOException {
		if (issues.isEmpty()) {
			out.write("No issues.");
			return;
		}
		out.write(Integer.toString(errorCount));
		out.write(" error(s), ");
		out.write(Integer.toString(issues.size() - errorCount));
		out.write(" warning(s):");
		for (int i = 0; i < issues.size(); i++) {
			out.newLine();
			out.write(severities.get(i) == Severity.ERROR ? "error: " : "warning: ");
			try (IndentingWriter.Indent ignored = out.indent()) {
				issues.get(i).format(out);
			}
		}
	}

	public String format() {
		StringWriter sw = new StringWriter();
		try {
			format(new IndentingWriter(sw));
		} catch (IOException e) {
			throw new Unreachable();
		}
		return sw.toString();
	}
}
