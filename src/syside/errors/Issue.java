package syside.errors;

import syside.SysIDEException;
import syside.Unreachable;
import syside.formatters.IndentingWriter;
import syside.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found while loading options or printing. Issues are thrown when the
 * print cannot continue and reported to an {@link IssueContext} otherwise.
 * The message is rendered on demand from the issue's fields.
 */
public abstract class Issue extends SysIDEException {

	public void format(IndentingWriter out) throws IOException {
		accept(new IssueFormattingVisitor(out));
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		try {
			format(new IndentingWriter(sw));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
