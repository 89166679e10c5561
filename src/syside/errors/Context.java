package syside.errors;

import syside.Unreachable;
import syside.formatters.ContextFormattingVisitor;
import syside.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The activity an issue was raised in: loading an options file, or printing one
 * element of the model. Contexts nest, the outermost one is formatted first.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter sw = new StringWriter();
		try {
			accept(new ContextFormattingVisitor(new IndentingWriter(sw)));
		} catch (IOException e) {
			throw new Unreachable();
		}
		return sw.toString();
	}

}
