package syside.formatters;

import syside.errors.ContextVisitor;
import syside.errors.WhileLoadingOptions;
import syside.errors.WhilePrintingElement;
import syside.util.SourceLocation;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhilePrintingElement whilePrintingElement) throws IOException {
		out.write("while printing ");
		out.write(whilePrintingElement.getElement().toString());
		if (whilePrintingElement.getElement().hasKnownLocation()) {
			SourceLocation location = whilePrintingElement.getElement().getLocation();
			out.write(" from line ");
			out.write(Integer.toString(location.getStartLine() + 1));
			out.write(" column ");
			out.write(Integer.toString(location.getStartColumn() + 1));
		}
		return null;
	}

	@Override
	public Void visit(WhileLoadingOptions whileLoadingOptions) throws IOException {
		out.write("while loading format options from ");
		out.write(whileLoadingOptions.getSource());
		return null;
	}

}
