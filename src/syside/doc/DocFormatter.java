package syside.doc;

import syside.Unreachable;
import syside.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes a readable dump of a doc tree, one command per line.
 */
public class DocFormatter extends DocVisitor<Void, IOException> {
	private final IndentingWriter out;

	public DocFormatter(IndentingWriter out) {
		this.out = out;
	}

	public static String format(Doc doc) {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			doc.accept(new DocFormatter(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	private void nested(String header, List<Doc> docs) throws IOException {
		out.write(header);
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Doc doc : docs) {
				out.newLine();
				doc.accept(this);
			}
		}
	}

	private void nested(String header, Doc doc) throws IOException {
		out.write(header);
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			doc.accept(this);
		}
	}

	@Override
	public Void visit(Text text) throws IOException {
		out.write("text ");
		out.write(escape(text.getContents()));
		if (text.getType() != null) {
			out.write(" <" + text.getType() + ">");
		}
		return null;
	}

	private static String escape(String s) {
		return "\"" + s.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"") + "\"";
	}

	@Override
	public Void visit(Concat concat) throws IOException {
		nested("concat", concat.getParts());
		return null;
	}

	@Override
	public Void visit(Line line) throws IOException {
		out.write("line " + line.getMode().name().toLowerCase());
		return null;
	}

	@Override
	public Void visit(Group group) throws IOException {
		String header = "group";
		if (group.getId() != null) {
			header += " #" + group.getId();
		}
		if (group.shouldBreak()) {
			header += " break";
		}
		nested(header, group.getContents());
		return null;
	}

	@Override
	public Void visit(Indent indent) throws IOException {
		nested("indent", indent.getContents());
		return null;
	}

	@Override
	public Void visit(IndentIfBreak indentIfBreak) throws IOException {
		nested("indent-if-break #" + indentIfBreak.getGroupId() + (indentIfBreak.isNegated() ? " negated" : ""),
				indentIfBreak.getContents());
		return null;
	}

	@Override
	public Void visit(IfBreak ifBreak) throws IOException {
		out.write("if-break" + (ifBreak.getGroupId() != null ? " #" + ifBreak.getGroupId() : ""));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			nested("broken:", ifBreak.getOnBreak());
			out.newLine();
			nested("flat:", ifBreak.getOnFlat());
		}
		return null;
	}

	@Override
	public Void visit(Fill fill) throws IOException {
		nested("fill", fill.getParts());
		return null;
	}

	@Override
	public Void visit(Label label) throws IOException {
		nested("label " + label.getName(), label.getContents());
		return null;
	}

	@Override
	public Void visit(Root root) throws IOException {
		nested("root", root.getContents());
		return null;
	}

	@Override
	public Void visit(BreakParent breakParent) throws IOException {
		out.write("break-parent");
		return null;
	}

	@Override
	public Void visit(LineSuffix lineSuffix) throws IOException {
		nested("line-suffix", lineSuffix.getContents());
		return null;
	}

	@Override
	public Void visit(LineSuffixBoundary lineSuffixBoundary) throws IOException {
		out.write("line-suffix-boundary");
		return null;
	}
}
