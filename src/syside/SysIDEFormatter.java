package syside;

import syside.doc.Doc;
import syside.doc.DocRenderer;
import syside.doc.PrintResult;
import syside.errors.IssueContext;
import syside.errors.TopLevelIssueContext;
import syside.model.Element;
import syside.model.Namespace;
import syside.model.SourceDocument;
import syside.options.LanguageMode;
import syside.printer.ActionBodyJoiner;
import syside.printer.ElementRange;
import syside.printer.ModelPrinter;
import syside.printer.PrintContext;
import syside.printer.PrintRangeCollector;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static syside.doc.DocBuilder.*;

/**
 * Entry points for printing whole documents, single elements and selections.
 *
 * Every call creates a fresh print context, so a formatter may be shared between
 * threads. Warnings about comments a printer could not place are collected in
 * the issue context passed in, fatal problems are thrown as {@link SysIDEException}.
 */
public class SysIDEFormatter {
	private static final Logger logger = Logger.getLogger("SysIDEFormatter");

	private final PrintOptions options;

	public SysIDEFormatter(PrintOptions options) {
		this.options = options;
	}

	public PrintOptions getOptions() {
		return options;
	}

	private ModelPrinter newPrinter(IssueContext issues) {
		return new ModelPrinter(new PrintContext(options.getMode(), options.getFormat(),
				options.getConfig().isHighlighting(), options.isForceFormatting(), issues));
	}

	public PrintResult renderDocument(Namespace root, IssueContext issues) {
		logger.fine("Printing document");
		Doc doc = newPrinter(issues).print(root);
		PrintResult result = DocRenderer.render(doc, options.getConfig());
		logger.fine("Printed document");
		return result;
	}

	public String printDocument(Namespace root, IssueContext issues) {
		return renderDocument(root, issues).getText();
	}

	public String printDocument(Namespace root) {
		return printDocument(root, new TopLevelIssueContext());
	}

	/**
	 * Prints a single element on its own, without a final newline.
	 */
	public String printElement(Element element, IssueContext issues) {
		logger.fine("Printing " + element.getKindName());
		Doc doc = newPrinter(issues).print(element);
		String text = DocRenderer.print(doc, options.getConfig().withAddFinalNewline(false));
		logger.fine("Printed " + element.getKindName());
		return text;
	}

	public String printElement(Element element) {
		return printElement(element, new TopLevelIssueContext());
	}

	/**
	 * Prints the elements covering [offset, end) of document.
	 *
	 * @return null if the range lies outside the document root or there is
	 * nothing to print
	 */
	public RangePrintResult printRange(SourceDocument document, int offset, int end, IssueContext issues) {
		logger.fine("Printing range [" + offset + ", " + end + ")");
		ElementRange range = PrintRangeCollector.collect(document.getRoot(), offset, end);
		if (range == null) {
			logger.fine("Nothing to print in range");
			return null;
		}

		ModelPrinter printer = newPrinter(issues);
		List<Doc> printed = new ArrayList<>();
		Element previous = range.getPreviousSibling();
		for (Element element : range.getElements()) {
			printed.add(range.isUnformatted()
					? printer.print(element, previous, printer::printUnformatted)
					: printer.print(element, previous));
			previous = element;
		}

		Doc doc;
		if (options.getMode() == LanguageMode.KERML) {
			doc = join(HARDLINE, printed);
		} else {
			doc = new ActionBodyJoiner().join(range.getElements(), printed, range.getLeading());
		}
		for (int i = 0; i < range.getLevel(); ++i) {
			doc = indent(doc);
		}

		String text = DocRenderer.print(doc, options.getConfig().withAddFinalNewline(false));
		logger.fine("Printed " + range.getElements().size() + " element(s) in range");
		return new RangePrintResult(text, range.getLevel(), range.getRange());
	}

	public RangePrintResult printRange(SourceDocument document, int offset, int end) {
		return printRange(document, offset, end, new TopLevelIssueContext());
	}
}
