package syside.printer;

import syside.doc.Doc;
import syside.errors.MissingMemberIssue;
import syside.model.Element;
import syside.model.Note;
import syside.model.OwningMembership;

import java.util.ArrayList;
import java.util.List;

import static syside.doc.DocBuilder.*;

/**
 * Prints elements to docs. Every element goes through {@link #print} which
 * handles format-ignore, notes and blank lines around the construct printed
 * by the element printer.
 */
public class ModelPrinter {
	private final PrintContext ctx;
	private final NotePrinter notes;
	private final NamespacePrinter namespaces;
	private final UsagePrinter usages;
	private final RelationshipPrinter relationships;
	private final ConnectorPrinter connectors;
	private final ActionPrinter actions;
	private final TransitionPrinter transitions;
	private final AnnotationPrinter annotations;
	private final ExpressionPrinter expressions;

	public ModelPrinter(PrintContext ctx) {
		this.ctx = ctx;
		this.notes = new NotePrinter(ctx);
		this.namespaces = new NamespacePrinter(this);
		this.usages = new UsagePrinter(this);
		this.relationships = new RelationshipPrinter(this);
		this.connectors = new ConnectorPrinter(this);
		this.actions = new ActionPrinter(this);
		this.transitions = new TransitionPrinter(this);
		this.annotations = new AnnotationPrinter(this);
		this.expressions = new ExpressionPrinter(this);
	}

	public PrintContext getContext() {
		return ctx;
	}

	NotePrinter notes() {
		return notes;
	}

	NamespacePrinter namespaces() {
		return namespaces;
	}

	UsagePrinter usages() {
		return usages;
	}

	RelationshipPrinter relationships() {
		return relationships;
	}

	ConnectorPrinter connectors() {
		return connectors;
	}

	ActionPrinter actions() {
		return actions;
	}

	TransitionPrinter transitions() {
		return transitions;
	}

	AnnotationPrinter annotations() {
		return annotations;
	}

	ExpressionPrinter expressions() {
		return expressions;
	}

	public Doc print(Element element) {
		return print(element, null);
	}

	public Doc print(Element element, Element previousSibling) {
		return print(element, previousSibling, this::printConstruct);
	}

	public <T extends Element> Doc print(T element, Element previousSibling, ElementPrinter<? super T> printer) {
		Doc doc;
		if (!ctx.isForceFormatting() && NotePrinter.hasFormatIgnore(element)) {
			doc = printVerbatim(element);
		} else {
			doc = printer.print(element, previousSibling);
		}
		doc = notes.printMissedInnerNotes(doc, element);
		doc = notes.surround(doc, element);

		// members are separated by their memberships
		if (previousSibling != null && !(element.getParent() instanceof OwningMembership) &&
				SourceRanges.newLinesBetween(previousSibling, element) > 1) {
			doc = inheritLabel(doc, contents -> concat(HARDLINE, contents));
		}
		return doc;
	}

	/**
	 * Prints elements in order, each with the one before it as its previous
	 * sibling.
	 */
	public <T extends Element> List<Doc> printAll(List<? extends T> elements, Element previousSibling,
	                                              ElementPrinter<? super T> printer) {
		List<Doc> printed = new ArrayList<>();
		Element previous = previousSibling;
		for (T element : elements) {
			printed.add(print(element, previous, printer));
			previous = element;
		}
		return printed;
	}

	public List<Doc> printAll(List<? extends Element> elements, Element previousSibling) {
		return printAll(elements, previousSibling, this::printConstruct);
	}

	/**
	 * Prints the construct of element without its notes.
	 */
	public Doc printConstruct(Element element, Element previousSibling) {
		return element.accept(new ElementPrintingVisitor(this, previousSibling));
	}

	/**
	 * Prints element as it was written if it has concrete syntax, so that only
	 * the whitespace around it is formatted.
	 */
	public Doc printUnformatted(Element element, Element previousSibling) {
		if (element.getCst() == null) {
			return printConstruct(element, previousSibling);
		}
		return printVerbatim(element);
	}

	private Doc printVerbatim(Element element) {
		markNotesPrinted(element, true);
		String[] lines = element.getCst().getText().split("\r?\n", -1);
		List<Doc> parts = new ArrayList<>();
		for (String line : lines) {
			parts.add(text(line));
		}
		return join(LITERALLINE, parts);
	}

	private void markNotesPrinted(Element element, boolean innerOnly) {
		for (Note note : element.getNotes()) {
			if (!innerOnly || note.getPlacement() == Note.Placement.INNER) {
				ctx.markPrinted(note);
			}
		}
		for (Element child : element.getOwnedElements()) {
			markNotesPrinted(child, false);
		}
	}

	/**
	 * @return value if it is not null
	 * @throws MissingMemberIssue if value is null
	 */
	static <T> T required(Element element, T value, String member) {
		if (value == null) {
			throw new MissingMemberIssue(element, member);
		}
		return value;
	}
}
