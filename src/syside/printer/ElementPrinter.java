package syside.printer;

import syside.doc.Doc;
import syside.model.Element;

/**
 * Prints the construct of a single element. Notes attached to the element are
 * handled by {@link ModelPrinter}, not by the element printer.
 */
@FunctionalInterface
public interface ElementPrinter<T extends Element> {
	Doc print(T element, Element previousSibling);
}
