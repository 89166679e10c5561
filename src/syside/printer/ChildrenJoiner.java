package syside.printer;

import syside.doc.Doc;
import syside.model.Element;

import java.util.List;

/**
 * Joins printed children of a block.
 */
public interface ChildrenJoiner {
	/**
	 * @param children the elements that were printed
	 * @param printed children printed to docs, same size as children
	 * @param leading unprinted elements that come before the first child, they
	 *                only advance the joiner state
	 */
	Doc join(List<? extends Element> children, List<Doc> printed, List<? extends Element> leading);
}
