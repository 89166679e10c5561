package syside.printer;

import syside.doc.Doc;
import syside.model.Element;

/**
 * Options of a children block {@code { ... }}.
 */
public class BlockOptions {
	private Element result = null;
	private boolean insertSpace = false;
	private boolean forceEmptyBrackets = false;
	private boolean forceBreak = false;
	private Doc semicolon = null;
	private ChildrenJoiner join = null;
	private ElementPrinter<Element> printer = null;

	/**
	 * A result expression appended after the children.
	 */
	public BlockOptions result(Element result) {
		this.result = result;
		return this;
	}

	/**
	 * Print a space before the opening bracket. Only expression bodies go
	 * without one.
	 */
	public BlockOptions insertSpace(boolean insertSpace) {
		this.insertSpace = insertSpace;
		return this;
	}

	public BlockOptions forceEmptyBrackets(boolean forceEmptyBrackets) {
		this.forceEmptyBrackets = forceEmptyBrackets;
		return this;
	}

	public BlockOptions forceBreak(boolean forceBreak) {
		this.forceBreak = forceBreak;
		return this;
	}

	public BlockOptions semicolon(Doc semicolon) {
		this.semicolon = semicolon;
		return this;
	}

	public BlockOptions join(ChildrenJoiner join) {
		this.join = join;
		return this;
	}

	/**
	 * Printer for each child instead of the default construct printer.
	 */
	public BlockOptions printer(ElementPrinter<Element> printer) {
		this.printer = printer;
		return this;
	}

	public Element getResult() {
		return result;
	}

	public boolean isInsertSpace() {
		return insertSpace;
	}

	public boolean isForceEmptyBrackets() {
		return forceEmptyBrackets;
	}

	public boolean isForceBreak() {
		return forceBreak;
	}

	public Doc getSemicolon() {
		return semicolon;
	}

	public ChildrenJoiner getJoin() {
		return join;
	}

	public ElementPrinter<Element> getPrinter() {
		return printer;
	}
}
