package syside.printer;

import syside.doc.Doc;
import syside.model.expression.Expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Parts and switches of a namespace declaration printed by
 * {@link NamespacePrinter#printGenericNamespace}.
 */
public class DeclarationOptions {
	private List<Doc> modifiers = new ArrayList<>();
	private String keyword = null;
	private Consumer<List<Doc>> appendToDeclaration = null;
	private boolean forceBrackets = false;
	private boolean forceBreakChildren = false;
	private boolean skipChildren = false;
	private boolean skipFirstSpecializationKeyword = false;
	private boolean ignoreMultiplicity = false;
	private SpecializationGrouper specializations = null;
	private ChildrenJoiner join = null;
	private Expression result = null;

	public DeclarationOptions modifiers(List<Doc> modifiers) {
		this.modifiers = modifiers;
		return this;
	}

	public DeclarationOptions modifiers(Doc... modifiers) {
		return modifiers(new ArrayList<>(Arrays.asList(modifiers)));
	}

	/**
	 * @param keyword the keyword before the identifiers, null for none
	 */
	public DeclarationOptions keyword(String keyword) {
		this.keyword = keyword;
		return this;
	}

	/**
	 * Appends a suffix to the declaration, e.g. a feature value. The consumer is
	 * responsible for any leading space or line break.
	 */
	public DeclarationOptions appendToDeclaration(Consumer<List<Doc>> appendToDeclaration) {
		this.appendToDeclaration = appendToDeclaration;
		return this;
	}

	/**
	 * Features print their value unless another suffix was set.
	 */
	public DeclarationOptions noAppend() {
		return appendToDeclaration(declaration -> {});
	}

	public DeclarationOptions forceBrackets(boolean forceBrackets) {
		this.forceBrackets = forceBrackets;
		return this;
	}

	public DeclarationOptions forceBreakChildren(boolean forceBreakChildren) {
		this.forceBreakChildren = forceBreakChildren;
		return this;
	}

	public DeclarationOptions skipChildren(boolean skipChildren) {
		this.skipChildren = skipChildren;
		return this;
	}

	public DeclarationOptions skipFirstSpecializationKeyword(boolean skip) {
		this.skipFirstSpecializationKeyword = skip;
		return this;
	}

	public DeclarationOptions ignoreMultiplicity(boolean ignoreMultiplicity) {
		this.ignoreMultiplicity = ignoreMultiplicity;
		return this;
	}

	public DeclarationOptions specializations(SpecializationGrouper specializations) {
		this.specializations = specializations;
		return this;
	}

	public DeclarationOptions join(ChildrenJoiner join) {
		this.join = join;
		return this;
	}

	public DeclarationOptions result(Expression result) {
		this.result = result;
		return this;
	}

	public List<Doc> getModifiers() {
		return modifiers;
	}

	public String getKeyword() {
		return keyword;
	}

	public Consumer<List<Doc>> getAppendToDeclaration() {
		return appendToDeclaration;
	}

	public boolean isForceBrackets() {
		return forceBrackets;
	}

	public boolean isForceBreakChildren() {
		return forceBreakChildren;
	}

	public boolean isSkipChildren() {
		return skipChildren;
	}

	public boolean isSkipFirstSpecializationKeyword() {
		return skipFirstSpecializationKeyword;
	}

	public boolean isIgnoreMultiplicity() {
		return ignoreMultiplicity;
	}

	public SpecializationGrouper getSpecializations() {
		return specializations;
	}

	public ChildrenJoiner getJoin() {
		return join;
	}

	public Expression getResult() {
		return result;
	}
}
