package syside.model;

import syside.util.SourceLocatable;
import syside.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the linked model graph.
 *
 * Every element is exclusively owned by its parent, references to other elements
 * go through {@link Reference} and never own their target.
 */
public abstract class Element extends SourceLocatable {
	private Element parent;
	private String declaredName;
	private String declaredShortName;
	private ConcreteSyntax cst;
	private final List<Note> notes = new ArrayList<>();

	@Override
	public SourceLocation getLocation() {
		if (cst == null) {
			return SourceLocation.unknown();
		}
		return cst.getLocation();
	}

	/**
	 * @return the element directly containing this one, which may be a relationship
	 */
	public Element getParent() {
		return parent;
	}

	/**
	 * @return the closest containing element that is not a membership-like relationship
	 */
	public Element getOwner() {
		if (parent instanceof Relationship) {
			return parent.getParent();
		}
		return parent;
	}

	protected <T extends Element> T adopt(T child) {
		if (child != null) {
			((Element) child).parent = this;
		}
		return child;
	}

	protected <T extends Element> void adoptAll(List<T> destination, List<? extends T> children) {
		for (T child : children) {
			destination.add(adopt(child));
		}
	}

	public String getDeclaredName() {
		return declaredName;
	}

	public void setDeclaredName(String declaredName) {
		this.declaredName = declaredName;
	}

	public String getDeclaredShortName() {
		return declaredShortName;
	}

	public void setDeclaredShortName(String declaredShortName) {
		this.declaredShortName = declaredShortName;
	}

	public boolean hasIdentifiers() {
		return declaredName != null || declaredShortName != null;
	}

	/**
	 * @return the name used to refer to this element, preferring the regular name
	 */
	public String getName() {
		return declaredName != null ? declaredName : declaredShortName;
	}

	public String getQualifiedName() {
		List<String> parts = new ArrayList<>();
		for (Element e = this; e != null; e = e.getOwner()) {
			if (e.getName() != null) {
				parts.add(e.getName());
			}
		}
		Collections.reverse(parts);
		return String.join("::", parts);
	}

	public ConcreteSyntax getCst() {
		return cst;
	}

	public void setCst(ConcreteSyntax cst) {
		this.cst = cst;
	}

	public List<Note> getNotes() {
		return notes;
	}

	public void addNote(Note note) {
		notes.add(note);
	}

	public String getKindName() {
		return getClass().getSimpleName();
	}

	/**
	 * @return every element owned by this one, in source order where it matters
	 */
	public abstract List<Element> getOwnedElements();

	public abstract <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return getKindName() + (getName() != null ? " " + getName() : "");
	}
}
