package syside.model;

import syside.model.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * A membership or namespace import, optionally recursive and filtered.
 */
public class Import extends Relationship {
	private final Reference target;
	private final boolean namespaceImport;
	private final boolean recursive;
	private boolean importAll;
	private final List<Expression> filters = new ArrayList<>();

	public Import(Reference target, boolean namespaceImport, boolean recursive) {
		this.target = adopt(target);
		this.namespaceImport = namespaceImport;
		this.recursive = recursive;
	}

	public Reference getTarget() {
		return target;
	}

	public boolean isNamespaceImport() {
		return namespaceImport;
	}

	public boolean isRecursive() {
		return recursive;
	}

	public boolean isImportAll() {
		return importAll;
	}

	public void setImportAll(boolean importAll) {
		this.importAll = importAll;
	}

	public List<Expression> getFilters() {
		return filters;
	}

	public void addFilter(Expression filter) {
		filters.add(adopt(filter));
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>();
		owned.add(target);
		owned.addAll(filters);
		owned.addAll(super.getOwnedElements());
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
