package syside.model;

import java.util.ArrayList;
import java.util.List;

public class Dependency extends Relationship {
	private final List<Reference> prefixes = new ArrayList<>();
	private final List<Reference> clients = new ArrayList<>();
	private final List<Reference> suppliers = new ArrayList<>();

	public Dependency(List<Reference> clients, List<Reference> suppliers) {
		adoptAll(this.clients, clients);
		adoptAll(this.suppliers, suppliers);
	}

	public List<Reference> getPrefixes() {
		return prefixes;
	}

	public void addPrefix(Reference prefix) {
		prefixes.add(adopt(prefix));
	}

	public List<Reference> getClients() {
		return clients;
	}

	public List<Reference> getSuppliers() {
		return suppliers;
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = new ArrayList<>(prefixes);
		owned.addAll(clients);
		owned.addAll(suppliers);
		owned.addAll(super.getOwnedElements());
		return owned;
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
