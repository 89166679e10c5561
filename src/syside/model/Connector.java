package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Connectors, bindings, successions and flows of both languages.
 */
public class Connector extends Usage {
	private final ConnectorKind connectorKind;
	private final List<ConnectorEnd> ends = new ArrayList<>();
	private Element item;

	public Connector(ConnectorKind connectorKind) {
		super(UsageKind.CONNECTOR);
		this.connectorKind = connectorKind;
	}

	public ConnectorKind getConnectorKind() {
		return connectorKind;
	}

	public List<ConnectorEnd> getEnds() {
		return ends;
	}

	public void addEnd(ConnectorEnd end) {
		ends.add(adopt(end));
	}

	/**
	 * @return the flowing item type of a flow, printed after {@code of}
	 */
	public Element getItem() {
		return item;
	}

	public void setItem(Element item) {
		this.item = adopt(item);
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		if (item != null) {
			owned.add(item);
		}
		owned.addAll(ends);
		return owned;
	}

	@Override
	public String getKindName() {
		return "Connector(" + connectorKind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
