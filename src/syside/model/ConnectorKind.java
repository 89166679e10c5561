package syside.model;

public enum ConnectorKind {
	CONNECTOR(false),
	BINDING(false),
	SUCCESSION(false),
	ITEM_FLOW(false),
	SUCCESSION_ITEM_FLOW(false),
	CONNECTION(true),
	BINDING_AS_USAGE(true),
	SUCCESSION_AS_USAGE(true),
	ALLOCATION(true),
	INTERFACE(true),
	FLOW_CONNECTION(true),
	SUCCESSION_FLOW_CONNECTION(true),
	MESSAGE(true);

	private final boolean sysml;

	ConnectorKind(boolean sysml) {
		this.sysml = sysml;
	}

	public boolean isSysML() {
		return sysml;
	}

	public boolean isFlow() {
		return this == ITEM_FLOW || this == SUCCESSION_ITEM_FLOW || this == FLOW_CONNECTION ||
				this == SUCCESSION_FLOW_CONNECTION || this == MESSAGE;
	}
}
