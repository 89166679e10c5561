package syside.model;

public class ControlNode extends Usage {
	private final ControlNodeKind nodeKind;

	public ControlNode(ControlNodeKind nodeKind) {
		super(UsageKind.CONTROL_NODE);
		this.nodeKind = nodeKind;
	}

	public ControlNodeKind getNodeKind() {
		return nodeKind;
	}

	@Override
	public String getKindName() {
		return "ControlNode(" + nodeKind + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
