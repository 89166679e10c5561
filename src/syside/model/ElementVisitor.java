package syside.model;

import syside.model.expression.*;

/**
 * Dispatch over every concrete element kind. Adding an element class without a
 * visit method here does not compile.
 */
public abstract class ElementVisitor<T, E extends Throwable> {
	public abstract T visit(Namespace namespace) throws E;
	public abstract T visit(Package pkg) throws E;
	public abstract T visit(Type type) throws E;
	public abstract T visit(Classifier classifier) throws E;
	public abstract T visit(Feature feature) throws E;
	public abstract T visit(Usage usage) throws E;
	public abstract T visit(Definition definition) throws E;
	public abstract T visit(Connector connector) throws E;
	public abstract T visit(ConnectorEnd connectorEnd) throws E;
	public abstract T visit(ControlNode controlNode) throws E;
	public abstract T visit(AcceptActionUsage acceptActionUsage) throws E;
	public abstract T visit(SendActionUsage sendActionUsage) throws E;
	public abstract T visit(AssignmentActionUsage assignmentActionUsage) throws E;
	public abstract T visit(IfActionUsage ifActionUsage) throws E;
	public abstract T visit(WhileLoopActionUsage whileLoopActionUsage) throws E;
	public abstract T visit(ForLoopActionUsage forLoopActionUsage) throws E;
	public abstract T visit(TransitionUsage transitionUsage) throws E;
	public abstract T visit(MultiplicityRange multiplicityRange) throws E;
	public abstract T visit(FeatureValue featureValue) throws E;
	public abstract T visit(Heritage heritage) throws E;
	public abstract T visit(Reference reference) throws E;
	public abstract T visit(FeatureChain featureChain) throws E;
	public abstract T visit(OwningMembership owningMembership) throws E;
	public abstract T visit(ElementFilterMembership elementFilterMembership) throws E;
	public abstract T visit(Alias alias) throws E;
	public abstract T visit(Import imp) throws E;
	public abstract T visit(Dependency dependency) throws E;
	public abstract T visit(SourceTargetRelationship sourceTargetRelationship) throws E;
	public abstract T visit(Comment comment) throws E;
	public abstract T visit(Documentation documentation) throws E;
	public abstract T visit(TextualRepresentation textualRepresentation) throws E;
	public abstract T visit(MetadataFeature metadataFeature) throws E;
	public abstract T visit(OperatorExpression operatorExpression) throws E;
	public abstract T visit(FeatureReferenceExpression featureReferenceExpression) throws E;
	public abstract T visit(InvocationExpression invocationExpression) throws E;
	public abstract T visit(Argument argument) throws E;
	public abstract T visit(BodyExpression bodyExpression) throws E;
	public abstract T visit(LiteralBoolean literalBoolean) throws E;
	public abstract T visit(LiteralNumber literalNumber) throws E;
	public abstract T visit(LiteralString literalString) throws E;
	public abstract T visit(LiteralInfinity literalInfinity) throws E;
	public abstract T visit(NullExpression nullExpression) throws E;
	public abstract T visit(MetadataAccessExpression metadataAccessExpression) throws E;
	public abstract T visit(TriggerInvocationExpression triggerInvocationExpression) throws E;
}
