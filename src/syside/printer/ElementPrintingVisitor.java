package syside.printer;

import syside.doc.Doc;
import syside.model.*;
import syside.model.Package;
import syside.model.expression.*;

import static syside.doc.DocBuilder.*;

/**
 * Dispatches an element to the printer of its construct.
 */
public class ElementPrintingVisitor extends ElementVisitor<Doc, RuntimeException> {
	private final ModelPrinter printer;
	private final PrintContext ctx;
	private final Element previousSibling;

	public ElementPrintingVisitor(ModelPrinter printer, Element previousSibling) {
		this.printer = printer;
		this.ctx = printer.getContext();
		this.previousSibling = previousSibling;
	}

	@Override
	public Doc visit(Namespace namespace) {
		if (namespace.isRoot()) {
			return join(HARDLINE, printer.printAll(namespace.getMembers(), null));
		}
		ctx.assertKerML(namespace);
		return printer.namespaces().printNonTypeNamespace(null, "namespace", namespace);
	}

	@Override
	public Doc visit(Package pkg) {
		if (pkg.isLibrary()) {
			return printer.namespaces().printNonTypeNamespace(pkg.isStandard() ? "standard library" : "library",
					"package", pkg);
		}
		return printer.namespaces().printNonTypeNamespace(null, "package", pkg);
	}

	@Override
	public Doc visit(Type type) {
		ctx.assertKerML(type);
		return printer.namespaces().printType(type, "type");
	}

	@Override
	public Doc visit(Classifier classifier) {
		ctx.assertKerML(classifier);
		return printer.namespaces().printType(classifier, classifier.getKind().getKeyword());
	}

	@Override
	public Doc visit(Feature feature) {
		if (feature.getOwner() instanceof Expression) {
			return printer.expressions().printBodyParameter(feature);
		}
		switch (feature.getFeatureKind()) {
			case FEATURE:
				return printer.namespaces().printFeature(feature);
			case INVARIANT:
				return printer.namespaces().printInvariant(feature);
			default:
				return printer.namespaces().printKerMLFeature(feature, feature.getFeatureKind().getKeyword());
		}
	}

	@Override
	public Doc visit(Usage usage) {
		return printer.usages().printUsage(usage);
	}

	@Override
	public Doc visit(Definition definition) {
		return printer.usages().printDefinition(definition);
	}

	@Override
	public Doc visit(Connector connector) {
		if (connector.getConnectorKind() == ConnectorKind.SUCCESSION_AS_USAGE) {
			return printer.transitions().printSuccessionAsUsage(connector, previousSibling);
		}
		return printer.connectors().printConnector(connector);
	}

	@Override
	public Doc visit(ConnectorEnd connectorEnd) {
		return printer.connectors().printConnectorEnd(connectorEnd);
	}

	@Override
	public Doc visit(ControlNode controlNode) {
		return printer.actions().printControlNode(controlNode);
	}

	@Override
	public Doc visit(AcceptActionUsage acceptActionUsage) {
		return printer.actions().printAcceptAction(acceptActionUsage, false);
	}

	@Override
	public Doc visit(SendActionUsage sendActionUsage) {
		return printer.actions().printSendAction(sendActionUsage, false);
	}

	@Override
	public Doc visit(AssignmentActionUsage assignmentActionUsage) {
		return printer.actions().printAssignmentAction(assignmentActionUsage, false);
	}

	@Override
	public Doc visit(IfActionUsage ifActionUsage) {
		return printer.actions().printIfAction(ifActionUsage);
	}

	@Override
	public Doc visit(WhileLoopActionUsage whileLoopActionUsage) {
		return printer.actions().printWhileLoop(whileLoopActionUsage);
	}

	@Override
	public Doc visit(ForLoopActionUsage forLoopActionUsage) {
		return printer.actions().printForLoop(forLoopActionUsage);
	}

	@Override
	public Doc visit(TransitionUsage transitionUsage) {
		return printer.transitions().printTransitionUsage(transitionUsage, previousSibling);
	}

	@Override
	public Doc visit(MultiplicityRange multiplicityRange) {
		return printer.namespaces().printMultiplicityMember(multiplicityRange);
	}

	@Override
	public Doc visit(FeatureValue featureValue) {
		return printer.relationships().printFeatureValue(featureValue);
	}

	@Override
	public Doc visit(Heritage heritage) {
		return printer.relationships().printHeritageTarget(heritage);
	}

	@Override
	public Doc visit(Reference reference) {
		Element scope = reference.getParent() != null ? reference.getParent() : reference;
		return Identifiers.printReference(reference, scope, ctx);
	}

	@Override
	public Doc visit(FeatureChain featureChain) {
		return printer.relationships().printChaining(featureChain);
	}

	@Override
	public Doc visit(OwningMembership owningMembership) {
		return printer.relationships().printOwningMembership(owningMembership, previousSibling);
	}

	@Override
	public Doc visit(ElementFilterMembership elementFilterMembership) {
		return printer.relationships().printElementFilter(elementFilterMembership);
	}

	@Override
	public Doc visit(Alias alias) {
		return printer.relationships().printAlias(alias);
	}

	@Override
	public Doc visit(Import imp) {
		return printer.relationships().printImport(imp);
	}

	@Override
	public Doc visit(Dependency dependency) {
		return printer.relationships().printDependency(dependency);
	}

	@Override
	public Doc visit(SourceTargetRelationship sourceTargetRelationship) {
		return printer.relationships().printSourceTargetRelationship(sourceTargetRelationship);
	}

	@Override
	public Doc visit(Comment comment) {
		return printer.annotations().printComment(comment);
	}

	@Override
	public Doc visit(Documentation documentation) {
		return printer.annotations().printDocumentation(documentation);
	}

	@Override
	public Doc visit(TextualRepresentation textualRepresentation) {
		return printer.annotations().printTextualRepresentation(textualRepresentation);
	}

	@Override
	public Doc visit(MetadataFeature metadataFeature) {
		return printer.annotations().printMetadataFeature(metadataFeature);
	}

	@Override
	public Doc visit(OperatorExpression operatorExpression) {
		return printer.expressions().printOperatorExpression(operatorExpression);
	}

	@Override
	public Doc visit(FeatureReferenceExpression featureReferenceExpression) {
		return printer.expressions().printFeatureReference(featureReferenceExpression);
	}

	@Override
	public Doc visit(InvocationExpression invocationExpression) {
		return printer.expressions().printInvocation(invocationExpression);
	}

	@Override
	public Doc visit(Argument argument) {
		return printer.expressions().printArgument(argument);
	}

	@Override
	public Doc visit(BodyExpression bodyExpression) {
		return printer.expressions().printBodyExpression(bodyExpression);
	}

	@Override
	public Doc visit(LiteralBoolean literalBoolean) {
		return printer.expressions().printLiteral(literalBoolean.getValue() ? "true" : "false", "keyword");
	}

	@Override
	public Doc visit(LiteralNumber literalNumber) {
		return printer.expressions().printNumber(literalNumber);
	}

	@Override
	public Doc visit(LiteralString literalString) {
		return printer.expressions().printString(literalString);
	}

	@Override
	public Doc visit(LiteralInfinity literalInfinity) {
		return printer.expressions().printLiteral("*", "number");
	}

	@Override
	public Doc visit(NullExpression nullExpression) {
		return printer.expressions().printNull(nullExpression);
	}

	@Override
	public Doc visit(MetadataAccessExpression metadataAccessExpression) {
		return printer.expressions().printMetadataAccess(metadataAccessExpression);
	}

	@Override
	public Doc visit(TriggerInvocationExpression triggerInvocationExpression) {
		return printer.expressions().printTrigger(triggerInvocationExpression);
	}
}
