package syside.model;

import syside.model.expression.*;
import syside.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for assembling element graphs by hand, mostly for tests and
 * programmatic edits. Elements created here have no concrete syntax.
 */
public class ModelBuilder {
	private ModelBuilder() {}

	// references

	public static Reference ref(String qualifiedName) {
		return new Reference(Arrays.asList(qualifiedName.split("::")), null);
	}

	public static Reference ref(String qualifiedName, Element target) {
		return new Reference(Arrays.asList(qualifiedName.split("::")), target);
	}

	/**
	 * A synthesized reference without text, printed through its target.
	 */
	public static Reference ref(Element target) {
		return new Reference(null, target);
	}

	public static FeatureChain chain(String... parts) {
		List<Reference> chainings = new ArrayList<>();
		for (String part : parts) {
			chainings.add(ref(part));
		}
		return new FeatureChain(chainings);
	}

	// namespaces

	public static Namespace root(Relationship... members) {
		Namespace root = new Namespace();
		for (Relationship member : members) {
			root.addMember(member);
		}
		return root;
	}

	public static Package pkg(String name, Relationship... members) {
		Package pkg = new Package();
		pkg.setDeclaredName(name);
		for (Relationship member : members) {
			pkg.addMember(member);
		}
		return pkg;
	}

	public static <T extends Namespace> T body(T namespace, Relationship... members) {
		for (Relationship member : members) {
			namespace.addMember(member);
		}
		return namespace;
	}

	public static <T extends Element> T named(T element, String name) {
		element.setDeclaredName(name);
		return element;
	}

	public static OwningMembership member(Element element) {
		return new OwningMembership(MembershipKind.MEMBER, element);
	}

	public static OwningMembership featureMember(Element element) {
		return new OwningMembership(MembershipKind.FEATURE, element);
	}

	public static OwningMembership membership(MembershipKind kind, Element element) {
		return new OwningMembership(kind, element);
	}

	public static OwningMembership membership(Visibility visibility, Element element) {
		OwningMembership membership = member(element);
		membership.setVisibility(visibility);
		return membership;
	}

	// types

	public static Type type(String name, Heritage... heritage) {
		return withHeritage(named(new Type(), name), heritage);
	}

	public static Classifier classifier(ClassifierKind kind, String name, Heritage... heritage) {
		return withHeritage(named(new Classifier(kind), name), heritage);
	}

	public static Feature feature(String name, Heritage... heritage) {
		return withHeritage(named(new Feature(FeatureKind.FEATURE), name), heritage);
	}

	public static Feature feature(FeatureKind kind, String name, Heritage... heritage) {
		return withHeritage(named(new Feature(kind), name), heritage);
	}

	public static Usage usage(UsageKind kind, String name, Heritage... heritage) {
		return withHeritage(named(new Usage(kind), name), heritage);
	}

	public static Definition definition(DefinitionKind kind, String name, Heritage... heritage) {
		return withHeritage(named(new Definition(kind), name), heritage);
	}

	public static <T extends Type> T withHeritage(T type, Heritage... heritage) {
		for (Heritage h : heritage) {
			type.addHeritage(h);
		}
		return type;
	}

	public static Heritage heritage(HeritageKind kind, String target) {
		return new Heritage(kind, ref(target));
	}

	public static Heritage specializes(String target) {
		return heritage(HeritageKind.SPECIALIZATION, target);
	}

	public static Heritage typedBy(String target) {
		return heritage(HeritageKind.FEATURE_TYPING, target);
	}

	public static Heritage subsets(String target) {
		return heritage(HeritageKind.SUBSETTING, target);
	}

	public static Heritage redefines(String target) {
		return heritage(HeritageKind.REDEFINITION, target);
	}

	public static Heritage references(String target) {
		return heritage(HeritageKind.REFERENCE_SUBSETTING, target);
	}

	public static Heritage unions(String target) {
		return heritage(HeritageKind.UNIONING, target);
	}

	public static MultiplicityRange multiplicity(Expression lower, Expression upper) {
		return new MultiplicityRange(lower, upper);
	}

	public static MultiplicityRange multiplicity(Expression upper) {
		return new MultiplicityRange(null, upper);
	}

	public static <T extends Feature> T value(T feature, Expression value) {
		feature.setValue(new FeatureValue(value, false, false));
		return feature;
	}

	public static <T extends Feature> T initialValue(T feature, Expression value) {
		feature.setValue(new FeatureValue(value, false, true));
		return feature;
	}

	// actions

	public static ControlNode decide(String name) {
		return named(new ControlNode(ControlNodeKind.DECISION), name);
	}

	public static ControlNode fork(String name) {
		return named(new ControlNode(ControlNodeKind.FORK), name);
	}

	/**
	 * A `then target;` succession shorthand.
	 */
	public static Connector then(String target) {
		Connector succession = new Connector(ConnectorKind.SUCCESSION_AS_USAGE);
		succession.addEnd(new ConnectorEnd(null, null));
		succession.addEnd(new ConnectorEnd(null, ref(target)));
		return succession;
	}

	/**
	 * A bare `then` that binds to the next sibling.
	 */
	public static Connector then() {
		Connector succession = new Connector(ConnectorKind.SUCCESSION_AS_USAGE);
		succession.addEnd(new ConnectorEnd(null, null));
		succession.addEnd(new ConnectorEnd(null, null));
		return succession;
	}

	/**
	 * A `first source then target;` succession.
	 */
	public static Connector succession(String source, String target) {
		Connector succession = new Connector(ConnectorKind.SUCCESSION_AS_USAGE);
		succession.addEnd(new ConnectorEnd(null, ref(source)));
		succession.addEnd(new ConnectorEnd(null, ref(target)));
		return succession;
	}

	/**
	 * A connector of kind between the named ends.
	 */
	public static Connector connector(ConnectorKind kind, String... ends) {
		Connector connector = new Connector(kind);
		for (String end : ends) {
			connector.addEnd(new ConnectorEnd(null, ref(end)));
		}
		return connector;
	}

	/**
	 * An `if guard then target;` transition, guard may be null.
	 */
	public static TransitionUsage transition(Expression guard, String target) {
		TransitionUsage transition = new TransitionUsage();
		transition.setGuard(guard);
		transition.setTarget(ref(target));
		return transition;
	}

	public static TransitionUsage elseTransition(String target) {
		TransitionUsage transition = transition(null, target);
		transition.setElse(true);
		return transition;
	}

	/**
	 * An accept action receiving a payload of the given type.
	 */
	public static AcceptActionUsage accept(String payload, String payloadType) {
		AcceptActionUsage accept = new AcceptActionUsage();
		accept.setPayload(usage(UsageKind.REFERENCE, payload, typedBy(payloadType)));
		return accept;
	}

	public static AssignmentActionUsage assign(Element target, Expression value) {
		AssignmentActionUsage assignment = new AssignmentActionUsage();
		assignment.setTarget(target);
		assignment.setAssignedValue(value);
		return assignment;
	}

	// expressions

	public static LiteralNumber num(long value) {
		return new LiteralNumber(value, true);
	}

	public static LiteralNumber real(double value) {
		return new LiteralNumber(value, false);
	}

	public static LiteralBoolean bool(boolean value) {
		return new LiteralBoolean(value);
	}

	public static LiteralString str(String value) {
		return new LiteralString(value);
	}

	public static LiteralInfinity inf() {
		return new LiteralInfinity();
	}

	public static NullExpression nul() {
		return new NullExpression();
	}

	public static FeatureReferenceExpression fref(String qualifiedName) {
		return new FeatureReferenceExpression(ref(qualifiedName));
	}

	public static OperatorExpression op(Operator operator, Expression... args) {
		return new OperatorExpression(operator, Arrays.asList(args));
	}

	public static OperatorExpression dot(Expression lhs, String member) {
		return op(Operator.DOT, lhs, fref(member));
	}

	public static InvocationExpression invoke(String function, Expression... args) {
		InvocationExpression invocation = new InvocationExpression(ref(function));
		for (Expression arg : args) {
			invocation.addArgument(new Argument(null, arg));
		}
		return invocation;
	}

	public static InvocationExpression arrow(Expression target, String function, Expression... args) {
		InvocationExpression invocation = invoke(function, args);
		invocation.setTarget(target);
		return invocation;
	}

	public static InvocationExpression arrow(Expression target, String function, BodyExpression body) {
		InvocationExpression invocation = new InvocationExpression(ref(function));
		invocation.setTarget(target);
		invocation.setBody(body);
		return invocation;
	}

	public static Argument arg(String name, Expression value) {
		return new Argument(ref(name), value);
	}

	public static BodyExpression lambda(Expression result, Relationship... members) {
		BodyExpression body = new BodyExpression();
		for (Relationship member : members) {
			body.addMember(member);
		}
		body.setResult(result);
		return body;
	}

	public static Feature in(String name) {
		Feature parameter = feature(name);
		parameter.setDirection(FeatureDirection.IN);
		return parameter;
	}

	// notes

	public static Comment comment(String body, String... about) {
		Comment comment = new Comment(body);
		for (String target : about) {
			comment.addAbout(ref(target));
		}
		return comment;
	}

	public static Documentation doc(String body) {
		return new Documentation(body);
	}

	public static <T extends Element> T note(T element, Note.Kind kind, Note.Placement placement, String text) {
		element.addNote(new Note(kind, text, placement, null, SourceLocation.unknown(), 1, 1));
		return element;
	}

	public static <T extends Element> T leadingNote(T element, String text) {
		return note(element, Note.Kind.LINE, Note.Placement.LEADING, text);
	}

	public static <T extends Element> T trailingNote(T element, String text) {
		element.addNote(new Note(Note.Kind.LINE, text, Note.Placement.TRAILING, null, SourceLocation.unknown(), 0, 1));
		return element;
	}

	public static <T extends Element> T innerNote(T element, String label, String text) {
		element.addNote(new Note(Note.Kind.BLOCK, text, Note.Placement.INNER, label, SourceLocation.unknown(), 1,
				1));
		return element;
	}
}
