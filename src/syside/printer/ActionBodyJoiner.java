package syside.printer;

import syside.doc.Doc;
import syside.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static syside.doc.DocBuilder.*;

/**
 * Joins children of action and state bodies. Successions following a decision
 * or fork node are indented one level per open node until a child that does
 * not continue the branch closes it.
 *
 * A joiner keeps state and must only be used for a single block.
 */
public class ActionBodyJoiner implements ChildrenJoiner {
	private static class Branch {
		final ControlNodeKind kind;
		boolean done = false;

		Branch(ControlNodeKind kind) {
			this.kind = kind;
		}
	}

	private final List<Branch> stack = new ArrayList<>();
	private Doc continuation = null;

	private Branch top() {
		return stack.isEmpty() ? null : stack.get(stack.size() - 1);
	}

	private void popIfDone() {
		Branch top = top();
		if (top != null && top.done) {
			stack.remove(stack.size() - 1);
		}
	}

	private Doc applyIndent(Doc doc) {
		for (int i = 0; i < stack.size(); ++i) {
			doc = indent(doc);
		}
		return doc;
	}

	private Doc advance(Element child, int index, Doc doc, Element previous) {
		Element target = child;
		if (target instanceof OwningMembership) {
			target = ((OwningMembership) target).getElement();
		}

		if (continuation != null) {
			Doc pending = continuation;
			continuation = null;
			if (doc != null) {
				doc = concat(pending, group(indent(LINE)), doc);
			}
			index--;
		} else if (target instanceof TransitionUsage) {
			TransitionUsage transition = (TransitionUsage) target;
			if (transition.getSource() != null) {
				stack.clear();
			} else if (transition.isElse() && top() != null && top().kind == ControlNodeKind.DECISION) {
				top().done = true;
			} else {
				popIfDone();
			}
		} else if (target instanceof Connector &&
				((Connector) target).getConnectorKind() == ConnectorKind.SUCCESSION_AS_USAGE) {
			SuccessionKind kind = SuccessionKind.of((Connector) target, previous);
			if (kind == SuccessionKind.REGULAR) {
				// starts with `first` so it is not a shorthand
				stack.clear();
			} else {
				popIfDone();
			}
			if (kind == SuccessionKind.EMPTY) {
				continuation = doc;
				return null;
			}
		} else {
			stack.clear();
		}

		if (doc != null && index != 0) {
			doc = applyIndent(concat(HARDLINE, doc));
		}

		if (target instanceof ControlNode) {
			ControlNodeKind kind = ((ControlNode) target).getNodeKind();
			// only decision and fork nodes have multiple outgoing successions
			if (kind == ControlNodeKind.DECISION || kind == ControlNodeKind.FORK) {
				stack.add(new Branch(kind));
			}
		}

		return doc;
	}

	@Override
	public Doc join(List<? extends Element> children, List<Doc> printed, List<? extends Element> leading) {
		if (leading == null) {
			leading = Collections.emptyList();
		}
		for (int i = 0; i < leading.size(); ++i) {
			advance(leading.get(i), 0, null, i > 0 ? leading.get(i - 1) : null);
		}
		List<Doc> parts = new ArrayList<>();
		for (int i = 0; i < children.size(); ++i) {
			Element previous;
			if (i > 0) {
				previous = children.get(i - 1);
			} else {
				previous = leading.isEmpty() ? null : leading.get(leading.size() - 1);
			}
			Doc doc = advance(children.get(i), i, printed.get(i), previous);
			if (doc != null) {
				parts.add(doc);
			}
		}
		if (continuation != null) {
			// a trailing `then` with nothing after it
			parts.add(parts.isEmpty() ? continuation : applyIndent(concat(HARDLINE, continuation)));
			continuation = null;
		}
		return concat(parts);
	}
}
