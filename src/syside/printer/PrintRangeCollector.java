package syside.printer;

import syside.model.Element;
import syside.model.Namespace;
import syside.model.OwningMembership;
import syside.model.Relationship;
import syside.model.Token;
import syside.model.expression.Expression;
import syside.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the elements to reprint for a selection. Descends from the root into
 * the smallest scope whose children block covers the selection.
 */
public class PrintRangeCollector {
	private PrintRangeCollector() {}

	/**
	 * @return true if an end of [offset, end) lies strictly inside [start, stop)
	 */
	private static boolean endInside(int offset, int end, int start, int stop) {
		return (offset > start && offset < stop) || (end < stop && end > start);
	}

	private static boolean intersects(Element child, int offset, int end) {
		SourceLocation location = SourceRanges.location(child);
		if (location.isUnknown()) {
			return false;
		}
		int start = location.getStartOffset();
		int stop = location.getEndOffset();
		return (start == offset && stop == end) || endInside(offset, end, start, stop) ||
				endInside(start, stop, offset, end);
	}

	private static List<Element> childrenOf(Element scope) {
		List<Element> children = new ArrayList<>();
		if (scope instanceof Namespace) {
			children.addAll(((Namespace) scope).getMembers());
		} else if (scope instanceof Relationship) {
			children.addAll(((Relationship) scope).getMembers());
		}
		return children;
	}

	private static int blockOffset(Element scope) {
		Element owner = scope;
		while (owner != null && owner.getCst() == null) {
			owner = owner.getParent();
		}
		if (owner == null) {
			return -1;
		}
		Token bracket = owner.getCst().findKeyword("{");
		return bracket != null ? bracket.getLocation().getStartOffset() : -1;
	}

	/**
	 * @return null if there is nothing to print for [offset, end)
	 */
	public static ElementRange collect(Namespace root, int offset, int end) {
		if (root.getCst() == null) {
			return null;
		}
		SourceLocation rootLocation = root.getCst().getLocation();
		if (end <= rootLocation.getStartOffset() || offset >= rootLocation.getEndOffset()) {
			return null;
		}

		int level = 0;
		Element scope = root;
		List<Element> children = childrenOf(root);
		List<Element> leading = null;

		for (;;) {
			int bracket = blockOffset(scope);
			// a cursor just before the bracket has the same offset
			if ((scope.getParent() != null && bracket == -1) || bracket >= offset) {
				if (scope.getParent() instanceof OwningMembership) {
					scope = scope.getParent();
				}
				List<Element> elements = new ArrayList<>();
				elements.add(scope);
				return new ElementRange(elements, SourceRanges.extent(elements), level - 1, leading, false);
			}

			int first = -1;
			int last = -1;
			for (int i = 0; i < children.size(); ++i) {
				if (intersects(children.get(i), offset, end)) {
					if (first == -1) {
						first = i;
					}
					last = i;
				}
			}
			leading = first > 0 ? new ArrayList<>(children.subList(0, first)) : null;

			if (first == -1) {
				return collectBetween(children, end, level);
			}

			if (first == last) {
				Element child = children.get(first);
				Element element = child instanceof Relationship ? ((Relationship) child).getElement() : null;
				if ((child instanceof Relationship && !(element instanceof Expression)) || child instanceof Namespace) {
					// check whether the whole child or only some of its members are selected
					Element target = child instanceof OwningMembership && element instanceof Namespace ? element : child;
					++level;
					scope = target;
					children = childrenOf(target);
					continue;
				}
			}

			List<Element> elements = new ArrayList<>(children.subList(first, last + 1));
			return new ElementRange(elements, SourceRanges.extent(elements), level, leading, false);
		}
	}

	/**
	 * The selection lies in the children block but touches no child, only the
	 * space between the nearest children is formatted.
	 */
	private static ElementRange collectBetween(List<Element> children, int end, int level) {
		switch (children.size()) {
			case 0:
				return null;
			case 1: {
				SourceLocation range = SourceRanges.extent(children);
				if (range.isUnknown()) {
					return null;
				}
				return new ElementRange(new ArrayList<>(children), range, level, null, true);
			}
			default: {
				int next = -1;
				for (int i = 0; i < children.size(); ++i) {
					SourceLocation location = SourceRanges.location(children.get(i));
					if (!location.isUnknown() && location.getStartOffset() >= end) {
						next = i;
						break;
					}
				}
				if (next == -1) {
					return null;
				}
				int previous = next - 1;
				while (previous >= 0 && !SourceRanges.hasSource(children.get(previous))) {
					--previous;
				}
				List<Element> surrounding = previous >= 0
						? new ArrayList<>(children.subList(previous, next + 1))
						: new ArrayList<>(children.subList(next, next + 1));
				List<Element> leading = previous > 0 ? new ArrayList<>(children.subList(0, previous)) : null;
				return new ElementRange(surrounding, SourceRanges.extent(surrounding), level, leading, true);
			}
		}
	}
}
