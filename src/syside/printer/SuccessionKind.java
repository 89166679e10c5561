package syside.printer;

import syside.model.*;

import java.util.List;

/**
 * Textual forms of a succession usage inside action and state bodies.
 */
public enum SuccessionKind {
	/**
	 * {@code then} followed by the next sibling, e.g. {@code then fork;}
	 */
	EMPTY,
	/**
	 * {@code then target;}
	 */
	TARGET,
	/**
	 * {@code first source then target;}
	 */
	REGULAR,
	/**
	 * {@code then target;} directly after an entry action
	 */
	TRANSITION;

	public static SuccessionKind of(Connector succession, Element previousSibling) {
		List<ConnectorEnd> ends = succession.getEnds();
		if (previousSibling instanceof OwningMembership &&
				((OwningMembership) previousSibling).getKind() == MembershipKind.ENTRY) {
			for (ConnectorEnd end : ends) {
				if (end.isExplicit()) {
					return TRANSITION;
				}
			}
			return EMPTY;
		}

		switch (ends.size()) {
			case 0:
				return EMPTY;
			case 1:
				return ends.get(0).isExplicit() ? TARGET : EMPTY;
			default:
				boolean allExplicit = true;
				for (ConnectorEnd end : ends) {
					allExplicit &= end.isExplicit();
				}
				if (allExplicit) {
					return REGULAR;
				}
				return ends.get(1).isExplicit() ? TARGET : EMPTY;
		}
	}
}
