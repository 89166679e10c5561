package syside.doc;

/**
 * A possible line break.
 *
 * AUTO prints a space when flat, SOFT prints nothing when flat, HARD always breaks
 * and LITERAL always breaks without indenting the next line.
 */
public class Line extends Doc {
	public enum Mode {
		AUTO,
		SOFT,
		HARD,
		LITERAL,
	}

	private final Mode mode;

	public Line(Mode mode) {
		this.mode = mode;
	}

	public Mode getMode() {
		return mode;
	}

	public boolean isHard() {
		return mode == Mode.HARD || mode == Mode.LITERAL;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
