package syside;

public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable");
	}

	public Unreachable(String what) {
		super("unreachable: " + what);
	}

	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
