package org.javai.sexpr;

/**
 * A character was found where a different one was required, e.g. anything but {@code (} at top level.
 */
public class UnexpectedCharException extends SexprSyntaxException {

	private final int expected;
	private final int found;

	public UnexpectedCharException(Coord coord, int expected, int found) {
		super(coord, "expected '" + describe(expected) + "', got '" + describe(found) + "'");
		this.expected = expected;
		this.found = found;
	}

	/**
	 * The code point that was required.
	 */
	public int expected() {
		return expected;
	}

	/**
	 * The code point that was actually read.
	 */
	public int found() {
		return found;
	}
}
