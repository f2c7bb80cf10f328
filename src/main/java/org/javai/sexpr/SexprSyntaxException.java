package org.javai.sexpr;

/**
 * Exception thrown when reading S-expression input fails.
 * <p>
 * Every syntax error carries the coordinate at which the malformed input was detected. Errors are fatal to
 * the reading session that raised them.
 */
public abstract class SexprSyntaxException extends RuntimeException {

	private final Coord coord;
	private final String detail;

	protected SexprSyntaxException(Coord coord, String detail) {
		super(detail + " at " + coord);
		this.coord = coord;
		this.detail = detail;
	}

	/**
	 * The position at which the error was detected.
	 */
	public Coord coord() {
		return coord;
	}

	/**
	 * The error description without the coordinate suffix.
	 */
	public String detail() {
		return detail;
	}

	static String describe(int codePoint) {
		return new String(Character.toChars(codePoint));
	}
}
