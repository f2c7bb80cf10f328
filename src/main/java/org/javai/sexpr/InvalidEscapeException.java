package org.javai.sexpr;

/**
 * An escape character inside a delimited atom was followed by a character with no configured replacement.
 */
public class InvalidEscapeException extends SexprSyntaxException {

	private final int escapedChar;

	public InvalidEscapeException(Coord coord, int escapedChar) {
		super(coord, "invalid escape character '" + describe(escapedChar) + "'");
		this.escapedChar = escapedChar;
	}

	public int escapedChar() {
		return escapedChar;
	}
}
