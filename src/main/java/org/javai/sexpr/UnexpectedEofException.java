package org.javai.sexpr;

/**
 * The input ended while a list or a delimited atom was still open.
 */
public class UnexpectedEofException extends SexprSyntaxException {

	public UnexpectedEofException(Coord coord) {
		super(coord, "unexpected end of file");
	}
}
