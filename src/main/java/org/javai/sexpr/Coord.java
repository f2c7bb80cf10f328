package org.javai.sexpr;

/**
 * A 1-indexed source position.
 *
 * @param row the line number, starting at 1
 * @param column the code point column within the line, starting at 1
 */
public record Coord(int row, int column) {

	public static final Coord START = new Coord(1, 1);

	public Coord {
		if (row < 1 || column < 1) {
			throw new IllegalArgumentException("Coordinates are 1-indexed, got " + row + ":" + column);
		}
	}

	/**
	 * Returns the coordinate of the code point that follows one read at this position.
	 */
	public Coord next(int codePoint) {
		return codePoint == '\n' ? new Coord(row + 1, 1) : new Coord(row, column + 1);
	}

	@Override
	public String toString() {
		return row + ":" + column;
	}
}
