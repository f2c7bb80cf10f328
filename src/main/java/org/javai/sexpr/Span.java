package org.javai.sexpr;

import java.util.Objects;

/**
 * The inclusive source range of an atom or a form.
 * For a form, {@code start} is the position of its {@code (} and {@code end} the position of its {@code )}.
 */
public record Span(Coord start, Coord end) {

	public Span {
		Objects.requireNonNull(start, "start must not be null");
		Objects.requireNonNull(end, "end must not be null");
	}

	@Override
	public String toString() {
		return start + "-" + end;
	}
}
