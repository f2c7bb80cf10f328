package org.javai.sexpr;

/**
 * A leaf of a form.
 *
 * @param value whatever the atom handler returned for the atom's text and span; {@code null} if the handler
 *     returned {@code null}
 */
public record Atom<T>(T value) implements Element<T> {

	@Override
	public <R> R accept(ElementVisitor<T, R> visitor) {
		return visitor.visitAtom(value);
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
