package org.javai.sexpr;

/**
 * An entry of a {@link Form}: either an {@link Atom} holding the atom handler's result, or a nested {@link Form}.
 *
 * @param <T> the type produced by the reader's {@link AtomHandler}
 */
public sealed interface Element<T> permits Atom, Form {

	/**
	 * Dispatches to the visitor method matching this element's kind.
	 */
	<R> R accept(ElementVisitor<T, R> visitor);

	/**
	 * Checks if this element is a nested form.
	 */
	default boolean isForm() {
		return this instanceof Form;
	}
}
