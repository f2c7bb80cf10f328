package org.javai.sexpr;

/**
 * Visitor interface for traversing parsed forms.
 *
 * @param <T> the atom value type
 * @param <R> the return type of the visitor operations
 */
public interface ElementVisitor<T, R> {

	/**
	 * Visits an atom.
	 *
	 * @param value the atom handler's result for this atom
	 * @return the result of visiting this atom
	 */
	R visitAtom(T value);

	/**
	 * Visits a form. Implementations decide whether to descend into {@link Form#elements()}.
	 *
	 * @param form the form being visited
	 * @return the result of visiting this form
	 */
	R visitForm(Form<T> form);
}
