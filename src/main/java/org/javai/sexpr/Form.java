package org.javai.sexpr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * A parsed list: the ordered atoms and nested forms between a matched pair of brackets.
 * <p>
 * Forms are only created once their closing {@code )} has been read and are immutable afterwards. Equality,
 * hashing and {@link #toString()} walk the tree with an explicit stack, so they work at any nesting depth the
 * reader accepts.
 *
 * @param elements the entries in source order
 * @param span from the opening {@code (} to the closing {@code )}
 * @param <T> the type produced by the reader's {@link AtomHandler}
 */
public record Form<T>(List<Element<T>> elements, Span span) implements Element<T> {

	public Form {
		elements = List.copyOf(elements);
		Objects.requireNonNull(span, "span must not be null");
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	public Element<T> get(int index) {
		return elements.get(index);
	}

	/**
	 * Returns the value of the atom at the given index.
	 *
	 * @throws IllegalStateException if the element at that index is a nested form
	 */
	public T atomAt(int index) {
		Element<T> element = elements.get(index);
		if (element instanceof Atom<T> atom) {
			return atom.value();
		}
		throw new IllegalStateException("Element " + index + " of form at " + span + " is not an atom");
	}

	/**
	 * Returns the nested form at the given index.
	 *
	 * @throws IllegalStateException if the element at that index is an atom
	 */
	public Form<T> formAt(int index) {
		Element<T> element = elements.get(index);
		if (element instanceof Form<T> form) {
			return form;
		}
		throw new IllegalStateException("Element " + index + " of form at " + span + " is not a form");
	}

	@Override
	public <R> R accept(ElementVisitor<T, R> visitor) {
		return visitor.visitForm(this);
	}

	/**
	 * Two forms are equal when their spans match and their elements are equal pairwise, nested forms included.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Form<?> other)) {
			return false;
		}
		Deque<Form<?>> left = new ArrayDeque<>();
		Deque<Form<?>> right = new ArrayDeque<>();
		left.push(this);
		right.push(other);
		while (!left.isEmpty()) {
			Form<?> a = left.pop();
			Form<?> b = right.pop();
			if (!a.span().equals(b.span()) || a.size() != b.size()) {
				return false;
			}
			for (int i = 0; i < a.size(); i++) {
				Element<?> x = a.get(i);
				Element<?> y = b.get(i);
				if (x instanceof Form<?> nestedX) {
					if (!(y instanceof Form<?> nestedY)) {
						return false;
					}
					if (nestedX != nestedY) {
						left.push(nestedX);
						right.push(nestedY);
					}
				}
				else if (!x.equals(y)) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int hash = 1;
		Deque<Element<?>> pending = new ArrayDeque<>();
		pending.push(this);
		while (!pending.isEmpty()) {
			Element<?> element = pending.pop();
			if (element instanceof Form<?> form) {
				hash = 31 * hash + form.span().hashCode();
				hash = 31 * hash + form.size();
				for (int i = form.size() - 1; i >= 0; i--) {
					pending.push(form.get(i));
				}
			}
			else {
				hash = 31 * hash + element.hashCode();
			}
		}
		return hash;
	}

	@Override
	public String toString() {
		return FormPrinter.printCompact(this);
	}
}
