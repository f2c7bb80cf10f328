package org.javai.sexpr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Common traversal patterns over parsed forms.
 * <p>
 * All traversals keep their position on an explicit stack rather than recursing, so any tree the reader produces
 * can be walked.
 */
public final class FormWalker {

	private FormWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits each element of the tree, the element itself before its children.
	 *
	 * @return the result of visiting the root element
	 */
	public static <T, R> R walkPreOrder(Element<T> element, ElementVisitor<T, R> visitor) {
		if (element == null) {
			return null;
		}
		R result = element.accept(visitor);
		Deque<Element<T>> pending = new ArrayDeque<>();
		pushChildren(element, pending);
		while (!pending.isEmpty()) {
			Element<T> next = pending.pop();
			next.accept(visitor);
			pushChildren(next, pending);
		}
		return result;
	}

	/**
	 * Visits each element of the tree, children before the element itself.
	 *
	 * @return the result of visiting the root element
	 */
	public static <T, R> R walkPostOrder(Element<T> element, ElementVisitor<T, R> visitor) {
		if (element == null) {
			return null;
		}
		if (!(element instanceof Form<T> root)) {
			return element.accept(visitor);
		}
		Deque<Level<T>> open = new ArrayDeque<>();
		open.push(new Level<>(root));
		while (true) {
			Level<T> level = open.peek();
			if (level.children.hasNext()) {
				Element<T> child = level.children.next();
				if (child instanceof Form<T> nested) {
					open.push(new Level<>(nested));
				}
				else {
					child.accept(visitor);
				}
				continue;
			}
			open.pop();
			R result = level.form.accept(visitor);
			if (open.isEmpty()) {
				return result;
			}
		}
	}

	/**
	 * Walks a list of top-level forms in pre-order.
	 */
	public static <T, R> void walkAll(List<Form<T>> forms, ElementVisitor<T, R> visitor) {
		if (forms == null) {
			return;
		}
		for (Form<T> form : forms) {
			walkPreOrder(form, visitor);
		}
	}

	/**
	 * Returns the bracket nesting depth: 0 for an atom, 1 for a form without nested forms.
	 */
	public static int depth(Element<?> element) {
		if (!(element instanceof Form<?> root)) {
			return 0;
		}
		int deepest = 0;
		Deque<Form<?>> forms = new ArrayDeque<>();
		Deque<Integer> depths = new ArrayDeque<>();
		forms.push(root);
		depths.push(1);
		while (!forms.isEmpty()) {
			Form<?> form = forms.pop();
			int depth = depths.pop();
			deepest = Math.max(deepest, depth);
			for (Element<?> child : form.elements()) {
				if (child instanceof Form<?> nested) {
					forms.push(nested);
					depths.push(depth + 1);
				}
			}
		}
		return deepest;
	}

	/**
	 * Counts the atoms anywhere below the given element, including the element itself.
	 */
	public static int countAtoms(Element<?> element) {
		int count = 0;
		Deque<Element<?>> pending = new ArrayDeque<>();
		pending.push(element);
		while (!pending.isEmpty()) {
			Element<?> next = pending.pop();
			if (next instanceof Form<?> form) {
				form.elements().forEach(pending::push);
			}
			else {
				count++;
			}
		}
		return count;
	}

	private static <T> void pushChildren(Element<T> element, Deque<Element<T>> pending) {
		if (element instanceof Form<T> form) {
			List<Element<T>> children = form.elements();
			for (int i = children.size() - 1; i >= 0; i--) {
				pending.push(children.get(i));
			}
		}
	}

	private static final class Level<T> {
		private final Form<T> form;
		private final Iterator<Element<T>> children;

		private Level(Form<T> form) {
			this.form = form;
			this.children = form.elements().iterator();
		}
	}
}
