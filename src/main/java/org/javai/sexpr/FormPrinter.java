package org.javai.sexpr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Renders forms back to S-expression text for debugging.
 * <p>
 * Atoms are printed with {@link String#valueOf(Object)}, so text atoms come out as read, including their
 * delimiters. No escaping is applied; the output is not guaranteed to read back to the same tree.
 */
public class FormPrinter<T> implements ElementVisitor<T, Void> {

	private final StringBuilder output = new StringBuilder();
	private final boolean pretty;
	private final int indentSize;
	private int indentLevel = 0;

	public FormPrinter() {
		this(true, 2);
	}

	public FormPrinter(boolean pretty, int indentSize) {
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	@Override
	public Void visitAtom(T value) {
		output.append(value);
		return null;
	}

	/**
	 * Prints the whole form, nested forms included, keeping open forms on an explicit stack.
	 */
	@Override
	public Void visitForm(Form<T> form) {
		Deque<Frame<T>> open = new ArrayDeque<>();
		openForm(form, open);
		while (!open.isEmpty()) {
			Frame<T> frame = open.peek();
			if (!frame.elements.hasNext()) {
				open.pop();
				if (frame.broken) {
					indentLevel--;
				}
				output.append(')');
				continue;
			}
			Element<T> element = frame.elements.next();
			if (!frame.first) {
				separate(frame.broken);
			}
			frame.first = false;
			if (element instanceof Form<T> nested) {
				openForm(nested, open);
			}
			else {
				element.accept(this);
			}
		}
		return null;
	}

	private void openForm(Form<T> form, Deque<Frame<T>> open) {
		output.append('(');
		boolean broken = pretty && form.elements().stream().anyMatch(Element::isForm);
		if (broken) {
			indentLevel++;
		}
		open.push(new Frame<>(form.elements().iterator(), broken));
	}

	private void separate(boolean broken) {
		if (broken) {
			output.append('\n');
			indent();
		}
		else {
			output.append(' ');
		}
	}

	private void indent() {
		output.append(" ".repeat(indentLevel * indentSize));
	}

	/**
	 * Returns the printed output as a string.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Prints a form with one element per line wherever a form contains nested forms.
	 */
	public static String print(Form<?> form) {
		return render(form, true, 2);
	}

	/**
	 * Prints a form on a single line, e.g. {@code (a b (c d))}.
	 */
	public static String printCompact(Form<?> form) {
		return render(form, false, 0);
	}

	private static <T> String render(Form<T> form, boolean pretty, int indentSize) {
		FormPrinter<T> printer = new FormPrinter<>(pretty, indentSize);
		form.accept(printer);
		return printer.toString();
	}

	private static final class Frame<T> {
		private final Iterator<Element<T>> elements;
		private final boolean broken;
		private boolean first = true;

		private Frame(Iterator<Element<T>> elements, boolean broken) {
			this.elements = elements;
			this.broken = broken;
		}
	}
}
