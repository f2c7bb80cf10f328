package org.javai.sexpr.internal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.sexpr.Atom;
import org.javai.sexpr.AtomHandler;
import org.javai.sexpr.Coord;
import org.javai.sexpr.DelimiterSpec;
import org.javai.sexpr.Element;
import org.javai.sexpr.Form;
import org.javai.sexpr.Span;
import org.javai.sexpr.UnexpectedEofException;

/**
 * Parses the remainder of a list whose opening bracket has already been consumed.
 * <p>
 * Open lists are kept on an explicit frame stack rather than the call stack, so deeply nested input cannot
 * overflow it.
 *
 * @param <T> the atom value type
 */
public final class FormParser<T> {

	private final SexprScanner scanner;
	private final AtomHandler<T> atomHandler;

	public FormParser(SexprScanner scanner, AtomHandler<T> atomHandler) {
		this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
		this.atomHandler = Objects.requireNonNull(atomHandler, "atomHandler must not be null");
	}

	/**
	 * Reads elements up to the {@code )} matching the already consumed {@code (} at {@code open}.
	 *
	 * @throws UnexpectedEofException if the input ends before every open list is closed
	 */
	public Form<T> parseList(Coord open) {
		CharCursor cursor = scanner.cursor();
		Deque<Frame<T>> parents = new ArrayDeque<>();
		Frame<T> frame = new Frame<>(open);
		while (true) {
			int c = scanner.skipTrivia();
			if (c == CharCursor.EOF) {
				throw new UnexpectedEofException(cursor.position());
			}
			if (c == '(') {
				Coord nestedOpen = cursor.position();
				cursor.advance();
				parents.push(frame);
				frame = new Frame<>(nestedOpen);
			}
			else if (c == ')') {
				Coord close = cursor.position();
				cursor.advance();
				Form<T> form = frame.close(close);
				if (parents.isEmpty()) {
					return form;
				}
				frame = parents.pop();
				frame.elements.add(form);
			}
			else {
				DelimiterSpec delimiter = scanner.options().delimiterFor(c);
				SexprScanner.Token token = delimiter != null
					? scanner.readDelimited(delimiter)
					: scanner.readBareAtom();
				frame.elements.add(new Atom<>(atomHandler.handle(token.text(), token.span())));
			}
		}
	}

	private static final class Frame<T> {
		final Coord open;
		final List<Element<T>> elements = new ArrayList<>();

		Frame(Coord open) {
			this.open = open;
		}

		Form<T> close(Coord close) {
			return new Form<>(elements, new Span(open, close));
		}
	}
}
