package org.javai.sexpr;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts the text of an atom into the value stored in the tree.
 * <p>
 * The text of a delimited atom includes its delimiters with escapes already decoded, e.g. {@code "a\"b"} is
 * handed over as {@code "a"b"}.
 *
 * @param <T> the value type stored in {@link Atom}s
 */
@FunctionalInterface
public interface AtomHandler<T> {

	T handle(String text, Span span);

	/**
	 * Keeps the atom text as is and ignores the span.
	 */
	static AtomHandler<String> identity() {
		return (text, span) -> text;
	}

	/**
	 * Adapts a text-only conversion.
	 */
	static <T> AtomHandler<T> ofText(Function<String, T> conversion) {
		Objects.requireNonNull(conversion, "conversion must not be null");
		return (text, span) -> conversion.apply(text);
	}

	/**
	 * Keeps both the text and the span of every atom.
	 */
	static AtomHandler<SourceAtom> withSpan() {
		return SourceAtom::new;
	}
}
