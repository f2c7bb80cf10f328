package org.javai.sexpr;

/**
 * Atom text paired with its source span, as produced by {@link AtomHandler#withSpan()}.
 */
public record SourceAtom(String text, Span span) {

	@Override
	public String toString() {
		return text;
	}
}
