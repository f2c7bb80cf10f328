package org.javai.sexpr.internal;

import java.util.Objects;
import org.javai.sexpr.Coord;
import org.javai.sexpr.DelimiterSpec;
import org.javai.sexpr.InvalidEscapeException;
import org.javai.sexpr.ReaderOptions;
import org.javai.sexpr.Span;
import org.javai.sexpr.UnexpectedEofException;

/**
 * Character-level scanner: skips whitespace and comments and reads single atoms off a {@link CharCursor}.
 */
public final class SexprScanner {

	private final CharCursor cursor;
	private final ReaderOptions options;

	public SexprScanner(CharCursor cursor, ReaderOptions options) {
		this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public CharCursor cursor() {
		return cursor;
	}

	public ReaderOptions options() {
		return options;
	}

	/**
	 * Skips whitespace and comments.
	 *
	 * @return the first code point that is neither, or {@link CharCursor#EOF}
	 */
	public int skipTrivia() {
		while (true) {
			int c = cursor.current();
			if (isWhitespace(c)) {
				cursor.advance();
			}
			else if (c == options.commentChar()) {
				while (c != CharCursor.EOF && c != '\n') {
					c = cursor.advance();
				}
			}
			else {
				return c;
			}
		}
	}

	/**
	 * Reads an atom enclosed by the given delimiter, starting at the opening delimiter.
	 * <p>
	 * The returned text keeps both delimiters and has its escape sequences replaced.
	 *
	 * @throws InvalidEscapeException if an escape character is followed by an unmapped character
	 * @throws UnexpectedEofException if the input ends before the closing delimiter
	 */
	public Token readDelimited(DelimiterSpec spec) {
		Coord start = cursor.position();
		StringBuilder text = new StringBuilder();
		text.appendCodePoint(cursor.current());
		int c = cursor.advance();
		while (c != CharCursor.EOF) {
			if (spec.hasEscapes() && c == spec.escapeChar()) {
				c = cursor.advance();
				if (c == CharCursor.EOF) {
					break;
				}
				String replacement = spec.replacementFor(c);
				if (replacement == null) {
					throw new InvalidEscapeException(cursor.position(), c);
				}
				text.append(replacement);
			}
			else if (c == spec.delimiter()) {
				text.appendCodePoint(c);
				Coord end = cursor.position();
				cursor.advance();
				return new Token(text.toString(), new Span(start, end));
			}
			else {
				text.appendCodePoint(c);
			}
			c = cursor.advance();
		}
		throw new UnexpectedEofException(cursor.position());
	}

	/**
	 * Reads a bare atom starting at the current code point, which must be neither trivia nor reserved.
	 * The terminating code point is left under the cursor.
	 */
	public Token readBareAtom() {
		Coord start = cursor.position();
		Coord end = start;
		StringBuilder text = new StringBuilder();
		int c = cursor.current();
		while (c != CharCursor.EOF && !isWhitespace(c) && !options.isReserved(c)) {
			text.appendCodePoint(c);
			end = cursor.position();
			c = cursor.advance();
		}
		return new Token(text.toString(), new Span(start, end));
	}

	static boolean isWhitespace(int c) {
		return c != CharCursor.EOF && (Character.isWhitespace(c) || Character.isSpaceChar(c));
	}

	/**
	 * Raw atom text with its span.
	 */
	public record Token(String text, Span span) {
	}
}
