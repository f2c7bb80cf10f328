package org.javai.sexpr.internal;

import java.io.IOException;
import java.io.Reader;
import java.util.Objects;
import java.util.Optional;
import org.javai.sexpr.Coord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-lookahead cursor over the code points of a character source.
 * <p>
 * The cursor always holds one current code point (or {@link #EOF}) together with its coordinate, and remembers
 * the coordinate of the code point consumed last. Surrogate pairs count as one code point and one column.
 * <p>
 * A failing source is treated as exhausted: the {@link IOException} is logged, kept for {@link #failure()}, and
 * the cursor reports {@link #EOF} from then on.
 */
public final class CharCursor {

	public static final int EOF = -1;

	private static final Logger logger = LoggerFactory.getLogger(CharCursor.class);

	private static final int NONE = -2;

	private final Reader source;
	private int pending = NONE;
	private boolean exhausted;
	private int current;
	private Coord position = Coord.START;
	private Coord lastPosition;
	private IOException failure;

	public CharCursor(Reader source) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.current = readCodePoint();
	}

	/**
	 * The code point under the cursor, or {@link #EOF}.
	 */
	public int current() {
		return current;
	}

	public boolean atEnd() {
		return current == EOF;
	}

	/**
	 * Consumes the current code point and returns the next one.
	 * At end of stream this is a no-op returning {@link #EOF}.
	 */
	public int advance() {
		if (current == EOF) {
			return EOF;
		}
		Coord next = position.next(current);
		lastPosition = position;
		position = next;
		current = readCodePoint();
		return current;
	}

	/**
	 * The coordinate of the current code point, or of the end of stream.
	 */
	public Coord position() {
		return position;
	}

	/**
	 * The coordinate of the code point consumed by the latest {@link #advance()}, {@code null} before the first one.
	 */
	public Coord lastPosition() {
		return lastPosition;
	}

	/**
	 * The error that cut the source short, if reading failed.
	 * <p>
	 * Once set, the cursor is at {@link #EOF}; callers that must tell a truncated source from a complete one
	 * check this after reaching the end.
	 */
	public Optional<IOException> failure() {
		return Optional.ofNullable(failure);
	}

	private int readCodePoint() {
		int high = readChar();
		if (high == EOF || !Character.isHighSurrogate((char) high)) {
			return high;
		}
		int low = readChar();
		if (low != EOF && Character.isLowSurrogate((char) low)) {
			return Character.toCodePoint((char) high, (char) low);
		}
		// unpaired surrogate: hand it out as is and keep what followed
		pending = low;
		return high;
	}

	private int readChar() {
		if (pending != NONE) {
			int c = pending;
			pending = NONE;
			return c;
		}
		if (exhausted) {
			return EOF;
		}
		try {
			int c = source.read();
			if (c == EOF) {
				exhausted = true;
			}
			return c;
		}
		catch (IOException e) {
			// buffered sources fail when refilling, so the bad input is at or after this position
			logger.warn("Reading failed at or after {}, treating source as exhausted", position, e);
			failure = e;
			exhausted = true;
			return EOF;
		}
	}
}
