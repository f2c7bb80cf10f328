package org.javai.sexpr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lexical configuration of a {@link SexprReader}: the quote delimiters and the comment character.
 * <p>
 * The reserved characters, which end a bare atom, are {@code (}, {@code )}, the comment character and every
 * delimiter. Delimiters, the comment character, brackets and whitespace must not overlap; this is checked on
 * construction.
 *
 * @param delimiters delimiter specs keyed by their delimiter character
 * @param commentChar the character that starts a comment running to the end of the line
 */
public record ReaderOptions(Map<Character, DelimiterSpec> delimiters, char commentChar) {

	public static final char DEFAULT_COMMENT_CHAR = ';';

	public static final DelimiterSpec STRING_DELIMITER = DelimiterSpec.escaped('"', '\\', defaultStringEscapes());

	public static final DelimiterSpec SYMBOL_DELIMITER = DelimiterSpec.verbatim('|');

	private static final ReaderOptions DEFAULTS = new ReaderOptions(
		orderedOf(STRING_DELIMITER, SYMBOL_DELIMITER), DEFAULT_COMMENT_CHAR);

	public ReaderOptions {
		Objects.requireNonNull(delimiters, "delimiters must not be null");
		checkLexical(commentChar, "Comment character");
		for (Map.Entry<Character, DelimiterSpec> entry : delimiters.entrySet()) {
			DelimiterSpec spec = Objects.requireNonNull(entry.getValue(), "delimiter spec must not be null");
			if (entry.getKey() != spec.delimiter()) {
				throw new IllegalArgumentException("Delimiter spec for '" + spec.delimiter()
					+ "' registered under '" + entry.getKey() + "'");
			}
			checkLexical(spec.delimiter(), "Delimiter");
			if (spec.delimiter() == commentChar) {
				throw new IllegalArgumentException(
					"Delimiter '" + spec.delimiter() + "' collides with the comment character");
			}
		}
		delimiters = Collections.unmodifiableMap(new LinkedHashMap<>(delimiters));
	}

	/**
	 * {@code "}-quoted strings with {@code \n \t \r \\ \"} escapes, {@code |}-quoted symbols without escapes,
	 * and {@code ;} comments.
	 */
	public static ReaderOptions defaults() {
		return DEFAULTS;
	}

	public ReaderOptions withCommentChar(char newCommentChar) {
		return new ReaderOptions(delimiters, newCommentChar);
	}

	/**
	 * Adds a delimiter, replacing any existing spec for the same character.
	 */
	public ReaderOptions withDelimiter(DelimiterSpec spec) {
		Map<Character, DelimiterSpec> copy = new LinkedHashMap<>(delimiters);
		copy.put(spec.delimiter(), spec);
		return new ReaderOptions(copy, commentChar);
	}

	public ReaderOptions withoutDelimiter(char delimiter) {
		Map<Character, DelimiterSpec> copy = new LinkedHashMap<>(delimiters);
		copy.remove(delimiter);
		return new ReaderOptions(copy, commentChar);
	}

	/**
	 * Returns the delimiter spec opened by the given code point, or {@code null} if it is not a delimiter.
	 */
	public DelimiterSpec delimiterFor(int codePoint) {
		if (codePoint < Character.MIN_VALUE || codePoint > Character.MAX_VALUE) {
			return null;
		}
		return delimiters.get((char) codePoint);
	}

	/**
	 * Checks if the code point terminates a bare atom.
	 */
	public boolean isReserved(int codePoint) {
		return codePoint == '(' || codePoint == ')' || codePoint == commentChar || delimiterFor(codePoint) != null;
	}

	private static void checkLexical(char c, String role) {
		if (c == '(' || c == ')') {
			throw new IllegalArgumentException(role + " must not be a bracket");
		}
		if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
			throw new IllegalArgumentException(role + " must not be whitespace");
		}
	}

	private static Map<Character, String> defaultStringEscapes() {
		Map<Character, String> escapes = new LinkedHashMap<>();
		escapes.put('n', "\n");
		escapes.put('t', "\t");
		escapes.put('r', "\r");
		escapes.put('\\', "\\");
		escapes.put('"', "\"");
		return escapes;
	}

	private static Map<Character, DelimiterSpec> orderedOf(DelimiterSpec... specs) {
		Map<Character, DelimiterSpec> map = new LinkedHashMap<>();
		for (DelimiterSpec spec : specs) {
			map.put(spec.delimiter(), spec);
		}
		return map;
	}
}
