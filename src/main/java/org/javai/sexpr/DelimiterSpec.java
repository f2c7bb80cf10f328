package org.javai.sexpr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one quote delimiter, e.g. {@code "} for strings or {@code |} for symbols containing spaces.
 *
 * @param delimiter the character that opens and closes the atom
 * @param escapeChar the character that introduces an escape sequence, or {@code null} for no escape processing
 * @param escapes maps the character following {@code escapeChar} to its replacement text
 */
public record DelimiterSpec(char delimiter, Character escapeChar, Map<Character, String> escapes) {

	public DelimiterSpec {
		Objects.requireNonNull(escapes, "escapes must not be null");
		if (escapeChar == null && !escapes.isEmpty()) {
			throw new IllegalArgumentException(
				"Delimiter '" + delimiter + "' defines escape sequences but no escape character");
		}
		escapes = Collections.unmodifiableMap(new LinkedHashMap<>(escapes));
	}

	/**
	 * A delimiter whose contents are taken literally.
	 */
	public static DelimiterSpec verbatim(char delimiter) {
		return new DelimiterSpec(delimiter, null, Map.of());
	}

	/**
	 * A delimiter with escape processing.
	 */
	public static DelimiterSpec escaped(char delimiter, char escapeChar, Map<Character, String> escapes) {
		return new DelimiterSpec(delimiter, escapeChar, escapes);
	}

	public boolean hasEscapes() {
		return escapeChar != null;
	}

	/**
	 * Returns the replacement for the character following the escape character, or {@code null} if unmapped.
	 */
	public String replacementFor(int codePoint) {
		if (codePoint < Character.MIN_VALUE || codePoint > Character.MAX_VALUE) {
			return null;
		}
		return escapes.get((char) codePoint);
	}
}
