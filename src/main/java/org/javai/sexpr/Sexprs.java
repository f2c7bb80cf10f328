package org.javai.sexpr;

import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.Optional;

/**
 * Shortcuts for reading whole inputs when laziness is not needed.
 */
public final class Sexprs {

	private Sexprs() {
		// Utility class - no instantiation
	}

	/**
	 * Parses every form in the given text with the default options.
	 */
	public static List<Form<String>> parse(String text) {
		return SexprReader.of(new StringReader(text)).readAll();
	}

	public static <T> List<Form<T>> readAll(Reader source, ReaderOptions options, AtomHandler<T> atomHandler) {
		return SexprReader.of(source, options, atomHandler).readAll();
	}

	/**
	 * Reads only the first form of the source, leaving anything after its closing bracket unread.
	 *
	 * @return the first form, or an empty result if the source holds nothing but whitespace and comments
	 */
	public static Optional<Form<String>> readFirst(Reader source) {
		return SexprReader.of(source).nextForm();
	}

	public static <T> Optional<Form<T>> readFirst(Reader source, ReaderOptions options, AtomHandler<T> atomHandler) {
		return SexprReader.of(source, options, atomHandler).nextForm();
	}
}
