package org.javai.sexpr;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.javai.sexpr.internal.CharCursor;
import org.javai.sexpr.internal.FormParser;
import org.javai.sexpr.internal.SexprScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads top-level forms from a character source, one at a time.
 * <p>
 * The reader is a single-pass, pull-based iterator: nothing is read until the caller asks for the next form, and
 * reading stops right after the closing bracket of that form. End of input between top-level forms ends the
 * sequence; an empty source yields no forms.
 * <p>
 * Example usage:
 *
 * <pre>
 * SexprReader&lt;String&gt; reader = SexprReader.of(new StringReader("(1 2) (3 (4 5))"));
 * while (reader.hasNext()) {
 *     Form&lt;String&gt; form = reader.next();
 *     ...
 * }
 * </pre>
 *
 * A syntax error is thrown as a {@link SexprSyntaxException} and leaves the reader unusable. A source that fails
 * with an {@link IOException} is treated as ended; see {@link #sourceFailure()}. The reader does not close the
 * source, and it is not safe for use by multiple threads.
 *
 * @param <T> the atom value type produced by the {@link AtomHandler}
 */
public final class SexprReader<T> implements Iterator<Form<T>> {

	private static final Logger logger = LoggerFactory.getLogger(SexprReader.class);

	private final SexprScanner scanner;
	private final FormParser<T> parser;
	private int formsRead;
	private SexprSyntaxException failure;

	private SexprReader(Reader source, ReaderOptions options, AtomHandler<T> atomHandler) {
		this.scanner = new SexprScanner(new CharCursor(source), options);
		this.parser = new FormParser<>(scanner, atomHandler);
	}

	/**
	 * Creates a reader with the default options that keeps atoms as text.
	 */
	public static SexprReader<String> of(Reader source) {
		return of(source, ReaderOptions.defaults(), AtomHandler.identity());
	}

	public static SexprReader<String> of(Reader source, ReaderOptions options) {
		return of(source, options, AtomHandler.identity());
	}

	public static <T> SexprReader<T> of(Reader source, ReaderOptions options, AtomHandler<T> atomHandler) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(options, "options must not be null");
		Objects.requireNonNull(atomHandler, "atomHandler must not be null");
		return new SexprReader<>(source, options, atomHandler);
	}

	/**
	 * Returns {@code true} if anything but whitespace and comments remains in the source.
	 * <p>
	 * This only skips trivia; the next form is not parsed until {@link #next()} is called, so a stray character
	 * also counts as remaining input and is reported by {@link #next()}.
	 */
	@Override
	public boolean hasNext() {
		checkUsable();
		return scanner.skipTrivia() != CharCursor.EOF;
	}

	/**
	 * Reads the next top-level form.
	 *
	 * @throws NoSuchElementException if the source holds no further form
	 * @throws SexprSyntaxException if the input is malformed
	 */
	@Override
	public Form<T> next() {
		return nextForm().orElseThrow(() -> new NoSuchElementException("No more forms after " + position()));
	}

	/**
	 * Reads the next top-level form, or returns an empty result at end of input.
	 *
	 * @throws SexprSyntaxException if the input is malformed
	 */
	public Optional<Form<T>> nextForm() {
		checkUsable();
		try {
			return Optional.ofNullable(readTopLevelForm());
		}
		catch (SexprSyntaxException e) {
			failure = e;
			throw e;
		}
	}

	/**
	 * Reads all remaining forms.
	 */
	public List<Form<T>> readAll() {
		List<Form<T>> forms = new ArrayList<>();
		Optional<Form<T>> form = nextForm();
		while (form.isPresent()) {
			forms.add(form.get());
			form = nextForm();
		}
		return forms;
	}

	/**
	 * Returns the remaining forms as a lazy, sequential stream backed by this reader.
	 */
	public Stream<Form<T>> stream() {
		Spliterator<Form<T>> spliterator = Spliterators.spliteratorUnknownSize(
			this, Spliterator.ORDERED | Spliterator.NONNULL);
		return StreamSupport.stream(spliterator, false);
	}

	/**
	 * The coordinate of the next unread code point.
	 */
	public Coord position() {
		return scanner.cursor().position();
	}

	/**
	 * The error that ended the source early, if any.
	 * <p>
	 * Reading failures are not thrown; the source simply ends where it failed. Check this once the reader reports
	 * no more forms to tell a truncated source from a complete one.
	 */
	public Optional<IOException> sourceFailure() {
		return scanner.cursor().failure();
	}

	/**
	 * The number of top-level forms returned so far.
	 */
	public int formsRead() {
		return formsRead;
	}

	private Form<T> readTopLevelForm() {
		int c = scanner.skipTrivia();
		if (c == CharCursor.EOF) {
			logger.debug("End of input at {} after {} form(s)", position(), formsRead);
			return null;
		}
		if (c != '(') {
			throw new UnexpectedCharException(position(), '(', c);
		}
		Coord open = position();
		scanner.cursor().advance();
		Form<T> form = parser.parseList(open);
		formsRead++;
		logger.debug("Read top-level form #{} spanning {}", formsRead, form.span());
		return form;
	}

	private void checkUsable() {
		if (failure != null) {
			throw new IllegalStateException("Reader failed earlier: " + failure.getMessage(), failure);
		}
	}
}
