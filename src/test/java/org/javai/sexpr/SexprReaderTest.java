package org.javai.sexpr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.Level;
import org.javai.sexpr.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Behaviour of the top-level reader: structure, spans, laziness and error reporting.
 */
class SexprReaderTest {

	private static SexprReader<String> readerFor(String input) {
		return SexprReader.of(new StringReader(input));
	}

	private static Form<String> readSingle(String input) {
		List<Form<String>> forms = readerFor(input).readAll();
		assertThat(forms).hasSize(1);
		return forms.get(0);
	}

	/**
	 * Converts a form into nested lists of atom strings for structural comparison.
	 */
	private static List<Object> structure(Form<String> form) {
		List<Object> result = new ArrayList<>();
		for (Element<String> element : form.elements()) {
			if (element instanceof Form<String> nested) {
				result.add(structure(nested));
			}
			else {
				result.add(((Atom<String>) element).value());
			}
		}
		return result;
	}

	static Stream<Arguments> wellFormedInputs() {
		return Stream.of(
				Arguments.of("()", List.of()),
				Arguments.of("(|a b c| || \"abc\\\"def\" |abcgf xs!!|)",
						List.of("|a b c|", "||", "\"abc\"def\"", "|abcgf xs!!|")),
				Arguments.of("(abc b0!@#$% c-d)", List.of("abc", "b0!@#$%", "c-d")),
				Arguments.of("(1😀)", List.of("1😀")),
				Arguments.of("(a b c (d e f () |x yz|))",
						List.of("a", "b", "c", List.of("d", "e", "f", List.of(), "|x yz|"))),
				Arguments.of("(1 (2 3) (4 5) 6 (7 (8 9)))",
						List.of("1", List.of("2", "3"), List.of("4", "5"), "6", List.of("7", List.of("8", "9")))),
				Arguments.of("(1 (2 3) (4 5)); 6 (7 (8 9)))",
						List.of("1", List.of("2", "3"), List.of("4", "5"))),
				Arguments.of("  ; leading comment\n\t(x)\n", List.of("x")));
	}

	@ParameterizedTest
	@MethodSource("wellFormedInputs")
	void readsWellFormedInput(String input, List<Object> expected) {
		assertThat(structure(readSingle(input))).isEqualTo(expected);
	}

	@Nested
	class MultipleForms {

		@Test
		void yieldsTopLevelFormsInOrder() {
			SexprReader<String> reader = readerFor("(1 2) (3 (4 5))");

			assertThat(reader.hasNext()).isTrue();
			assertThat(structure(reader.next())).isEqualTo(List.of("1", "2"));
			assertThat(reader.hasNext()).isTrue();
			assertThat(structure(reader.next())).isEqualTo(List.of("3", List.of("4", "5")));
			assertThat(reader.hasNext()).isFalse();
			assertThat(reader.formsRead()).isEqualTo(2);
		}

		@Test
		void firstFormDoesNotForceReadingTheSecond() {
			CountingReader source = new CountingReader("(1 2) (3 (4 5))");
			SexprReader<String> reader = SexprReader.of(source);

			Form<String> first = reader.next();

			assertThat(structure(first)).isEqualTo(List.of("1", "2"));
			// the closing bracket plus one character of lookahead
			assertThat(source.charsRead()).isEqualTo(6);
		}

		@Test
		void malformedLaterFormDoesNotAffectEarlierOnes() {
			SexprReader<String> reader = readerFor("(a) (b");

			assertThat(structure(reader.next())).isEqualTo(List.of("a"));
			assertThatThrownBy(reader::next).isInstanceOf(UnexpectedEofException.class);
		}

		@Test
		void streamIsLazy() {
			Optional<Form<String>> first = readerFor("(a) this is not a form").stream().findFirst();

			assertThat(first).hasValueSatisfying(form -> assertThat(form.atomAt(0)).isEqualTo("a"));
		}

		@Test
		void streamYieldsAllForms() {
			String printed = readerFor("(a) (b (c)) ()").stream()
					.map(Form::toString)
					.collect(Collectors.joining(" | "));

			assertThat(printed).isEqualTo("(a) | (b (c)) | ()");
		}

		@Test
		void nextFormReturnsEmptyAtEnd() {
			SexprReader<String> reader = readerFor("(a) ; done");

			assertThat(reader.nextForm()).isPresent();
			assertThat(reader.nextForm()).isEmpty();
			assertThat(reader.nextForm()).isEmpty();
		}

		@Test
		void nextPastEndThrowsNoSuchElement() {
			SexprReader<String> reader = readerFor("(a)");
			reader.next();

			assertThatThrownBy(reader::next).isInstanceOf(NoSuchElementException.class);
		}

		@Test
		void formsNeedNoSeparator() {
			assertThat(readerFor("(a)(b)").readAll()).hasSize(2);
		}
	}

	@Nested
	class EmptyInput {

		@ParameterizedTest
		@ValueSource(strings = {"", "   ", "\n\n", "; only a comment", "; one\n; two\n"})
		void yieldsNoFormsAndNoError(String input) {
			SexprReader<String> reader = readerFor(input);

			assertThat(reader.hasNext()).isFalse();
			assertThat(reader.readAll()).isEmpty();
		}
	}

	@Nested
	class SourceFailures {

		@Test
		void failingSourceEndsTheSequenceAndIsReported() {
			SexprReader<String> reader = SexprReader.of(new TruncatingReader("(a) (b"));

			assertThat(reader.next().toString()).isEqualTo("(a)");
			assertThatThrownBy(reader::next).isInstanceOf(UnexpectedEofException.class);
		}

		@Test
		void failureBetweenFormsIsAvailableAfterTheLastForm() {
			SexprReader<String> reader = SexprReader.of(new TruncatingReader("(a) "));

			assertThat(reader.readAll()).hasSize(1);
			assertThat(reader.sourceFailure()).hasValueSatisfying(
					e -> assertThat(e).hasMessage("stream closed"));
		}

		@Test
		void completeSourceHasNoFailure() {
			SexprReader<String> reader = readerFor("(a)");

			assertThat(reader.readAll()).hasSize(1);
			assertThat(reader.sourceFailure()).isEmpty();
		}
	}

	@Nested
	class Spans {

		@Test
		void formSpanRunsFromOpeningToClosingBracket() {
			List<Form<String>> forms = readerFor("(a)\n  (b\n   c)").readAll();

			assertThat(forms.get(0).span()).isEqualTo(new Span(new Coord(1, 1), new Coord(1, 3)));
			assertThat(forms.get(1).span()).isEqualTo(new Span(new Coord(2, 3), new Coord(3, 5)));
		}

		@Test
		void atomSpansReachTheHandler() {
			SexprReader<SourceAtom> reader = SexprReader.of(
					new StringReader("(foo \"b r\"\n|x|)"), ReaderOptions.defaults(), AtomHandler.withSpan());

			Form<SourceAtom> form = reader.next();

			assertThat(form.atomAt(0)).isEqualTo(new SourceAtom("foo", new Span(new Coord(1, 2), new Coord(1, 4))));
			assertThat(form.atomAt(1)).isEqualTo(new SourceAtom("\"b r\"", new Span(new Coord(1, 6), new Coord(1, 10))));
			assertThat(form.atomAt(2)).isEqualTo(new SourceAtom("|x|", new Span(new Coord(2, 1), new Coord(2, 3))));
		}

		@Test
		void commentShiftsLaterSpansWithoutChangingStructure() {
			Form<String> plain = readSingle("(a b (c))");
			Form<String> commented = readSingle("(a ; remark\n b (c))");

			assertThat(structure(commented)).isEqualTo(structure(plain));
			assertThat(commented.formAt(2).span()).isEqualTo(new Span(new Coord(2, 4), new Coord(2, 6)));
		}
	}

	@Nested
	class Errors {

		@Test
		void bareAtomAtTopLevelIsUnexpectedChar() {
			assertThatThrownBy(() -> readerFor("abc").next())
					.isInstanceOfSatisfying(UnexpectedCharException.class, e -> {
						assertThat(e.expected()).isEqualTo('(');
						assertThat(e.found()).isEqualTo('a');
						assertThat(e.coord()).isEqualTo(new Coord(1, 1));
						assertThat(e.getMessage()).isEqualTo("expected '(', got 'a' at 1:1");
					});
		}

		@Test
		void strayClosingBracketIsUnexpectedChar() {
			SexprReader<String> reader = readerFor("(a))");
			reader.next();

			assertThatThrownBy(reader::next)
					.isInstanceOfSatisfying(UnexpectedCharException.class, e -> {
						assertThat(e.found()).isEqualTo(')');
						assertThat(e.coord()).isEqualTo(new Coord(1, 4));
					});
		}

		@ParameterizedTest
		@ValueSource(strings = {"|a b c", "\"abc\"cde\""})
		void delimitedAtomAtTopLevelIsUnexpectedChar(String input) {
			assertThatThrownBy(() -> readerFor(input).readAll()).isInstanceOf(UnexpectedCharException.class);
		}

		@Test
		void unclosedListIsUnexpectedEof() {
			assertThatThrownBy(() -> readerFor("(a").next())
					.isInstanceOfSatisfying(UnexpectedEofException.class, e -> {
						assertThat(e.coord()).isEqualTo(new Coord(1, 3));
						assertThat(e.detail()).isEqualTo("unexpected end of file");
					});
		}

		@Test
		void unclosedNestedListIsUnexpectedEof() {
			assertThatThrownBy(() -> readerFor("(1 (2 3) (4 5) 6 (7 (8 9))").next())
					.isInstanceOfSatisfying(UnexpectedEofException.class,
							e -> assertThat(e.coord()).isEqualTo(new Coord(1, 27)));
		}

		@Test
		void unclosedDelimitedAtomIsUnexpectedEof() {
			assertThatThrownBy(() -> readerFor("(|a b c").next()).isInstanceOf(UnexpectedEofException.class);
		}

		@Test
		void invalidEscapeNamesTheCharacter() {
			assertThatThrownBy(() -> readerFor("(\"abc\\9cde\"").next())
					.isInstanceOfSatisfying(InvalidEscapeException.class, e -> {
						assertThat(e.escapedChar()).isEqualTo('9');
						assertThat(e.coord()).isEqualTo(new Coord(1, 7));
					});
		}

		@Test
		void readerIsUnusableAfterAnError() {
			SexprReader<String> reader = readerFor("x (a)");

			assertThatThrownBy(reader::next).isInstanceOf(UnexpectedCharException.class);
			assertThatThrownBy(reader::hasNext)
					.isInstanceOf(IllegalStateException.class)
					.hasCauseInstanceOf(UnexpectedCharException.class);
		}

		@Test
		void readerFailsEvenWhenErrorIsRaisedInsideStream() {
			SexprReader<String> reader = readerFor("(a) (b");

			assertThatThrownBy(() -> reader.stream().count()).isInstanceOf(UnexpectedEofException.class);
			assertThatThrownBy(reader::nextForm).isInstanceOf(IllegalStateException.class);
		}
	}

	@Nested
	class CustomOptions {

		@Test
		void alternativeCommentCharacter() {
			ReaderOptions options = ReaderOptions.defaults().withCommentChar('#');

			List<Form<String>> forms = SexprReader.of(new StringReader("(a;b) # (c)\n(d)"), options).readAll();

			assertThat(forms).extracting(Form::toString).containsExactly("(a;b)", "(d)");
		}

		@Test
		void withoutEscapesAllCharactersAreLiteral() {
			ReaderOptions options = ReaderOptions.defaults().withDelimiter(DelimiterSpec.verbatim('"'));

			Form<String> form = SexprReader.of(new StringReader("(\"a\\b\")"), options).next();

			assertThat(form.atomAt(0)).isEqualTo("\"a\\b\"");
		}

		@Test
		void atomHandlerConvertsValues() {
			AtomHandler<Object> numbers = AtomHandler.ofText(text -> text.matches("-?\\d+") ? Long.valueOf(text) : text);

			Form<Object> form = SexprReader.of(new StringReader("(add 1 -2 x)"), ReaderOptions.defaults(), numbers).next();

			assertThat(form.elements()).extracting(e -> ((Atom<Object>) e).value())
					.containsExactly("add", 1L, -2L, "x");
		}
	}

	@Test
	void logsEachTopLevelFormAtDebug() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(SexprReader.class, Level.DEBUG)) {
			readerFor("(a) (b)").readAll();

			assertThat(appender.messages())
					.anyMatch(message -> message.contains("Read top-level form #1 spanning 1:1-1:3"))
					.anyMatch(message -> message.contains("Read top-level form #2 spanning 1:5-1:7"))
					.anyMatch(message -> message.contains("End of input at 1:8 after 2 form(s)"));
		}
	}

	@Test
	void balancedNestingMatchesDepth() {
		Form<String> form = readSingle("(1 (2 (3 (4)) 5) ((6)))");

		assertThat(FormWalker.depth(form)).isEqualTo(4);
		assertThat(FormWalker.countAtoms(form)).isEqualTo(6);
	}

	/**
	 * Counts how many characters the reader pulled from the source.
	 */
	static final class CountingReader extends Reader {

		private final StringReader delegate;
		private int charsRead;

		CountingReader(String text) {
			this.delegate = new StringReader(text);
		}

		@Override
		public int read(char[] buffer, int offset, int length) throws IOException {
			int n = delegate.read(buffer, offset, Math.min(length, 1));
			if (n > 0) {
				charsRead += n;
			}
			return n;
		}

		int charsRead() {
			return charsRead;
		}

		@Override
		public void close() {
			delegate.close();
		}
	}

	/**
	 * Serves the given text, then fails instead of reporting end of stream.
	 */
	static final class TruncatingReader extends Reader {

		private final StringReader delegate;

		TruncatingReader(String text) {
			this.delegate = new StringReader(text);
		}

		@Override
		public int read(char[] buffer, int offset, int length) throws IOException {
			int n = delegate.read(buffer, offset, length);
			if (n < 0) {
				throw new IOException("stream closed");
			}
			return n;
		}

		@Override
		public void close() {
			delegate.close();
		}
	}
}
