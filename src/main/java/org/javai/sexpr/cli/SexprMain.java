package org.javai.sexpr.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.javai.sexpr.AtomHandler;
import org.javai.sexpr.Form;
import org.javai.sexpr.FormPrinter;
import org.javai.sexpr.ReaderOptions;
import org.javai.sexpr.SexprReader;
import org.javai.sexpr.SexprSyntaxException;
import org.javai.sexpr.SourceAtom;
import org.javai.sexpr.config.ReaderOptionsParseException;
import org.javai.sexpr.config.ReaderOptionsParser;
import org.javai.sexpr.json.FormJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end: reads every form of the given files and prints them.
 * <p>
 * Usage: {@code sexpr [--json] [--spans] [--pretty] [--options FILE] FILE...}
 * <p>
 * Exit codes: 0 on success, 1 if a file cannot be read completely or contains a syntax error, 2 on invalid
 * arguments. Forms read before a failure are still printed.
 */
public class SexprMain {

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	private static final Logger logger = LoggerFactory.getLogger(SexprMain.class);

	private static final String USAGE = "Usage: sexpr [--json] [--spans] [--pretty] [--options FILE] FILE...";

	private final PrintStream out;
	private final PrintStream err;

	public SexprMain(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		int status = new SexprMain(System.out, System.err).run(args);
		System.exit(status);
	}

	/**
	 * Runs the command and returns its exit code.
	 */
	public int run(String[] args) {
		Arguments arguments;
		try {
			arguments = Arguments.parse(args);
		}
		catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		}
		if (arguments.help) {
			out.println(USAGE);
			return EXIT_OK;
		}

		ReaderOptions options;
		try {
			options = arguments.optionsFile != null
				? new ReaderOptionsParser().parse(arguments.optionsFile)
				: ReaderOptions.defaults();
		}
		catch (ReaderOptionsParseException e) {
			err.println(arguments.optionsFile + ": " + e.getMessage());
			return EXIT_FAILURE;
		}

		for (Path file : arguments.files) {
			if (!printFile(file, options, arguments)) {
				return EXIT_FAILURE;
			}
		}
		return EXIT_OK;
	}

	private boolean printFile(Path file, ReaderOptions options, Arguments arguments) {
		try (Reader source = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			SexprReader<SourceAtom> reader = SexprReader.of(source, options, AtomHandler.withSpan());
			FormJsonMapper jsonMapper = arguments.spans ? FormJsonMapper.withSpans() : FormJsonMapper.plain();
			while (reader.hasNext()) {
				out.println(render(reader.next(), jsonMapper, arguments));
			}
			IOException sourceFailure = reader.sourceFailure().orElse(null);
			if (sourceFailure != null) {
				throw sourceFailure;
			}
			logger.debug("Printed {} form(s) from {}", reader.formsRead(), file);
			return true;
		}
		catch (SexprSyntaxException e) {
			err.println(file + ":" + e.coord() + ": " + e.detail());
			return false;
		}
		catch (IOException e) {
			logger.error("Failed to read {}", file, e);
			err.println(file + ": " + e.getMessage());
			return false;
		}
	}

	private static String render(Form<SourceAtom> form, FormJsonMapper jsonMapper, Arguments arguments) {
		if (arguments.json) {
			return arguments.pretty
				? jsonMapper.writeValueAsPrettyString(form)
				: jsonMapper.writeValueAsString(form);
		}
		return arguments.pretty ? FormPrinter.print(form) : FormPrinter.printCompact(form);
	}

	static final class Arguments {
		boolean json;
		boolean spans;
		boolean pretty;
		boolean help;
		Path optionsFile;
		final List<Path> files = new ArrayList<>();

		static Arguments parse(String[] args) {
			Arguments arguments = new Arguments();
			for (int i = 0; i < args.length; i++) {
				String arg = args[i];
				switch (arg) {
					case "--json" -> arguments.json = true;
					case "--spans" -> arguments.spans = true;
					case "--pretty" -> arguments.pretty = true;
					case "-h", "--help" -> arguments.help = true;
					case "--options" -> {
						if (i + 1 >= args.length) {
							throw new IllegalArgumentException("Missing file after --options");
						}
						arguments.optionsFile = Path.of(args[++i]);
					}
					default -> {
						if (arg.startsWith("--")) {
							throw new IllegalArgumentException("Unknown option: " + arg);
						}
						arguments.files.add(Path.of(arg));
					}
				}
			}
			if (arguments.spans && !arguments.json) {
				throw new IllegalArgumentException("--spans requires --json");
			}
			if (arguments.files.isEmpty() && !arguments.help) {
				throw new IllegalArgumentException("No input file given");
			}
			return arguments;
		}
	}
}
