package org.javai.sexpr.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.sexpr.DelimiterSpec;
import org.javai.sexpr.ReaderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link ReaderOptions} from YAML.
 * <p>
 * Expected layout:
 *
 * <pre>
 * comment: ";"
 * delimiters:
 *   - delimiter: '"'
 *     escape: '\'
 *     escapes:
 *       n: "\n"
 *       '"': '"'
 *   - delimiter: "|"
 * </pre>
 *
 * A missing {@code comment} falls back to {@code ;}, a missing {@code delimiters} section to the default
 * delimiters. An empty {@code delimiters} list configures no delimiters at all.
 */
public class ReaderOptionsParser {

	/**
	 * Classpath location of the YAML document describing {@link ReaderOptions#defaults()}.
	 */
	public static final String DEFAULT_OPTIONS_RESOURCE = "META-INF/sexpr-reader-defaults.yml";

	private static final Logger logger = LoggerFactory.getLogger(ReaderOptionsParser.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Parse reader options from a YAML file.
	 */
	public ReaderOptions parse(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return parse(reader);
		}
		catch (ReaderOptionsParseException e) {
			throw new ReaderOptionsParseException("Invalid reader options in " + path + ": " + e.getMessage(), e);
		}
		catch (Exception e) {
			throw new ReaderOptionsParseException("Failed to read reader options from path: " + path, e);
		}
	}

	/**
	 * Parse reader options from a YAML input stream.
	 */
	public ReaderOptions parse(InputStream inputStream) {
		return build(load(() -> yaml.load(inputStream)));
	}

	/**
	 * Parse reader options from a YAML reader.
	 */
	public ReaderOptions parse(Reader reader) {
		return build(load(() -> yaml.load(reader)));
	}

	/**
	 * Parse reader options from a YAML string.
	 */
	public ReaderOptions parseString(String yamlContent) {
		return build(load(() -> yaml.load(yamlContent)));
	}

	/**
	 * Parse reader options from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 */
	public ReaderOptions parseResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			ReaderOptions options = parse(is);
			logger.debug("Loaded reader options from resource {}", resourcePath);
			return options;
		}
		catch (IllegalArgumentException | ReaderOptionsParseException e) {
			throw e;
		}
		catch (Exception e) {
			throw new ReaderOptionsParseException("Failed to load reader options from resource: " + resourcePath, e);
		}
	}

	private Object load(YamlLoad loading) {
		try {
			return loading.load();
		}
		catch (Exception e) {
			throw new ReaderOptionsParseException("Malformed reader options YAML", e);
		}
	}

	@SuppressWarnings("unchecked")
	private ReaderOptions build(Object document) {
		if (document == null) {
			return ReaderOptions.defaults();
		}
		if (!(document instanceof Map)) {
			throw new ReaderOptionsParseException("Reader options must be a mapping, got: " + typeName(document));
		}
		Map<String, Object> data = (Map<String, Object>) document;

		char commentChar = data.containsKey("comment")
			? singleChar(data.get("comment"), "comment")
			: ReaderOptions.DEFAULT_COMMENT_CHAR;

		Map<Character, DelimiterSpec> delimiters;
		if (data.containsKey("delimiters")) {
			delimiters = buildDelimiters(data.get("delimiters"));
		}
		else {
			delimiters = ReaderOptions.defaults().delimiters();
		}

		try {
			ReaderOptions options = new ReaderOptions(delimiters, commentChar);
			logger.debug("Built reader options: comment '{}', delimiters {}", commentChar, delimiters.keySet());
			return options;
		}
		catch (IllegalArgumentException e) {
			throw new ReaderOptionsParseException(e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private Map<Character, DelimiterSpec> buildDelimiters(Object section) {
		Map<Character, DelimiterSpec> delimiters = new LinkedHashMap<>();
		if (section == null) {
			return delimiters;
		}
		if (!(section instanceof List)) {
			throw new ReaderOptionsParseException("'delimiters' must be a list, got: " + typeName(section));
		}
		for (Object entry : (List<Object>) section) {
			if (!(entry instanceof Map)) {
				throw new ReaderOptionsParseException("Delimiter entry must be a mapping, got: " + typeName(entry));
			}
			DelimiterSpec spec = buildDelimiter((Map<String, Object>) entry);
			if (delimiters.put(spec.delimiter(), spec) != null) {
				throw new ReaderOptionsParseException("Delimiter '" + spec.delimiter() + "' is defined twice");
			}
		}
		return delimiters;
	}

	@SuppressWarnings("unchecked")
	private DelimiterSpec buildDelimiter(Map<String, Object> entry) {
		if (!entry.containsKey("delimiter")) {
			throw new ReaderOptionsParseException("Delimiter entry is missing required 'delimiter'");
		}
		char delimiter = singleChar(entry.get("delimiter"), "delimiter");
		Object escape = entry.get("escape");
		Object escapesSection = entry.get("escapes");
		if (escape == null) {
			if (escapesSection != null) {
				throw new ReaderOptionsParseException(
					"Delimiter '" + delimiter + "' defines 'escapes' but no 'escape' character");
			}
			return DelimiterSpec.verbatim(delimiter);
		}
		char escapeChar = singleChar(escape, "escape");
		Map<Character, String> escapes = new LinkedHashMap<>();
		if (escapesSection != null) {
			if (!(escapesSection instanceof Map)) {
				throw new ReaderOptionsParseException(
					"'escapes' of delimiter '" + delimiter + "' must be a mapping, got: " + typeName(escapesSection));
			}
			for (Map.Entry<Object, Object> mapping : ((Map<Object, Object>) escapesSection).entrySet()) {
				char trigger = singleChar(mapping.getKey(), "escape trigger");
				escapes.put(trigger, mapping.getValue() == null ? "" : String.valueOf(mapping.getValue()));
			}
		}
		return DelimiterSpec.escaped(delimiter, escapeChar, escapes);
	}

	private static char singleChar(Object value, String field) {
		String text = value == null ? null : String.valueOf(value);
		if (text == null || text.length() != 1) {
			throw new ReaderOptionsParseException("'" + field + "' must be a single character, got: " + text);
		}
		return text.charAt(0);
	}

	private static String typeName(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName();
	}

	@FunctionalInterface
	private interface YamlLoad {
		Object load();
	}
}
