package org.javai.sexpr.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.javai.sexpr.Atom;
import org.javai.sexpr.Coord;
import org.javai.sexpr.Element;
import org.javai.sexpr.Form;
import org.javai.sexpr.SourceAtom;
import org.javai.sexpr.Span;

/**
 * Converts parsed forms into JSON trees for diagnostics and tooling.
 * <p>
 * Without spans, a form becomes a nested array and an atom becomes its value ({@link SourceAtom}s contribute
 * their text; other values go through Jackson's default conversion). With spans, every form becomes an object
 * {@code {"span": ..., "elements": [...]}} and every {@link SourceAtom} an object {@code {"text": ..., "span": ...}}.
 * <p>
 * Forms are converted and written with an explicit stack, and the string writers stream straight to a generator
 * without a nesting limit, so forms of any depth the reader accepts can be rendered.
 */
public final class FormJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper(JsonFactory.builder()
		.streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
		.build());

	private final boolean includeSpans;

	private FormJsonMapper(boolean includeSpans) {
		this.includeSpans = includeSpans;
	}

	/**
	 * Forms as plain nested arrays.
	 */
	public static FormJsonMapper plain() {
		return new FormJsonMapper(false);
	}

	/**
	 * Forms and span-carrying atoms as objects with their source spans.
	 */
	public static FormJsonMapper withSpans() {
		return new FormJsonMapper(true);
	}

	public JsonNode toJson(Element<?> element) {
		if (!(element instanceof Form<?> root)) {
			return atomToJson(((Atom<?>) element).value());
		}
		ArrayNode rootElements = mapper.createArrayNode();
		JsonNode result = formNode(root, rootElements);
		Deque<Level> open = new ArrayDeque<>();
		open.push(new Level(root.elements().iterator(), rootElements));
		while (!open.isEmpty()) {
			Level level = open.peek();
			if (!level.children().hasNext()) {
				open.pop();
				continue;
			}
			Element<?> child = level.children().next();
			if (child instanceof Form<?> form) {
				ArrayNode elements = mapper.createArrayNode();
				level.target().add(formNode(form, elements));
				open.push(new Level(form.elements().iterator(), elements));
			}
			else {
				level.target().add(atomToJson(((Atom<?>) child).value()));
			}
		}
		return result;
	}

	public ArrayNode toJsonArray(List<? extends Form<?>> forms) {
		ArrayNode array = mapper.createArrayNode();
		for (Form<?> form : forms) {
			array.add(toJson(form));
		}
		return array;
	}

	/**
	 * Serializes a single element to a compact JSON string.
	 */
	public String writeValueAsString(Element<?> element) {
		return write(element, false);
	}

	/**
	 * Serializes a single element to indented JSON.
	 */
	public String writeValueAsPrettyString(Element<?> element) {
		return write(element, true);
	}

	private String write(Element<?> element, boolean pretty) {
		StringWriter writer = new StringWriter();
		try (JsonGenerator generator = mapper.getFactory().createGenerator(writer)) {
			if (pretty) {
				generator.useDefaultPrettyPrinter();
			}
			write(element, generator);
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to serialize form to JSON", e);
		}
		return writer.toString();
	}

	private void write(Element<?> root, JsonGenerator generator) throws IOException {
		Deque<Iterator<? extends Element<?>>> open = new ArrayDeque<>();
		writeElement(root, generator, open);
		while (!open.isEmpty()) {
			Iterator<? extends Element<?>> children = open.peek();
			if (children.hasNext()) {
				writeElement(children.next(), generator, open);
				continue;
			}
			open.pop();
			generator.writeEndArray();
			if (includeSpans) {
				generator.writeEndObject();
			}
		}
	}

	private void writeElement(Element<?> element, JsonGenerator generator, Deque<Iterator<? extends Element<?>>> open)
			throws IOException {
		if (!(element instanceof Form<?> form)) {
			mapper.writeTree(generator, atomToJson(((Atom<?>) element).value()));
			return;
		}
		if (includeSpans) {
			generator.writeStartObject();
			generator.writeFieldName("span");
			mapper.writeTree(generator, spanToJson(form.span()));
			generator.writeFieldName("elements");
		}
		generator.writeStartArray();
		open.push(form.elements().iterator());
	}

	private JsonNode formNode(Form<?> form, ArrayNode elements) {
		if (!includeSpans) {
			return elements;
		}
		ObjectNode node = mapper.createObjectNode();
		node.set("span", spanToJson(form.span()));
		node.set("elements", elements);
		return node;
	}

	private JsonNode atomToJson(Object value) {
		if (value == null) {
			return NullNode.getInstance();
		}
		if (value instanceof SourceAtom atom) {
			if (!includeSpans) {
				return mapper.getNodeFactory().textNode(atom.text());
			}
			ObjectNode node = mapper.createObjectNode();
			node.put("text", atom.text());
			node.set("span", spanToJson(atom.span()));
			return node;
		}
		return mapper.valueToTree(value);
	}

	private static ObjectNode spanToJson(Span span) {
		ObjectNode node = mapper.createObjectNode();
		node.set("start", coordToJson(span.start()));
		node.set("end", coordToJson(span.end()));
		return node;
	}

	private static ArrayNode coordToJson(Coord coord) {
		ArrayNode node = mapper.createArrayNode();
		node.add(coord.row());
		node.add(coord.column());
		return node;
	}

	private record Level(Iterator<? extends Element<?>> children, ArrayNode target) {
	}
}
