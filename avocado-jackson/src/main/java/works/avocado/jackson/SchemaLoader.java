package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avocado.exceptions.MalformedSchemaException;
import works.avocado.schema.PreferredName;
import works.avocado.schema.PropertyDef;
import works.avocado.schema.PropertyKind;
import works.avocado.schema.Schema;
import works.avocado.schema.TypeDef;
import works.avocado.schema.ValueType;
import works.avocado.schema.ValueTypeParser;

/**
 * Reads a {@link Schema} from a YAML document, or equally, from JSON.
 *
 * <pre>
 * Note:
 *   uri: https://www.w3.org/ns/activitystreams#Note
 *   doc: A short written work.
 *   extends: [Object]
 *   except_properties: [duration]
 *   preferred_property_name:
 *     summary: { LangContainer: { default: summary, container: summaryMap } }
 *   properties:
 *     content:
 *       LangContainer:
 *         type: String
 *         container_tag: contentMap
 *         kind: Normal
 * </pre>
 *
 * Types and properties keep the order in which they appear.
 */
public final class SchemaLoader {
	private final ObjectMapper mapper;

	public SchemaLoader() {
		this(new YAMLMapper());
	}

	public SchemaLoader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public Schema load(String text) throws MalformedSchemaException {
		try {
			return fromTree(mapper.readTree(text));
		} catch (JsonProcessingException e) {
			throw new MalformedSchemaException("Unable to parse schema document: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * @throws IOException if {@code in} cannot be read
	 */
	public Schema load(InputStream in) throws IOException, MalformedSchemaException {
		JsonNode root;
		try {
			root = mapper.readTree(in);
		} catch (JsonProcessingException e) {
			throw new MalformedSchemaException("Unable to parse schema document: " + e.getOriginalMessage(), e);
		}
		return fromTree(root);
	}

	public Schema fromTree(JsonNode root) throws MalformedSchemaException {
		expectObject(root, "schema document");
		Schema.SchemaBuilder result = Schema.builder();
		for (Iterator<Map.Entry<String, JsonNode>> iter = root.fields(); iter.hasNext(); ) {
			Map.Entry<String, JsonNode> entry = iter.next();
			result.type(entry.getKey(), typeDef(entry.getKey(), entry.getValue()));
		}
		Schema schema = result.build();
		LOGGER.debug("Loaded schema with {} types", schema.types().size());
		return schema;
	}

	private TypeDef typeDef(String typeName, JsonNode node) throws MalformedSchemaException {
		expectObject(node, typeName);
		TypeDef.TypeDefBuilder result = TypeDef.builder()
			.uri(optionalText(node, "uri", typeName))
			.doc(optionalText(node, "doc", typeName));
		forEachText(node.get("extends"), typeName + ".extends", result::supertype);
		forEachText(node.get("except_properties"), typeName + ".except_properties", result::exceptProperty);

		JsonNode properties = node.get("properties");
		if (properties != null) {
			expectObject(properties, typeName + ".properties");
			for (Iterator<Map.Entry<String, JsonNode>> iter = properties.fields(); iter.hasNext(); ) {
				Map.Entry<String, JsonNode> entry = iter.next();
				result.property(entry.getKey(), propertyDef(typeName + "." + entry.getKey(), entry.getValue()));
			}
		}

		JsonNode preferred = node.get("preferred_property_name");
		if (preferred != null) {
			expectObject(preferred, typeName + ".preferred_property_name");
			for (Iterator<Map.Entry<String, JsonNode>> iter = preferred.fields(); iter.hasNext(); ) {
				Map.Entry<String, JsonNode> entry = iter.next();
				result.preferredName(entry.getKey(), preferredName(typeName + ".preferred_property_name." + entry.getKey(), entry.getValue()));
			}
		}
		return result.build();
	}

	private PropertyDef propertyDef(String context, JsonNode node) throws MalformedSchemaException {
		Map.Entry<String, JsonNode> choice = singleKey(node, context, "Simple or LangContainer");
		JsonNode body = choice.getValue();
		String bodyContext = context + "." + choice.getKey();
		expectObject(body, bodyContext);
		ValueType valueType = valueType(bodyContext, requiredText(body, "type", bodyContext));
		PropertyKind kind = kind(bodyContext, body.get("kind"));
		switch (choice.getKey()) {
			case "Simple": {
				PropertyDef.Simple.SimpleBuilder result = PropertyDef.Simple.builder()
					.tag(optionalText(body, "tag", bodyContext))
					.valueType(valueType)
					.kind(kind)
					.uri(optionalText(body, "uri", bodyContext))
					.doc(optionalText(body, "doc", bodyContext));
				forEachText(body.get("aka"), bodyContext + ".aka", result::alias);
				return result.build();
			}
			case "LangContainer": {
				PropertyDef.LangContainer.LangContainerBuilder result = PropertyDef.LangContainer.builder()
					.tag(optionalText(body, "tag", bodyContext))
					.valueType(valueType)
					.containerTag(requiredText(body, "container_tag", bodyContext))
					.kind(kind)
					.uri(optionalText(body, "uri", bodyContext))
					.doc(optionalText(body, "doc", bodyContext));
				forEachText(body.get("aka"), bodyContext + ".aka", result::alias);
				forEachText(body.get("container_aka"), bodyContext + ".container_aka", result::containerAlias);
				return result.build();
			}
			default:
				throw new MalformedSchemaException(context + ": expected Simple or LangContainer; found " + choice.getKey());
		}
	}

	private PreferredName preferredName(String context, JsonNode node) throws MalformedSchemaException {
		if (node.isTextual()) {
			return new PreferredName.Simple(node.textValue());
		}
		Map.Entry<String, JsonNode> choice = singleKey(node, context, "Simple or LangContainer");
		String bodyContext = context + "." + choice.getKey();
		switch (choice.getKey()) {
			case "Simple":
				if (!choice.getValue().isTextual()) {
					throw new MalformedSchemaException(bodyContext + ": expected a string");
				}
				return new PreferredName.Simple(choice.getValue().textValue());
			case "LangContainer":
				expectObject(choice.getValue(), bodyContext);
				return new PreferredName.LangContainer(
					requiredText(choice.getValue(), "default", bodyContext),
					requiredText(choice.getValue(), "container", bodyContext));
			default:
				throw new MalformedSchemaException(context + ": expected Simple or LangContainer; found " + choice.getKey());
		}
	}

	private static ValueType valueType(String context, String text) throws MalformedSchemaException {
		try {
			return ValueTypeParser.parse(text);
		} catch (IllegalArgumentException e) {
			throw new MalformedSchemaException(context + ".type: " + e.getMessage(), e);
		}
	}

	private static PropertyKind kind(String context, JsonNode node) throws MalformedSchemaException {
		if (node == null || node.isNull()) {
			return PropertyKind.NORMAL;
		}
		try {
			return PropertyKind.fromSchemaName(node.asText());
		} catch (IllegalArgumentException e) {
			throw new MalformedSchemaException(context + ".kind: " + e.getMessage(), e);
		}
	}

	private static Map.Entry<String, JsonNode> singleKey(JsonNode node, String context, String expected) throws MalformedSchemaException {
		if (!node.isObject() || node.size() != 1) {
			throw new MalformedSchemaException(context + ": expected a mapping with a single key, " + expected);
		}
		return node.fields().next();
	}

	private static void expectObject(JsonNode node, String context) throws MalformedSchemaException {
		if (node == null || !node.isObject()) {
			throw new MalformedSchemaException(context + ": expected a mapping");
		}
	}

	private static String requiredText(JsonNode node, String field, String context) throws MalformedSchemaException {
		JsonNode value = node.get(field);
		if (value == null || !value.isValueNode() || value.isNull()) {
			throw new MalformedSchemaException(context + ": missing " + field);
		}
		return value.asText();
	}

	private static String optionalText(JsonNode node, String field, String context) throws MalformedSchemaException {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		} else if (!value.isValueNode()) {
			throw new MalformedSchemaException(context + "." + field + ": expected a string");
		}
		return value.asText();
	}

	private static void forEachText(JsonNode node, String context, Consumer<String> action) throws MalformedSchemaException {
		if (node == null || node.isNull()) {
			return;
		}
		if (!node.isArray()) {
			throw new MalformedSchemaException(context + ": expected a list");
		}
		for (JsonNode element: node) {
			if (!element.isValueNode() || element.isNull()) {
				throw new MalformedSchemaException(context + ": expected a list of strings");
			}
			action.accept(element.asText());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaLoader.class);
}
