package eu.fbk.confman.data;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;

/**
 * Conversion of configuration data to and from JSON.
 * <p>
 * A configuration document is a JSON object whose members are strings, numbers or booleans.
 * Integral numbers map to 64-bit integers and numbers with a fraction or exponent map to doubles;
 * arrays, objects, {@code null}, integers outside the 64-bit range and numbers that overflow a
 * double are rejected. Documents are
 * written with a four-space indentation.
 * </p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final ObjectWriter WRITER = MAPPER.writer(new IndentingPrinter());

    private Json() {
    }

    /**
     * Returns the Jackson mapper shared by the JSON codecs of the configuration manager.
     *
     * @return the mapper, which must not be reconfigured
     */
    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    /**
     * Parses a configuration document.
     *
     * @param text
     *            the JSON text
     * @return the parsed configuration
     * @throws ConfigurationException
     *             with kind {@code PARSE_ERROR} if the text is not a JSON object, or with kind
     *             {@code TYPE_ERROR} if some member has an unsupported value
     */
    public static ConfigMap parse(final String text) throws ConfigurationException {
        final JsonNode node;
        try {
            node = MAPPER.readTree(text);
        } catch (final JsonProcessingException ex) {
            throw new ConfigurationException(Kind.PARSE_ERROR, ex.getOriginalMessage(), ex);
        }
        if (node == null || node.isMissingNode() || !node.isObject()) {
            throw new ConfigurationException(Kind.PARSE_ERROR, "Expected a JSON object");
        }
        return toMap(node);
    }

    /**
     * Formats a configuration as an indented JSON document, with keys in sorted order.
     *
     * @param map
     *            the configuration
     * @return the JSON text, without trailing newline
     */
    public static String format(final ConfigMap map) {
        try {
            return WRITER.writeValueAsString(toNode(map));
        } catch (final JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize " + map, ex);
        }
    }

    public static JsonNode toNode(final ConfigValue value) {
        final JsonNodeFactory factory = JsonNodeFactory.instance;
        switch (value.getType()) {
        case STRING:
            return factory.textNode(value.asString());
        case INT64:
            return factory.numberNode(value.asLong());
        case DOUBLE:
            return factory.numberNode(value.asDouble());
        case BOOLEAN:
            return factory.booleanNode(value.asBoolean());
        default:
            throw new Error("Unexpected type " + value.getType());
        }
    }

    public static ObjectNode toNode(final ConfigMap map) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (final Map.Entry<String, ConfigValue> entry : map.asMap().entrySet()) {
            node.set(entry.getKey(), toNode(entry.getValue()));
        }
        return node;
    }

    /**
     * Converts a JSON scalar to a configuration value.
     *
     * @param node
     *            the JSON node
     * @return the corresponding value
     * @throws ConfigurationException
     *             with kind {@code TYPE_ERROR} if the node is not a supported scalar
     */
    public static ConfigValue toValue(final JsonNode node) throws ConfigurationException {
        if (node.isTextual()) {
            return ConfigValue.of(node.textValue());
        } else if (node.isBoolean()) {
            return ConfigValue.of(node.booleanValue());
        } else if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new ConfigurationException(Kind.TYPE_ERROR, "Integer " + node
                        + " exceeds the 64-bit range");
            }
            return ConfigValue.of(node.longValue());
        } else if (node.isFloatingPointNumber()) {
            if (!Double.isFinite(node.doubleValue())) {
                throw new ConfigurationException(Kind.TYPE_ERROR, "Number " + node
                        + " exceeds the double range");
            }
            return ConfigValue.of(node.doubleValue());
        }
        throw new ConfigurationException(Kind.TYPE_ERROR, "Unsupported "
                + node.getNodeType().name().toLowerCase() + " value " + node);
    }

    /**
     * Converts a JSON object to a configuration map.
     *
     * @param node
     *            the JSON object
     * @return the corresponding configuration
     * @throws ConfigurationException
     *             with kind {@code PARSE_ERROR} if the node is not an object or has an empty key,
     *             or with kind {@code TYPE_ERROR} if some member has an unsupported value
     */
    public static ConfigMap toMap(final JsonNode node) throws ConfigurationException {
        if (!node.isObject()) {
            throw new ConfigurationException(Kind.PARSE_ERROR, "Expected a JSON object, got "
                    + node.getNodeType().name().toLowerCase());
        }
        final ConfigMap.Builder builder = ConfigMap.builder();
        for (final Iterator<Map.Entry<String, JsonNode>> i = node.fields(); i.hasNext();) {
            final Map.Entry<String, JsonNode> field = i.next();
            if (field.getKey().isEmpty()) {
                throw new ConfigurationException(Kind.PARSE_ERROR, "Empty key");
            }
            try {
                builder.put(field.getKey(), toValue(field.getValue()));
            } catch (final ConfigurationException ex) {
                throw new ConfigurationException(ex.getKind(), "Key '" + field.getKey() + "': "
                        + ex.getMessage());
            }
        }
        return builder.build();
    }

    private static final class IndentingPrinter extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 1L;

        IndentingPrinter() {
            final DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new IndentingPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(final JsonGenerator generator)
                throws IOException {
            generator.writeRaw(": ");
        }

    }

}
