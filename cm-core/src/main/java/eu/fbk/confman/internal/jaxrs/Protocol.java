package eu.fbk.confman.internal.jaxrs;

import java.io.IOException;
import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.Message;
import eu.fbk.confman.bus.MethodCall;
import eu.fbk.confman.bus.ObjectPath;
import eu.fbk.confman.bus.Signal;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;
import eu.fbk.confman.data.Json;

/**
 * JSON encoding of the bus messages exchanged over HTTP.
 * <p>
 * A call is POSTed to {@value #PATH_CALL} as
 * {@code {"destination":..., "path":..., "interface":..., "member":..., "args":[...]}} and
 * answered either with status 200 and {@code {"result": arg}} ({@code null} for no result) or
 * with an error status and {@code {"error": name, "message": text}}. Signals are streamed by
 * {@value #PATH_SIGNALS} as server-sent events named after the signal member, whose data is
 * {@code {"path":..., "interface":..., "member":..., "args":[...]}}; the first event of each
 * stream is {@value #EVENT_SUBSCRIBED}. Arguments are tagged objects: {@code {"s": string}},
 * {@code {"v": scalar}} for a {@code ConfigValue} and {@code {"a{sv}": object}} for a
 * {@code ConfigMap}.
 * </p>
 */
public final class Protocol {

    public static final String PATH_CALL = "call";

    public static final String PATH_SIGNALS = "signals";

    public static final String PARAM_PATH = "path";

    public static final String PARAM_INTERFACE = "interface";

    public static final String PARAM_MEMBER = "member";

    public static final String EVENT_SUBSCRIBED = "Subscribed";

    private static final String TAG_STRING = "s";

    private static final String TAG_VALUE = "v";

    private static final String TAG_MAP = "a{sv}";

    private Protocol() {
    }

    public static String encodeCall(final MethodCall call) {
        final ObjectNode node = encodeMessage(call);
        if (call.getDestination() != null) {
            node.put("destination", call.getDestination());
        }
        return node.toString();
    }

    public static MethodCall decodeCall(final String json) throws BusException {
        final JsonNode node = parse(json);
        final JsonNode destination = node.get("destination");
        return new MethodCall(destination == null || destination.isNull() ? null
                : destination.asText(), decodePath(node), text(node, "interface"), text(node,
                "member"), decodeArgs(node));
    }

    public static String encodeSignal(final Signal signal) {
        return encodeMessage(signal).toString();
    }

    public static Signal decodeSignal(final String json) throws BusException {
        final JsonNode node = parse(json);
        return new Signal(decodePath(node), text(node, "interface"), text(node, "member"),
                decodeArgs(node));
    }

    public static String encodeReply(@Nullable final Object result) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.set("result", result == null ? JsonNodeFactory.instance.nullNode()
                : encodeArg(result));
        return node.toString();
    }

    @Nullable
    public static Object decodeReply(final String json) throws BusException {
        final JsonNode result = parse(json).get("result");
        return result == null || result.isNull() ? null : decodeArg(result);
    }

    public static String encodeError(final BusException exception) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", exception.getErrorName());
        node.put("message", exception.getMessage());
        return node.toString();
    }

    /**
     * Decodes an error reply. A body that is not an error object yields a
     * {@link BusException#FAILED} exception quoting the HTTP status.
     *
     * @param status
     *            the HTTP status of the reply
     * @param json
     *            the body of the reply
     * @return the decoded exception
     */
    public static BusException decodeError(final int status, final String json) {
        try {
            final JsonNode node = parse(json);
            final JsonNode message = node.get("message");
            return new BusException(text(node, "error"), message == null || message.isNull()
                    ? null : message.asText());
        } catch (final BusException ex) {
            return new BusException(BusException.FAILED, "HTTP status " + status);
        }
    }

    /**
     * Returns the HTTP status used to report an error with the name specified.
     *
     * @param errorName
     *            the error name
     * @return the HTTP status
     */
    public static int statusFor(final String errorName) {
        final ConfigurationException.Kind kind = ConfigurationException.Kind
                .forErrorName(errorName);
        if (errorName.equals(BusException.INVALID_ARGS)
                || kind == ConfigurationException.Kind.INVALID_ARGUMENT
                || kind == ConfigurationException.Kind.TYPE_ERROR) {
            return 400;
        } else if (errorName.equals(BusException.UNKNOWN_OBJECT)
                || errorName.equals(BusException.UNKNOWN_INTERFACE)
                || errorName.equals(BusException.UNKNOWN_METHOD)
                || errorName.equals(BusException.SERVICE_UNKNOWN)) {
            return 404;
        } else if (errorName.equals(BusException.NO_REPLY)) {
            return 504;
        }
        return 500;
    }

    public static JsonNode encodeArg(final Object arg) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (arg instanceof String) {
            node.put(TAG_STRING, (String) arg);
        } else if (arg instanceof ConfigValue) {
            node.set(TAG_VALUE, Json.toNode((ConfigValue) arg));
        } else if (arg instanceof ConfigMap) {
            node.set(TAG_MAP, Json.toNode((ConfigMap) arg));
        } else {
            throw new IllegalArgumentException("Unsupported argument " + arg);
        }
        return node;
    }

    public static Object decodeArg(final JsonNode node) throws BusException {
        try {
            if (node.isObject() && node.size() == 1) {
                final JsonNode string = node.get(TAG_STRING);
                if (string != null && string.isTextual()) {
                    return string.textValue();
                }
                final JsonNode value = node.get(TAG_VALUE);
                if (value != null) {
                    return Json.toValue(value);
                }
                final JsonNode map = node.get(TAG_MAP);
                if (map != null) {
                    return Json.toMap(map);
                }
            }
        } catch (final ConfigurationException ex) {
            throw new BusException(ex.getKind().getErrorName(), ex.getMessage(), ex);
        }
        throw new BusException(BusException.INVALID_ARGS, "Invalid argument " + node);
    }

    private static ObjectNode encodeMessage(final Message message) {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("path", message.getPath().toString());
        node.put("interface", message.getInterfaceName());
        node.put("member", message.getMember());
        final ArrayNode args = node.putArray("args");
        for (final Object arg : message.getArgs()) {
            args.add(encodeArg(arg));
        }
        return node;
    }

    private static JsonNode parse(final String json) throws BusException {
        try {
            final JsonNode node = Json.getMapper().readTree(json);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (final IOException ex) {
            throw new BusException(BusException.INVALID_ARGS, "Malformed message: "
                    + ex.getMessage(), ex);
        }
        throw new BusException(BusException.INVALID_ARGS, "Malformed message: " + json);
    }

    private static String text(final JsonNode node, final String field) throws BusException {
        final JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.textValue().isEmpty()) {
            throw new BusException(BusException.INVALID_ARGS, "Missing " + field + " in " + node);
        }
        return value.textValue();
    }

    private static ObjectPath decodePath(final JsonNode node) throws BusException {
        try {
            return ObjectPath.valueOf(text(node, "path"));
        } catch (final IllegalArgumentException ex) {
            throw new BusException(BusException.INVALID_ARGS, ex.getMessage(), ex);
        }
    }

    private static Object[] decodeArgs(final JsonNode node) throws BusException {
        final JsonNode args = node.get("args");
        if (args == null || args.isNull()) {
            return new Object[0];
        }
        if (!args.isArray()) {
            throw new BusException(BusException.INVALID_ARGS, "Invalid args in " + node);
        }
        final List<Object> result = Lists.newArrayList();
        for (final JsonNode arg : args) {
            result.add(decodeArg(arg));
        }
        return result.toArray();
    }

}
