package com.questrail.assetexport.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * WorkerMessageCodec
 * =============================================================================
 * JSON encoding of worker requests and decoding of worker responses.
 *
 * <h2>Wire shape</h2>
 * <pre>
 *   request:  {"id": n, "method": "exportAsset", "params": {...}}
 *   success:  {"id": n, "result": ...}
 *   failure:  {"id": n, "error": {"message": "..."}}
 * </pre>
 *
 * <p>The codec is stateless and thread-safe; it shares one {@link ObjectMapper}.</p>
 */
public final class WorkerMessageCodec
{
    private static final String UNKNOWN_ERROR = "Worker reported an unspecified error";

    private final ObjectMapper mapper;

    public WorkerMessageCodec() {
        this(new ObjectMapper());
    }

    public WorkerMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * A fresh, empty params object.
     */
    public ObjectNode newParams() {
        return mapper.createObjectNode();
    }

    public String encodeRequest(long id, String method, ObjectNode params) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");

        ObjectNode request = mapper.createObjectNode();
        request.put("id", id);
        request.put("method", method);
        request.set("params", params);
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode worker request " + method, e);
        }
    }

    /**
     * Decodes one response message.
     *
     * @throws WorkerMessageDecodeException if the text is not a response object
     */
    public WorkerResponse decodeResponse(String text) {
        Objects.requireNonNull(text, "text");

        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new WorkerMessageDecodeException("Worker message is not valid JSON", e);
        }

        if (node == null || !node.isObject()) {
            throw new WorkerMessageDecodeException("Worker message is not a JSON object");
        }

        JsonNode id = node.get("id");
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) {
            throw new WorkerMessageDecodeException("Worker message has no numeric id");
        }

        JsonNode error = node.get("error");
        if (error != null && !error.isNull()) {
            return new WorkerResponse(id.longValue(), NullNode.getInstance(), Optional.of(errorMessage(error)));
        }

        JsonNode result = node.get("result");
        return new WorkerResponse(id.longValue(),
                result == null ? NullNode.getInstance() : result,
                Optional.empty());
    }

    private static String errorMessage(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        String message = error.path("message").asText("");
        return message.isEmpty() ? UNKNOWN_ERROR : message;
    }
}
