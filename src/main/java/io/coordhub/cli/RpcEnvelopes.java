package io.coordhub.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.coordhub.dispatch.MethodDispatcher;
import io.coordhub.error.CoordinationException;
import io.coordhub.error.ErrorKind;
import io.coordhub.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request/response framing shared by the HTTP and stdio transports. A request is
 * {@code {"id": ..., "method": "...", "params": {...}}}; a reply carries either {@code result} or
 * {@code error: {kind, message}}, echoing {@code id} when the request had one.
 */
final class RpcEnvelopes {
    static final String INTERNAL = "INTERNAL";

    private RpcEnvelopes() {
    }

    static RpcReply handle(MethodDispatcher dispatcher, String raw) {
        JsonNode request;
        try {
            request = raw == null || raw.isBlank() ? null : Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            return error(null, ErrorKind.VALIDATION.name(), "Malformed request: " + e.getOriginalMessage(), 400);
        }
        if (request == null || !request.isObject()) {
            return error(null, ErrorKind.VALIDATION.name(), "Request must be a JSON object", 400);
        }
        JsonNode id = request.get("id");
        String method = request.path("method").asText("");
        try {
            Object result = dispatcher.dispatch(method, request.get("params"));
            Map<String, Object> body = new LinkedHashMap<>();
            putId(body, id);
            body.put("result", result);
            return new RpcReply(200, body);
        } catch (CoordinationException e) {
            return error(id, e.kind().name(), e.getMessage(), httpStatus(e.kind()));
        } catch (RuntimeException e) {
            return error(id, INTERNAL, String.valueOf(e.getMessage()), 500);
        }
    }

    static int httpStatus(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, UNKNOWN_METHOD -> 400;
            case NOT_FOUND -> 404;
            case CONFLICT -> 409;
        };
    }

    static RpcReply error(JsonNode id, String kind, String message, int status) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", kind);
        error.put("message", message);
        Map<String, Object> body = new LinkedHashMap<>();
        putId(body, id);
        body.put("error", error);
        return new RpcReply(status, body);
    }

    private static void putId(Map<String, Object> body, JsonNode id) {
        if (id != null && !id.isNull()) {
            body.put("id", id);
        }
    }

    record RpcReply(int status, Map<String, Object> body) {
        boolean ok() {
            return body.containsKey("result");
        }
    }
}
