package com.ciro.jstyle.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.LinkedHashMap;
import java.util.Map;

final class JsonResponses {

    private JsonResponses() {}

    static void ok(HttpServerExchange ex, ObjectMapper mapper, Map<String, Object> body) {
        send(ex, mapper, 200, body);
    }

    static void error(HttpServerExchange ex, ObjectMapper mapper, int status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("code", code);
        body.put("error", message == null ? "" : message);
        send(ex, mapper, status, body);
    }

    private static void send(HttpServerExchange ex, ObjectMapper mapper, int status, Map<String, Object> body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            // un Map de strings/booleans no debería fallar nunca
            throw new IllegalStateException("No se pudo serializar la respuesta", e);
        }
        ex.setStatusCode(status);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        ex.getResponseSender().send(json);
    }
}
