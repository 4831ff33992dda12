package com.ciro.jstyle.tree;

import com.ciro.jstyle.StyleParseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Convierte JSON en un {@link StyleLayer}.
 * <pre>
 * {"color": "red", "&amp;:hover": {"color": "blue"}, "@media print": {"display": "none"}}
 * </pre>
 */
public final class StyleTreeReader {

    private final ObjectMapper mapper;

    public StyleTreeReader() {
        this(new ObjectMapper());
    }

    public StyleTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public StyleLayer read(String json) {
        try {
            return read(mapper.readTree(json));
        } catch (IOException e) {
            throw new StyleParseException("JSON de estilos inválido", e);
        }
    }

    public StyleLayer read(byte[] json) {
        try {
            return read(mapper.readTree(json));
        } catch (IOException e) {
            throw new StyleParseException("JSON de estilos inválido", e);
        }
    }

    public StyleLayer read(InputStream in) {
        try {
            return read(mapper.readTree(in));
        } catch (IOException e) {
            throw new StyleParseException("JSON de estilos inválido", e);
        }
    }

    public StyleLayer read(JsonNode node) {
        if (node == null || !node.isObject()) {
            String kind = node == null || node.isMissingNode() ? "vacío" : node.getNodeType().name();
            throw new StyleParseException("Se esperaba un objeto JSON en la raíz, llegó: " + kind);
        }
        return toLayer(node);
    }

    private StyleLayer toLayer(JsonNode object) {
        Map<String, StyleValue> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), toValue(field.getValue()));
        }
        return StyleLayer.of(entries);
    }

    private StyleValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return StyleValue.Absent.INSTANCE;
        if (node.isObject()) return new StyleValue.NestedLayer(toLayer(node));
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toRaw(item));
            }
            return StyleValue.from(items);
        }
        return StyleValue.Scalar.of(toRaw(node));
    }

    private Object toRaw(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) return node.numberValue();
        if (node.isTextual()) return node.textValue();
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(toRaw(item));
            return items;
        }
        // booleans y objetos dentro de arrays: se pasan tal cual a texto
        return node.isObject() ? "[object Object]" : node.asText();
    }
}
