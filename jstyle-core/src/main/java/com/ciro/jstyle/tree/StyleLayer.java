package com.ciro.jstyle.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Un nivel del árbol de estilos. Conserva el orden de inserción del
 * llamador; el orden canónico (claves ordenadas) lo impone el compilador.
 */
public final class StyleLayer {

    private final Map<String, StyleValue> entries;

    private StyleLayer(Map<String, StyleValue> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static StyleLayer of(Map<?, ?> raw) {
        Map<String, StyleValue> entries = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<?, ?> e : raw.entrySet()) {
                entries.put(String.valueOf(e.getKey()), StyleValue.from(e.getValue()));
            }
        }
        return new StyleLayer(entries);
    }

    public static StyleLayer empty() {
        return new StyleLayer(new LinkedHashMap<>());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, StyleValue> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StyleLayer)) return false;
        return entries.equals(((StyleLayer) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "StyleLayer" + entries;
    }

    public static final class Builder {
        private final Map<String, StyleValue> entries = new LinkedHashMap<>();

        private Builder() {}

        /** Acepta String, Number, listas/arrays, null o un {@link StyleValue}. */
        public Builder property(String name, Object value) {
            entries.put(name, StyleValue.from(value));
            return this;
        }

        /** Selector anidado ({@code .foo}, {@code &:hover}) o at-rule ({@code @media ...}). */
        public Builder nested(String key, StyleLayer layer) {
            entries.put(key, new StyleValue.NestedLayer(layer));
            return this;
        }

        public StyleLayer build() {
            return new StyleLayer(new LinkedHashMap<>(entries));
        }
    }
}
