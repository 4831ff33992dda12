package com.ciro.jstyle.compile;

import com.ciro.jstyle.tree.StyleLayer;
import com.ciro.jstyle.tree.StyleValue;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normaliza una capa: claves ordenadas, propiedades en kebab-case y
 * capas anidadas separadas. El orden es lo que garantiza la deduplicación:
 * {@code {color, background}} y {@code {background, color}} producen el mismo texto.
 */
public final class PropertyCompiler {

    private static final Pattern UPPER = Pattern.compile("([A-Z])");

    // Los nombres de propiedad se repiten muchísimo entre registros
    private static final Cache<String, String> HYPHENATED = Caffeine.newBuilder()
            .maximumSize(1_000)
            .build();

    private PropertyCompiler() {}

    public record Property(String name, StyleValue value) {}

    public record NestedStyle(String name, StyleLayer styles) {}

    public record CompiledLayer(List<Property> properties, List<NestedStyle> nestedStyles) {
        public String declarations() {
            return stringify(properties);
        }
    }

    public static CompiledLayer compile(StyleLayer styles) {
        List<Property> properties = new ArrayList<>();
        List<NestedStyle> nestedStyles = new ArrayList<>();

        List<String> keys = new ArrayList<>(styles.entries().keySet());
        keys.sort(null);

        for (String key : keys) {
            StyleValue value = styles.entries().get(key);

            if (value instanceof StyleValue.NestedLayer nested) {
                nestedStyles.add(new NestedStyle(key.trim(), nested.layer()));
            } else {
                properties.add(new Property(hyphenate(key.trim()), value));
            }
        }

        return new CompiledLayer(properties, nestedStyles);
    }

    public static String stringify(List<Property> properties) {
        StringBuilder sb = new StringBuilder();
        for (Property p : properties) {
            appendProperty(sb, p.name(), p.value());
        }
        return sb.toString();
    }

    /** {@code backgroundColor → background-color}, {@code msTransform → -ms-transform}. */
    public static String hyphenate(String propertyName) {
        return HYPHENATED.get(propertyName, PropertyCompiler::toHyphenCase);
    }

    private static String toHyphenCase(String propertyName) {
        String dashed = UPPER.matcher(propertyName).replaceAll("-$1");
        if (dashed.startsWith("ms-")) {
            dashed = "-" + dashed;
        }
        return dashed.toLowerCase(Locale.ROOT);
    }

    private static void appendProperty(StringBuilder sb, String name, StyleValue value) {
        if (value instanceof StyleValue.ScalarArray array) {
            // una declaración por elemento, sin deduplicar: cadenas de fallback
            for (StyleValue item : array.values()) {
                appendProperty(sb, name, item);
            }
        } else if (value instanceof StyleValue.Scalar scalar) {
            sb.append(name).append(':').append(scalar.text()).append(';');
        }
        // Absent: nada
    }

    static boolean isAtRule(String name) {
        return !name.isEmpty() && name.charAt(0) == '@';
    }
}
