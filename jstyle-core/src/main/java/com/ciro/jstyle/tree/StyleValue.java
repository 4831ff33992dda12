package com.ciro.jstyle.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Valor de una clave dentro de una capa de estilos.
 * Se decide una sola vez, al ingresar el árbol: escalar, lista de escalares,
 * capa anidada o ausente.
 */
public sealed interface StyleValue
        permits StyleValue.Scalar, StyleValue.ScalarArray, StyleValue.NestedLayer, StyleValue.Absent {

    record Scalar(String text) implements StyleValue {
        public Scalar {
            if (text == null) throw new IllegalArgumentException("text == null, usa Absent");
        }

        public static Scalar of(Object value) {
            if (value instanceof Number n) return new Scalar(formatNumber(n));
            return new Scalar(String.valueOf(value));
        }
    }

    /** Cada elemento es un {@link Scalar} o {@link Absent}; se emite una declaración por elemento. */
    record ScalarArray(List<StyleValue> values) implements StyleValue {
        public ScalarArray {
            values = List.copyOf(values);
        }
    }

    record NestedLayer(StyleLayer layer) implements StyleValue {}

    /** Propiedad sin valor: no genera salida. */
    enum Absent implements StyleValue {
        INSTANCE
    }

    static StyleValue from(Object raw) {
        if (raw == null) return Absent.INSTANCE;
        if (raw instanceof StyleValue v) return v;
        if (raw instanceof StyleLayer layer) return new NestedLayer(layer);
        if (raw instanceof Map<?, ?> map) return new NestedLayer(StyleLayer.of(map));

        List<?> items = asList(raw);
        if (items != null) {
            List<StyleValue> values = new ArrayList<>(items.size());
            for (Object item : items) {
                values.add(item == null ? Absent.INSTANCE : new Scalar(stringify(item)));
            }
            return new ScalarArray(values);
        }

        return Scalar.of(raw);
    }

    /**
     * Texto de un número con las reglas de {@code Number#toString} de
     * JavaScript: dígitos mínimos, {@code -0} como {@code 0}, notación
     * exponencial fuera de [1e-6, 1e21) ({@code 1e+21}, {@code 1.5e-7}).
     * Nunca se añade unidad.
     */
    static String formatNumber(Number n) {
        BigDecimal value;
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            value = BigDecimal.valueOf(n.longValue());
        } else if (n instanceof BigInteger bi) {
            value = new BigDecimal(bi);
        } else if (n instanceof BigDecimal bd) {
            value = bd;
        } else {
            double d = (n instanceof Float f) ? Double.parseDouble(Float.toString(f)) : n.doubleValue();

            if (Double.isNaN(d)) return "NaN";
            if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
            value = BigDecimal.valueOf(d);
        }

        if (value.signum() == 0) return "0";

        BigDecimal abs = value.abs().stripTrailingZeros();
        String digits = abs.unscaledValue().toString();
        int k = digits.length();
        // valor = 0.digits * 10^exp
        int exp = k - abs.scale();

        StringBuilder out = new StringBuilder();
        if (value.signum() < 0) out.append('-');

        if (k <= exp && exp <= 21) {
            out.append(digits).append("0".repeat(exp - k));
        } else if (0 < exp && exp <= 21) {
            out.append(digits, 0, exp).append('.').append(digits, exp, k);
        } else if (-6 < exp && exp <= 0) {
            out.append("0.").append("0".repeat(-exp)).append(digits);
        } else {
            int e = exp - 1;
            out.append(digits.charAt(0));
            if (k > 1) out.append('.').append(digits, 1, k);
            out.append('e').append(e < 0 ? '-' : '+').append(Math.abs(e));
        }
        return out.toString();
    }

    private static String stringify(Object item) {
        if (item == null) return "";
        if (item instanceof Number n) return formatNumber(n);
        if (item instanceof Map<?, ?> || item instanceof StyleLayer) return "[object Object]";
        List<?> nested = asList(item);
        if (nested != null) {
            return nested.stream().map(StyleValue::stringify).collect(Collectors.joining(","));
        }
        return String.valueOf(item);
    }

    private static List<?> asList(Object raw) {
        if (raw instanceof Collection<?> c) return new ArrayList<>(c);
        if (raw instanceof Object[] arr) return Arrays.asList(arr);
        return null;
    }
}
