package com.ciro.jstyle;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Helpers para usar los nombres de clase generados; no tocan ningún cache. */
public final class ClassNames {

    // Lo que encodeURI deja intacto
    private static final String URI_SAFE = ";,/?:@&=+$-_.!~*'()#";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private ClassNames() {}

    /** {@code url("...")} con la URL codificada como lo haría {@code encodeURI}. */
    public static String url(String url) {
        return "url(\"" + encodeUri(url) + "\")";
    }

    /**
     * Une nombres de clase: strings tal cual, arrays/colecciones en
     * recursión, mapas aportan las claves con valor "verdadero". Los null se saltan.
     */
    public static String join(Object... classList) {
        List<String> classNames = new ArrayList<>();

        for (Object value : classList) {
            if (value instanceof String s) {
                classNames.add(s);
            } else if (value instanceof Object[] arr) {
                classNames.add(join(arr));
            } else if (value instanceof Collection<?> c) {
                classNames.add(join(c.toArray()));
            } else if (value instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    if (isTruthy(e.getValue())) {
                        classNames.add(String.valueOf(e.getKey()));
                    }
                }
            }
        }

        return String.join(" ", classNames);
    }

    static String encodeUri(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || (c < 0x80 && URI_SAFE.indexOf(c) >= 0)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0xf]);
            }
        }
        return sb.toString();
    }

    private static boolean isTruthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0 && !Double.isNaN(n.doubleValue());
        if (v instanceof CharSequence cs) return cs.length() > 0;
        return true;
    }
}
