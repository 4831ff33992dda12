package com.ciro.jstyle;

import com.ciro.jstyle.compile.StyleHash;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Crea hojas raíz. La raíz no tiene contenido del que derivar un hash, así
 * que su id es {@code prefijo_contador}: el prefijo es aleatorio por fábrica
 * y el contador es propio de cada fábrica.
 */
public class StyleSheetFactory {

    private final String prefix;
    private final AtomicInteger ids = new AtomicInteger();

    public StyleSheetFactory() {
        this(StyleHash.hashToString(ThreadLocalRandom.current().nextInt()));
    }

    StyleSheetFactory(String prefix) {
        this.prefix = prefix;
    }

    public StyleSheet create() {
        return new StyleSheet(prefix + "_" + StyleHash.hashToString(ids.incrementAndGet()));
    }
}
