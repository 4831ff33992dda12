package com.ciro.jstyle.node;

import com.ciro.jstyle.cache.Cacheable;
import com.ciro.jstyle.compile.StyleHash;

/** Selector final ya interpolado, p.ej. {@code .f3a9 .foo}. Hoja inmutable. */
public final class Selector implements Cacheable {

    private final String id;
    private final String selector;

    public Selector(String selector) {
        this.selector = selector;
        this.id = "s" + StyleHash.hashString(selector);
    }

    @Override
    public String id() {
        return id;
    }

    public String selector() {
        return selector;
    }

    @Override
    public String toString() {
        return selector;
    }
}
