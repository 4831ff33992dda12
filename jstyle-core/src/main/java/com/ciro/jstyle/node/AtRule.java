package com.ciro.jstyle.node;

import com.ciro.jstyle.cache.StyleCache;
import com.ciro.jstyle.compile.StyleHash;

/**
 * Bloque {@code @media}, {@code @supports}, etc. Sus hijos se renderizan
 * dentro de {@code rule{...}}. El id sale del texto de la regla, así que
 * dos registros con la misma at-rule comparten bloque.
 */
public final class AtRule implements StyleNode {

    private final String id;
    private final String rule;
    private final StyleCache<StyleNode> children = new StyleCache<>();

    public AtRule(String rule) {
        this.rule = rule;
        this.id = "a" + StyleHash.hashString(rule);
    }

    @Override
    public String id() {
        return id;
    }

    public String rule() {
        return rule;
    }

    public StyleCache<StyleNode> children() {
        return children;
    }

    @Override
    public String getStyles() {
        return rule + "{" + Container.render(children) + "}";
    }
}
