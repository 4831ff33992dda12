package com.ciro.jstyle.node;

import com.ciro.jstyle.cache.StyleCache;
import com.ciro.jstyle.compile.StyleHash;

import java.util.stream.Collectors;

/**
 * Un bloque de declaraciones compiladas ({@code color:red;}) junto con los
 * selectores que lo usan. Dos capas con el mismo texto comparten instancia.
 */
public final class Style implements StyleNode {

    private final String id;
    private final String style;
    private final StyleCache<Selector> selectors = new StyleCache<>();

    public Style(String style) {
        this.style = style;
        this.id = "n" + StyleHash.hashString(style);
    }

    @Override
    public String id() {
        return id;
    }

    public String style() {
        return style;
    }

    public StyleCache<Selector> selectors() {
        return selectors;
    }

    @Override
    public String getStyles() {
        // sin declaraciones no hay regla, aunque tenga selectores activos
        if (style.isEmpty()) return "";

        String joined = selectors.values().stream()
                .map(Selector::selector)
                .collect(Collectors.joining(","));

        return joined + "{" + style + "}";
    }
}
