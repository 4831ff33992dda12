package com.ciro.jstyle.node;

import com.ciro.jstyle.cache.StyleCache;

/** Agrupa reglas y otros contenedores; se renderiza concatenando a sus hijos. */
public final class Container implements StyleNode {

    private final String id;
    private final StyleCache<StyleNode> children = new StyleCache<>();

    public Container(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    public StyleCache<StyleNode> children() {
        return children;
    }

    @Override
    public String getStyles() {
        return render(children);
    }

    static String render(StyleCache<StyleNode> children) {
        StringBuilder sb = new StringBuilder();
        for (StyleNode child : children.values()) {
            sb.append(child.getStyles());
        }
        return sb.toString();
    }
}
