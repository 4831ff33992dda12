package com.ciro.jstyle.compile;

import com.ciro.jstyle.cache.StyleCache;
import com.ciro.jstyle.compile.PropertyCompiler.CompiledLayer;
import com.ciro.jstyle.compile.PropertyCompiler.NestedStyle;
import com.ciro.jstyle.node.AtRule;
import com.ciro.jstyle.node.Selector;
import com.ciro.jstyle.node.Style;
import com.ciro.jstyle.node.StyleNode;
import com.ciro.jstyle.tree.StyleLayer;

import java.util.ArrayList;
import java.util.List;

/**
 * Compila un árbol de estilos sobre un contenedor.
 *
 * <p>Recorrido en pre-orden: por cada capa se añade su {@link Style} al
 * contenedor actual y el hash avanza con (selector, declaraciones), en ese
 * orden. Las at-rules crean/reutilizan un {@link AtRule} en el contenedor
 * actual y se recorren con el MISMO selector; los selectores anidados se
 * interpolan y se quedan en el mismo contenedor. Al final el hash es el
 * nombre de clase y cada Style recibe su {@link Selector} definitivo.
 */
public final class TreeBuilder {

    private TreeBuilder() {}

    /**
     * Par (selector sin resolver, Style) pendiente de recibir el nombre de
     * clase. {@code atRule} es el índice del AtRuleBinding que lo contiene, o -1.
     */
    record Binding(StyleCache<StyleNode> container, String selector, Style style, int atRule) {}

    /** {@code enclosing}: índice del AtRuleBinding padre, o -1. */
    record AtRuleBinding(StyleCache<StyleNode> parent, AtRule rule, int enclosing) {}

    /** Acumulador de un registro; el hash viaja por parámetro y retorno. */
    record Walk(List<Binding> bindings, List<AtRuleBinding> atRules) {
        Walk() {
            this(new ArrayList<>(), new ArrayList<>());
        }
    }

    public static String register(StyleCache<StyleNode> container, StyleLayer styles) {
        Walk walk = new Walk();
        int hash = stylize(container, styles, SelectorInterpolator.ROOT_SELECTOR, 0, walk, true, -1);

        String className = StyleHash.hashToString(hash);
        String classSelector = "." + className;

        for (Binding b : walk.bindings()) {
            b.style().selectors().add(new Selector(SelectorInterpolator.interpolate(b.selector(), classSelector)));
        }

        return className;
    }

    /**
     * Deshace un {@link #register} previo con el mismo árbol: repite el
     * recorrido y resta una referencia a cada Selector, Style y AtRule.
     *
     * <p>Sólo se toca un Style si todavía lleva el selector de ESTE nombre de
     * clase, y sólo un AtRule si dentro se ha deshecho algo. Un árbol nunca
     * registrado (o ya deshecho) no resta referencias a nodos compartidos
     * con otros registros.
     */
    public static String unregister(StyleCache<StyleNode> container, StyleLayer styles) {
        Walk walk = new Walk();
        int hash = stylize(container, styles, SelectorInterpolator.ROOT_SELECTOR, 0, walk, false, -1);

        String className = StyleHash.hashToString(hash);
        String classSelector = "." + className;

        List<AtRuleBinding> atRules = walk.atRules();
        boolean[] touched = new boolean[atRules.size()];

        for (Binding b : walk.bindings()) {
            if (b.container() == null) continue;

            Style canonical = b.container().get(b.style());
            if (canonical == null) continue;

            Selector selector = new Selector(SelectorInterpolator.interpolate(b.selector(), classSelector));
            if (!canonical.selectors().has(selector)) continue;

            canonical.selectors().remove(selector);
            b.container().remove(canonical);

            for (int i = b.atRule(); i >= 0 && !touched[i]; i = atRules.get(i).enclosing()) {
                touched[i] = true;
            }
        }

        // de dentro hacia fuera
        for (int i = atRules.size() - 1; i >= 0; i--) {
            AtRuleBinding a = atRules.get(i);
            if (touched[i] && a.parent() != null) a.parent().remove(a.rule());
        }

        return className;
    }

    /** Nombre de clase que produciría el árbol, sin tocar ningún cache. */
    public static String className(StyleLayer styles) {
        return StyleHash.hashToString(stylize(null, styles, SelectorInterpolator.ROOT_SELECTOR, 0, new Walk(), false, -1));
    }

    private static int stylize(StyleCache<StyleNode> container,
                               StyleLayer styles,
                               String selector,
                               int hash,
                               Walk walk,
                               boolean mutate,
                               int atRule) {

        CompiledLayer layer = PropertyCompiler.compile(styles);
        String declarations = layer.declarations();

        Style style = new Style(declarations);
        if (mutate) {
            style = container.add(style);
        }

        walk.bindings().add(new Binding(container, selector, style, atRule));

        hash = StyleHash.hash(selector, hash);
        hash = StyleHash.hash(declarations, hash);

        for (NestedStyle nested : layer.nestedStyles()) {
            if (PropertyCompiler.isAtRule(nested.name())) {
                AtRule rule = new AtRule(nested.name());
                AtRule canonical;
                if (mutate) {
                    canonical = container.add(rule);
                } else {
                    // en modo consulta el contenedor puede no existir
                    canonical = container == null ? null : container.get(rule);
                }

                int index = walk.atRules().size();
                walk.atRules().add(new AtRuleBinding(container, canonical != null ? canonical : rule, atRule));
                hash = stylize(canonical == null ? null : canonical.children(), nested.styles(), selector, hash, walk, mutate, index);
            } else {
                hash = stylize(container, nested.styles(), SelectorInterpolator.interpolate(nested.name(), selector), hash, walk, mutate, atRule);
            }
        }

        return hash;
    }
}
