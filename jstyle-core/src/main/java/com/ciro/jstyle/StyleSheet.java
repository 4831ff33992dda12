package com.ciro.jstyle;

import com.ciro.jstyle.cache.ChangeListener;
import com.ciro.jstyle.compile.TreeBuilder;
import com.ciro.jstyle.node.Container;
import com.ciro.jstyle.node.StyleNode;
import com.ciro.jstyle.tree.StyleLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Hoja raíz: punto de registro de estilos y de renderizado del CSS final.
 *
 * <pre>
 * StyleSheet sheet = new StyleSheetFactory().create();
 * String cls = sheet.registerStyle(Map.of("color", "red", "&amp;:hover", Map.of("color", "blue")));
 * sheet.getStyles(); // ".xyz{color:red;}.xyz:hover{color:blue;}"
 * </pre>
 *
 * No es thread-safe; ver {@link LockedStyleSheet}.
 */
public class StyleSheet {

    private static final Logger log = LoggerFactory.getLogger(StyleSheet.class);

    private final Container root;

    StyleSheet(String id) {
        this.root = new Container(id);
    }

    public String id() {
        return root.id();
    }

    /** Registra el árbol y devuelve el nombre de clase generado. */
    public String registerStyle(StyleLayer styles) {
        String className = TreeBuilder.register(root.children(), styles);
        if (log.isDebugEnabled()) {
            log.debug("[{}] registrado .{} ({} nodos raíz)", id(), className, root.children().size());
        }
        return className;
    }

    public String registerStyle(Map<String, ?> styles) {
        return registerStyle(StyleLayer.of(styles));
    }

    /**
     * Deshace un registro previo. Hay que pasar el mismo árbol que se
     * registró: no existe borrado por nombre de clase.
     */
    public String unregisterStyle(StyleLayer styles) {
        String className = TreeBuilder.unregister(root.children(), styles);
        if (log.isDebugEnabled()) {
            log.debug("[{}] eliminado .{} ({} nodos raíz)", id(), className, root.children().size());
        }
        return className;
    }

    public String unregisterStyle(Map<String, ?> styles) {
        return unregisterStyle(StyleLayer.of(styles));
    }

    public String getStyles() {
        return root.getStyles();
    }

    /* ---------------- acceso directo al contenedor raíz ---------------- */

    public <U extends StyleNode> U add(U node) {
        return root.children().add(node);
    }

    public void remove(StyleNode node) {
        root.children().remove(node);
    }

    public int count(StyleNode node) {
        return root.children().count(node);
    }

    public boolean has(StyleNode node) {
        return root.children().has(node);
    }

    public List<StyleNode> values() {
        return root.children().values();
    }

    public void empty() {
        root.children().empty();
    }

    public void addChangeListener(ChangeListener<StyleNode> listener) {
        root.children().addChangeListener(listener);
    }

    public void removeChangeListener(ChangeListener<StyleNode> listener) {
        root.children().removeChangeListener(listener);
    }

    /** Anida otra hoja: su CSS vivo pasa a formar parte de éste. */
    public void include(StyleSheet other) {
        root.children().add(other.root);
    }

    public void exclude(StyleSheet other) {
        root.children().remove(other.root);
    }

    /* ---------------- utilidades ---------------- */

    public String url(String url) {
        return ClassNames.url(url);
    }

    public String join(Object... classList) {
        return ClassNames.join(classList);
    }
}
