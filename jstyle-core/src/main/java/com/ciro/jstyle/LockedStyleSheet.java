package com.ciro.jstyle;

import com.ciro.jstyle.tree.StyleLayer;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializa el acceso a una {@link StyleSheet} compartida entre hilos
 * (servidor HTTP, beans de Spring). El núcleo no bloquea nada por sí mismo.
 */
public final class LockedStyleSheet {

    private final StyleSheet sheet;
    private final ReentrantLock lock = new ReentrantLock();

    public LockedStyleSheet(StyleSheet sheet) {
        this.sheet = sheet;
    }

    public String register(StyleLayer styles) {
        return withLock(() -> sheet.registerStyle(styles));
    }

    public String unregister(StyleLayer styles) {
        return withLock(() -> sheet.unregisterStyle(styles));
    }

    public String render(boolean pretty) {
        String css = withLock(sheet::getStyles);
        // el formateo trabaja sobre una copia, fuera del lock
        return pretty ? CssFormatter.pretty(css) : css;
    }

    public StyleSheet unwrap() {
        return sheet;
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
