package com.ciro.jstyle.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Almacén direccionado por contenido con conteo de referencias.
 *
 * <p>Una entrada existe sólo mientras su contador sea &gt; 0. La transición 0→1
 * emite {@link ChangeType#ADD}, la 1→0 emite {@link ChangeType#REMOVE} y borra
 * la entrada. Los listeners se invocan en línea, en orden de registro.
 *
 * <p>No es thread-safe: quien lo comparta debe serializar el acceso.
 */
public class StyleCache<T extends Cacheable> {

    private static final Logger log = LoggerFactory.getLogger(StyleCache.class);

    private final Map<String, T> cache = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new HashMap<>();
    private final List<ChangeListener<T>> listeners = new ArrayList<>();

    /**
     * Suma una referencia. Devuelve SIEMPRE la instancia canónica guardada,
     * que puede no ser la que se pasó: las mutaciones siguientes deben ir
     * contra el valor devuelto.
     */
    @SuppressWarnings("unchecked")
    public <U extends T> U add(U item) {
        String id = item.id();
        int count = counts.getOrDefault(id, 0);

        counts.put(id, count + 1);

        if (count == 0) {
            cache.put(id, item);
            emitChange(ChangeType.ADD, item);
        }

        return (U) cache.get(id);
    }

    /** Resta una referencia; si no existe, no hace nada. */
    public void remove(T item) {
        String id = item.id();
        Integer count = counts.get(id);

        if (count == null || count <= 0) return;

        if (count == 1) {
            counts.remove(id);
            T stored = cache.remove(id);
            emitChange(ChangeType.REMOVE, stored != null ? stored : item);
        } else {
            counts.put(id, count - 1);
        }
    }

    public int count(T item) {
        return counts.getOrDefault(item.id(), 0);
    }

    public boolean has(T item) {
        return count(item) > 0;
    }

    /** Instancia canónica con el mismo id, o {@code null}. */
    @SuppressWarnings("unchecked")
    public <U extends T> U get(U item) {
        return (U) cache.get(item.id());
    }

    public int size() {
        return cache.size();
    }

    public boolean isEmpty() {
        return cache.isEmpty();
    }

    /** Copia de las entradas vivas, en orden de inserción. */
    public List<T> values() {
        return new ArrayList<>(cache.values());
    }

    /**
     * Vacía el cache llamando a {@link #remove} tantas veces como se añadió
     * cada entrada: un único REMOVE por entrada.
     */
    public void empty() {
        for (T item : values()) {
            int len = count(item);
            while (len-- > 0) {
                remove(item);
            }
        }
    }

    public void addChangeListener(ChangeListener<T> listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(ChangeListener<T> listener) {
        listeners.remove(listener);
    }

    protected void emitChange(ChangeType type, T item) {
        if (log.isTraceEnabled()) {
            log.trace("{} {}", type, item.id());
        }
        // Por índice: un listener añadido durante la emisión también se invoca
        for (int i = 0; i < listeners.size(); i++) {
            listeners.get(i).onChange(type, item);
        }
    }
}
