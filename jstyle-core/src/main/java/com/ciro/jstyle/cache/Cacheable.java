package com.ciro.jstyle.cache;

/**
 * Cualquier cosa que se pueda guardar en un {@link StyleCache}.
 * El id se deriva del contenido: mismo contenido, mismo id.
 */
public interface Cacheable {
    String id();
}
