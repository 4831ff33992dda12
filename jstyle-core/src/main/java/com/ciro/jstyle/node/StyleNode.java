package com.ciro.jstyle.node;

import com.ciro.jstyle.cache.Cacheable;

/**
 * Nodo que sabe renderizarse a CSS. Conjunto cerrado: una regla con
 * declaraciones, un contenedor o una at-rule.
 */
public sealed interface StyleNode extends Cacheable permits Style, Container, AtRule {

    String getStyles();
}
