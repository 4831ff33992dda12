package com.ciro.jstyle.cache;

@FunctionalInterface
public interface ChangeListener<T> {
    void onChange(ChangeType type, T item);
}
