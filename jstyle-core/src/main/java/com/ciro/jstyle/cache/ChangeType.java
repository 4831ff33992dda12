package com.ciro.jstyle.cache;

public enum ChangeType {
    ADD,
    REMOVE
}
