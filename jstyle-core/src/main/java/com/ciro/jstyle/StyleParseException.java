package com.ciro.jstyle;

/** El árbol de estilos recibido (JSON) no se pudo interpretar. */
public class StyleParseException extends RuntimeException {

    public StyleParseException(String message) {
        super(message);
    }

    public StyleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
