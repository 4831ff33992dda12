package com.ciro.jstyle.standalone;

import com.ciro.jstyle.LockedStyleSheet;
import com.ciro.jstyle.StyleParseException;
import com.ciro.jstyle.tree.StyleLayer;
import com.ciro.jstyle.tree.StyleTreeReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * /styles
 * <ul>
 *   <li>POST: registra el árbol JSON del body, responde {@code {"ok":true,"className":"..."}}</li>
 *   <li>DELETE: deshace un registro previo con el mismo árbol</li>
 * </ul>
 */
public final class StylesEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(StylesEndpoint.class);

    private final LockedStyleSheet sheet;
    private final ObjectMapper mapper;
    private final StyleTreeReader reader;

    public StylesEndpoint(LockedStyleSheet sheet, ObjectMapper mapper) {
        this.sheet = sheet;
        this.mapper = mapper;
        this.reader = new StyleTreeReader(mapper);
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        // register/unregister toman el lock de la hoja: fuera del hilo de IO
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        String method = exchange.getRequestMethod().toString();
        boolean register = "POST".equals(method);

        if (!register && !"DELETE".equals(method)) {
            JsonResponses.error(exchange, mapper, 405, "METHOD_NOT_ALLOWED", "Only POST and DELETE are allowed");
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, bytes) -> {
            // si el body llegó en varias lecturas el callback corre en el hilo de IO
            if (ex.isInIoThread()) {
                ex.dispatch(() -> apply(ex, method, register, bytes));
            } else {
                apply(ex, method, register, bytes);
            }
        }, (ex, err) -> {
            log.warn("No se pudo leer el body", err);
            JsonResponses.error(ex, mapper, 400, "BAD_REQUEST", err.getMessage());
        });
    }

    private void apply(HttpServerExchange ex, String method, boolean register, byte[] bytes) {
        try {
            if (bytes == null || bytes.length == 0) {
                JsonResponses.error(ex, mapper, 400, "BAD_REQUEST", "Empty body");
                return;
            }

            StyleLayer styles = reader.read(bytes);
            String className = register ? sheet.register(styles) : sheet.unregister(styles);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("ok", true);
            body.put("className", className);
            JsonResponses.ok(ex, mapper, body);

        } catch (StyleParseException e) {
            log.warn("Body rechazado en {} /styles: {}", method, e.getMessage());
            JsonResponses.error(ex, mapper, 400, "BAD_REQUEST", e.getMessage());
        } catch (Exception e) {
            log.error("Error procesando {} /styles", method, e);
            JsonResponses.error(ex, mapper, 500, "INTERNAL", e.getMessage());
        }
    }
}
