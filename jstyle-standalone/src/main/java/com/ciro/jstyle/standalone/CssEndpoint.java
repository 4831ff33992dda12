package com.ciro.jstyle.standalone;

import com.ciro.jstyle.LockedStyleSheet;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.Deque;

/** GET /styles.css → todo el CSS vivo. {@code ?pretty=true} lo devuelve formateado. */
public class CssEndpoint implements HttpHandler {

    private final LockedStyleSheet sheet;

    public CssEndpoint(LockedStyleSheet sheet) {
        this.sheet = sheet;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        // el render (y sobre todo el pretty) no se hace en el hilo de IO
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        String method = exchange.getRequestMethod().toString();
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            exchange.setStatusCode(405);
            exchange.getResponseHeaders().put(Headers.ALLOW, "GET, HEAD");
            exchange.endExchange();
            return;
        }

        Deque<String> pretty = exchange.getQueryParameters().get("pretty");
        boolean isPretty = pretty != null && "true".equalsIgnoreCase(pretty.peekFirst());

        String css = sheet.render(isPretty);

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/css; charset=utf-8");
        // el CSS cambia con cada registro
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
        exchange.getResponseSender().send(css);
    }
}
