package com.ciro.jstyle.standalone;

import com.ciro.jstyle.LockedStyleSheet;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class JStyleServer {

    private static final Logger log = LoggerFactory.getLogger(JStyleServer.class);

    private final String host;
    private final int port;
    private final LockedStyleSheet sheet;
    private final ObjectMapper mapper;

    private Undertow server;

    public JStyleServer(String host, int port, LockedStyleSheet sheet, ObjectMapper mapper) {
        this.host = host;
        this.port = port;
        this.sheet = sheet;
        this.mapper = mapper;
    }

    /** Arranca y devuelve el puerto real (útil con puerto 0). */
    public int start() {
        CssEndpoint cssEndpoint = new CssEndpoint(sheet);
        StylesEndpoint stylesEndpoint = new StylesEndpoint(sheet, mapper);

        HttpHandler fallback = exchange ->
                JsonResponses.error(exchange, mapper, 404, "NOT_FOUND", "No route for " + exchange.getRequestPath());

        PathHandler routes = new PathHandler(fallback);
        routes.addExactPath("/styles.css", cssEndpoint);
        routes.addExactPath("/styles", stylesEndpoint);

        server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(routes)
                .build();

        server.start();

        int actualPort = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        log.info("jstyle corriendo en http://{}:{}/styles.css", host, actualPort);
        return actualPort;
    }

    public void stop() {
        if (server != null) {
            server.stop();
            server = null;
        }
    }
}
