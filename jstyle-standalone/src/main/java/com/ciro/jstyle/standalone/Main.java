package com.ciro.jstyle.standalone;

import com.ciro.jstyle.LockedStyleSheet;
import com.ciro.jstyle.StyleParseException;
import com.ciro.jstyle.StyleSheetFactory;
import com.ciro.jstyle.tree.StyleTreeReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Uso: {@code java -Djstyle.port=8080 -jar jstyle-standalone.jar estilos/boton.json estilos/card.json}
 * <p>Cada argumento es un árbol de estilos JSON que se registra al arrancar.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        // 1. Configuración
        int port = Integer.getInteger("jstyle.port", 8080);
        String host = System.getProperty("jstyle.host", "0.0.0.0");

        // 2. Hoja compartida
        ObjectMapper mapper = ObjectMapperFactory.create();
        LockedStyleSheet sheet = new LockedStyleSheet(new StyleSheetFactory().create());

        // 3. Precarga
        preload(sheet, new StyleTreeReader(mapper), args);

        // 4. Arrancar
        JStyleServer server = new JStyleServer(host, port, sheet, mapper);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "jstyle-shutdown"));
        server.start();
    }

    static int preload(LockedStyleSheet sheet, StyleTreeReader reader, String[] files) {
        int loaded = 0;
        for (String file : files) {
            Path path = Path.of(file);
            try (InputStream in = Files.newInputStream(path)) {
                String className = sheet.register(reader.read(in));
                log.info("{} -> .{}", path, className);
                loaded++;
            } catch (IOException | StyleParseException e) {
                log.error("No se pudo cargar {}", path, e);
            }
        }
        return loaded;
    }
}
