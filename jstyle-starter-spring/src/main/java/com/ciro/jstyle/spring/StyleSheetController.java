package com.ciro.jstyle.spring;

import com.ciro.jstyle.LockedStyleSheet;
import com.ciro.jstyle.StyleParseException;
import com.ciro.jstyle.tree.StyleTreeReader;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StyleSheetController {

    private static final Logger log = LoggerFactory.getLogger(StyleSheetController.class);

    private static final MediaType TEXT_CSS = MediaType.valueOf("text/css;charset=UTF-8");

    private final LockedStyleSheet sheet;
    private final StyleTreeReader reader;
    private final JStyleProperties properties;

    public StyleSheetController(LockedStyleSheet sheet, StyleTreeReader reader, JStyleProperties properties) {
        this.sheet = sheet;
        this.reader = reader;
        this.properties = properties;
    }

    @GetMapping("${jstyle.path:/jstyle.css}")
    public ResponseEntity<String> css(@RequestParam(name = "pretty", required = false) Boolean pretty) {
        boolean isPretty = pretty != null ? pretty : properties.isPretty();
        return ResponseEntity.ok()
                .contentType(TEXT_CSS)
                .cacheControl(CacheControl.noStore())
                .body(sheet.render(isPretty));
    }

    @PostMapping(value = "/jstyle/styles", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> register(@RequestBody JsonNode body) {
        return result(sheet.register(reader.read(body)));
    }

    @DeleteMapping(value = "/jstyle/styles", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> unregister(@RequestBody JsonNode body) {
        return result(sheet.unregister(reader.read(body)));
    }

    @ExceptionHandler(StyleParseException.class)
    public ResponseEntity<Map<String, Object>> badRequest(StyleParseException e) {
        log.warn("Árbol de estilos rechazado: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("code", "BAD_REQUEST");
        body.put("error", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    private static Map<String, Object> result(String className) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("className", className);
        return body;
    }
}
