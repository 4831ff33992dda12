package com.ciro.jstyle;

import com.helger.css.ECSSVersion;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.reader.CSSReader;
import com.helger.css.reader.errorhandler.CollectingCSSParseErrorHandler;
import com.helger.css.writer.CSSWriter;
import com.helger.css.writer.CSSWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-formatea el CSS generado (que sale minificado) para lectura humana.
 * Si ph-css reporta cualquier error se devuelve el texto original: la
 * recuperación del parser descartaría reglas en silencio.
 */
public final class CssFormatter {

    private static final Logger log = LoggerFactory.getLogger(CssFormatter.class);

    private CssFormatter() {}

    public static String pretty(String css) {
        return write(css, false);
    }

    public static String minify(String css) {
        return write(css, true);
    }

    /** true si ph-css entiende todo el texto como CSS 3, sin errores. */
    public static boolean isParsable(String css) {
        return css != null && parse(css) != null;
    }

    private static String write(String css, boolean optimized) {
        if (css == null || css.isBlank()) return "";

        CascadingStyleSheet aCSS = parse(css);
        if (aCSS == null) {
            log.warn("CSS no parseable, se devuelve sin formatear ({} caracteres)", css.length());
            return css;
        }

        CSSWriterSettings settings = new CSSWriterSettings(ECSSVersion.CSS30, optimized);
        CSSWriter writer = new CSSWriter(settings);
        writer.setWriteHeaderText(false);
        return writer.getCSSAsString(aCSS);
    }

    private static CascadingStyleSheet parse(String css) {
        CollectingCSSParseErrorHandler errors = new CollectingCSSParseErrorHandler();
        CascadingStyleSheet aCSS = CSSReader.readFromString(css, ECSSVersion.CSS30, errors);

        if (aCSS == null || errors.hasParseErrors()) {
            if (log.isDebugEnabled()) {
                log.debug("ph-css: {}", errors.getAllParseErrors());
            }
            return null;
        }
        return aCSS;
    }
}
