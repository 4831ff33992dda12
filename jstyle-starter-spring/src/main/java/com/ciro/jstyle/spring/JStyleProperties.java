package com.ciro.jstyle.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jstyle")
public class JStyleProperties {
    /** Activa/desactiva el controlador HTTP */
    private boolean enabled = true;
    /** Ruta donde se sirve el CSS generado */
    private String path = "/jstyle.css";
    /** Servir el CSS formateado en vez de minificado */
    private boolean pretty = false;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public boolean isPretty() { return pretty; }
    public void setPretty(boolean pretty) { this.pretty = pretty; }
}
