package com.ciro.jstyle.compile;

public final class SelectorInterpolator {

    /** Selector sintético de la raíz de cada registro. */
    public static final String ROOT_SELECTOR = "&";

    private SelectorInterpolator() {}

    /**
     * {@code &} se sustituye por el selector padre (todas las apariciones);
     * sin {@code &} se usa el combinador descendiente: {@code "padre hijo"}.
     */
    public static String interpolate(String selector, String parentSelector) {
        if (selector.indexOf('&') > -1) {
            return selector.replace("&", parentSelector);
        }
        return parentSelector + " " + selector;
    }
}
