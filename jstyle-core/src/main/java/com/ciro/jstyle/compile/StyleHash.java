package com.ciro.jstyle.compile;

/**
 * Hash de 32 bits encadenable (variante FNV-1a) usado como identidad de
 * todos los nodos y como nombre de clase.
 *
 * <p>Las colisiones no se detectan: dos estructuras distintas con el mismo
 * hash compartirían entrada en el cache.
 */
public final class StyleHash {

    public static final int SEED = 0x811c9dc5;

    private StyleHash() {}

    /**
     * @param seed resultado de un hash previo para encadenar; {@code 0} usa la semilla por defecto
     * @return los 32 bits del hash, a interpretar sin signo
     */
    public static int hash(String str, int seed) {
        int value = seed != 0 ? seed : SEED;

        for (int i = 0; i < str.length(); i++) {
            value ^= str.charAt(i);
            value += (value << 1) + (value << 4) + (value << 7) + (value << 8) + (value << 24);
        }

        return value;
    }

    public static int hash(String str) {
        return hash(str, 0);
    }

    /** Base 32, minúsculas, sin signo. */
    public static String hashToString(int hash) {
        return Integer.toUnsignedString(hash, 32);
    }

    public static String hashString(String str) {
        return hashToString(hash(str));
    }
}
