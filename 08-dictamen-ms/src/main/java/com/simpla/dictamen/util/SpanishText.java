package com.simpla.dictamen.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SpanishText {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Locale ES = new Locale("es", "AR");

    private SpanishText() {}

    /**
     * Lower-cases and strips accents so "Sustitúyese" and "sustituyese" compare equal.
     * The ñ is folded to n as well.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("").toLowerCase(ES);
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
