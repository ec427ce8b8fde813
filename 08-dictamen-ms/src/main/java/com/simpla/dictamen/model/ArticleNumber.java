package com.simpla.dictamen.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Legal article number: numeric base plus optional Latin ordinal suffix ("29", "29 bis", "14 ter").
 * Numbers that do not start with digits (synthetic ids, "S/N") are kept verbatim and sort last.
 */
public final class ArticleNumber implements Comparable<ArticleNumber> {

    public static final List<String> SUFFIXES = Collections.unmodifiableList(Arrays.asList(
            "bis", "ter", "quater", "quinquies", "sexies", "septies", "octies", "nonies", "decies"));

    public static final String SUFFIX_REGEX = "(?:" + String.join("|", SUFFIXES) + ")";

    private static final Pattern PATTERN = Pattern.compile(
            "^\\s*(\\d+)\\s*[°º]?\\s*(" + SUFFIX_REGEX + ")?(?![\\p{L}]).*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final String raw;
    private final int base;
    private final String suffix;

    private ArticleNumber(String raw, int base, String suffix) {
        this.raw = raw;
        this.base = base;
        this.suffix = suffix;
    }

    public static ArticleNumber parse(String value) {
        String raw = value == null ? "" : value.trim();
        Matcher m = PATTERN.matcher(raw);
        if (m.matches()) {
            try {
                int base = Integer.parseInt(m.group(1));
                String suffix = m.group(2) != null ? m.group(2).toLowerCase(Locale.ROOT) : "";
                return new ArticleNumber(raw, base, suffix);
            } catch (NumberFormatException e) {
                return new ArticleNumber(raw, -1, "");
            }
        }
        return new ArticleNumber(raw, -1, "");
    }

    /**
     * Canonical key used to match dictamen targets against law articles: "2°bis" and "2 Bis" both become "2 bis".
     */
    public static String normalize(String value) {
        return parse(value).canonical();
    }

    public String canonical() {
        if (!isNumeric()) {
            return raw;
        }
        return suffix.isEmpty() ? String.valueOf(base) : base + " " + suffix;
    }

    public boolean isNumeric() {
        return base >= 0;
    }

    public int getBase() {
        return base;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * 0 for a plain number, 1 for bis, 2 for ter and so on.
     */
    public int getSuffixRank() {
        return suffix.isEmpty() ? 0 : SUFFIXES.indexOf(suffix) + 1;
    }

    public String getRaw() {
        return raw;
    }

    @Override
    public int compareTo(ArticleNumber other) {
        if (isNumeric() != other.isNumeric()) {
            return isNumeric() ? -1 : 1;
        }
        if (!isNumeric()) {
            return raw.compareTo(other.raw);
        }
        int byBase = Integer.compare(base, other.base);
        if (byBase != 0) {
            return byBase;
        }
        return Integer.compare(getSuffixRank(), other.getSuffixRank());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArticleNumber)) return false;
        return canonical().equals(((ArticleNumber) o).canonical());
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonical());
    }

    @Override
    public String toString() {
        return canonical();
    }
}
