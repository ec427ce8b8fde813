package com.simpla.dictamen.util;

import java.util.Locale;

/**
 * Title and chapter numbers show up both as Roman numerals ("VIII") and digits ("8").
 */
public final class RomanNumerals {

    private RomanNumerals() {}

    /**
     * @return the numeric value of a Roman numeral or decimal string, or -1 if it is neither
     */
    public static int toInt(String value) {
        if (value == null) {
            return -1;
        }
        String s = value.trim().toUpperCase(Locale.ROOT);
        if (s.isEmpty()) {
            return -1;
        }
        if (s.chars().allMatch(Character::isDigit)) {
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        int total = 0;
        int previous = 0;
        for (int i = s.length() - 1; i >= 0; i--) {
            int current = valueOf(s.charAt(i));
            if (current < 0) {
                return -1;
            }
            if (current < previous) {
                total -= current;
            } else {
                total += current;
                previous = current;
            }
        }
        return total;
    }

    /**
     * Compares two structural numbers, so "VIII", "viii" and "8" are the same chapter.
     */
    public static boolean sameNumber(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        int left = toInt(a);
        int right = toInt(b);
        if (left > 0 && right > 0) {
            return left == right;
        }
        return a.trim().equalsIgnoreCase(b.trim());
    }

    private static int valueOf(char c) {
        switch (c) {
            case 'I': return 1;
            case 'V': return 5;
            case 'X': return 10;
            case 'L': return 50;
            case 'C': return 100;
            case 'D': return 500;
            case 'M': return 1000;
            default: return -1;
        }
    }
}
