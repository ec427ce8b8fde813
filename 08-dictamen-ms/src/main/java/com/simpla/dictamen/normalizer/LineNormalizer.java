package com.simpla.dictamen.normalizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans the raw lines extracted from a dictamen PDF: page numbers and "Página N" footers are
 * dropped, horizontal whitespace is collapsed and words broken with a trailing hyphen are rejoined.
 * Relative line order is preserved.
 */
public class LineNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(LineNormalizer.class);

    private static final Pattern PAGE_NUMBER = Pattern.compile("^\\s*\\d+\\s*$");
    private static final Pattern PAGE_FOOTER = Pattern.compile("^\\s*p[áa]gina\\s+\\d+.*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]+");

    public List<String> normalize(List<String> rawLines) {
        List<String> result = new ArrayList<>();
        int dropped = 0;
        int joined = 0;

        for (String raw : rawLines) {
            String line = raw == null ? "" : raw;
            if (PAGE_NUMBER.matcher(line).matches() || PAGE_FOOTER.matcher(line).matches()) {
                dropped++;
                continue;
            }
            line = HORIZONTAL_SPACE.matcher(line).replaceAll(" ").stripTrailing();

            if (!result.isEmpty() && continuesBrokenWord(result.get(result.size() - 1), line)) {
                String previous = result.remove(result.size() - 1);
                result.add(previous.substring(0, previous.length() - 1) + line.trim());
                joined++;
                continue;
            }
            result.add(line);
        }

        LOG.debug("Normalized {} raw lines into {} ({} dropped, {} joined)",
                rawLines.size(), result.size(), dropped, joined);
        return result;
    }

    /**
     * "obliga-" followed by "ciones" is one word; "ARTÍCULO 5-" followed by "Sustitúyese" is not.
     */
    static boolean continuesBrokenWord(String previous, String next) {
        if (previous.length() < 2 || !previous.endsWith("-")) {
            return false;
        }
        if (!Character.isLetter(previous.charAt(previous.length() - 2))) {
            return false;
        }
        String continuation = next.trim();
        return !continuation.isEmpty() && Character.isLowerCase(continuation.charAt(0));
    }
}
