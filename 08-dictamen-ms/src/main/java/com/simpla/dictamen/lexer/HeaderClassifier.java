package com.simpla.dictamen.lexer;

import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.ArticleNumber;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Tells the dictamen's own operative articles ("ARTÍCULO 5- Sustitúyese ...") apart from article
 * headers of the law text being transcribed ("ARTÍCULO 30.- El trabajador ...").
 */
public class HeaderClassifier {

    /** Blank lines skipped when the verb of an empty-tailed header is on a following line. */
    public static final int MAX_HEADER_LOOKAHEAD = 3;

    /**
     * Result for a header-shaped line. {@code nextIndex} is the first line not consumed by the header.
     */
    public static final class HeaderMatch {
        private final boolean operation;
        private final String headerText;
        private final String articleNumber;
        private final Action action;
        private final int nextIndex;

        HeaderMatch(boolean operation, String headerText, String articleNumber, Action action, int nextIndex) {
            this.operation = operation;
            this.headerText = headerText;
            this.articleNumber = articleNumber;
            this.action = action;
            this.nextIndex = nextIndex;
        }

        public boolean isOperation() {
            return operation;
        }

        public String getHeaderText() {
            return headerText;
        }

        public String getArticleNumber() {
            return articleNumber;
        }

        public Action getAction() {
            return action;
        }

        public int getNextIndex() {
            return nextIndex;
        }
    }

    /**
     * @return empty when the line does not have header shape
     */
    public Optional<HeaderMatch> classify(List<String> lines, int index) {
        String line = lines.get(index);
        Matcher shape = DictamenPatterns.HEADER_SHAPE.matcher(line);
        if (!shape.matches()) {
            return Optional.empty();
        }
        String number = ArticleNumber.normalize(shape.group(1));
        String tail = shape.group(2) == null ? "" : shape.group(2).trim();

        Action action = findAction(tail);
        if (action != null) {
            return Optional.of(new HeaderMatch(true, headerText(number, tail), number, action, index + 1));
        }

        if (tail.isEmpty()) {
            int next = nextNonBlank(lines, index + 1);
            if (next >= 0 && !DictamenPatterns.HEADER_SHAPE.matcher(lines.get(next)).matches()) {
                String continuation = lines.get(next).trim();
                Action deferred = findAction(continuation);
                if (deferred != null) {
                    return Optional.of(new HeaderMatch(true, headerText(number, continuation), number, deferred, next + 1));
                }
            }
        }
        return Optional.of(new HeaderMatch(false, line.trim(), number, null, index + 1));
    }

    static Action findAction(String text) {
        Matcher verb = DictamenPatterns.OPERATIVE_VERB.matcher(text);
        return verb.find() ? Action.fromVerb(verb.group(1)) : null;
    }

    private static String headerText(String number, String tail) {
        return ("ARTÍCULO " + number + "- " + tail).trim();
    }

    private static int nextNonBlank(List<String> lines, int from) {
        int skipped = 0;
        for (int i = from; i < lines.size(); i++) {
            if (!lines.get(i).trim().isEmpty()) {
                return i;
            }
            if (++skipped > MAX_HEADER_LOOKAHEAD) {
                return -1;
            }
        }
        return -1;
    }
}
