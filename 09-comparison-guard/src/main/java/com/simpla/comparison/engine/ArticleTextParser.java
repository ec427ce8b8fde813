package com.simpla.comparison.engine;

import com.simpla.comparison.model.Inciso;
import com.simpla.dictamen.lexer.DictamenPatterns;
import com.simpla.dictamen.model.ArticleNumber;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits replacement text captured from a dictamen into the parts of a law article:
 * "ARTÍCULO 2°.- Ámbito de aplicación. La vigencia..." gives title "Ámbito de aplicación"
 * and body "La vigencia...". Lines opening with "a)", "b)" become incisos.
 */
public class ArticleTextParser {

    static final int MAX_TITLE_LENGTH = 120;

    private static final Pattern INCISO_LINE = Pattern.compile("^\\s*([a-zñ])\\)\\s+(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern TITLE_END = Pattern.compile("\\.\\s+");
    private static final Pattern MARKER_ANYWHERE = Pattern.compile(
            "(?m)^[\\s\"“'«]*ART[ÍI]CULO\\s+(" + DictamenPatterns.ARTICLE_NUMBER + ")\\s*[°º]?\\s*[.\\-–—]+\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final String QUOTES = "\"“”'«»";

    public static final class ParsedText {
        private final String number;
        private final String title;
        private final String body;
        private final List<Inciso> incisos;

        ParsedText(String number, String title, String body, List<Inciso> incisos) {
            this.number = number;
            this.title = title;
            this.body = body;
            this.incisos = incisos;
        }

        /** Article number stated at the head of the text, or null. */
        public String getNumber() {
            return number;
        }

        public String getTitle() {
            return title;
        }

        public String getBody() {
            return body;
        }

        public List<Inciso> getIncisos() {
            return incisos;
        }
    }

    public ParsedText parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return new ParsedText(null, "", "", new ArrayList<>());
        }
        String remaining = stripQuotes(text.trim());
        String number = null;
        Matcher marker = MARKER_ANYWHERE.matcher(remaining);
        if (marker.lookingAt()) {
            number = ArticleNumber.normalize(marker.group(1));
            remaining = remaining.substring(marker.end());
        }

        List<String> bodyLines = new ArrayList<>();
        List<Inciso> incisos = new ArrayList<>();
        for (String line : remaining.split("\n")) {
            Matcher inciso = INCISO_LINE.matcher(line);
            if (inciso.matches()) {
                incisos.add(new Inciso(inciso.group(1).toLowerCase(), stripQuotes(inciso.group(2).trim())));
            } else if (!incisos.isEmpty() && !line.trim().isEmpty()) {
                // continuation of the previous inciso
                Inciso last = incisos.get(incisos.size() - 1);
                last.setText(last.getText() + " " + stripQuotes(line.trim()));
            } else {
                bodyLines.add(line);
            }
        }
        String body = String.join("\n", bodyLines).trim();

        String title = "";
        if (number != null) {
            Matcher end = TITLE_END.matcher(body);
            if (end.find() && end.start() <= MAX_TITLE_LENGTH && !body.substring(end.end()).trim().isEmpty()
                    && !body.substring(0, end.start()).contains("\n")) {
                title = body.substring(0, end.start()).trim();
                body = body.substring(end.end()).trim();
            }
        }
        return new ParsedText(number, title, stripQuotes(body), incisos);
    }

    /**
     * Cuts a text that transcribes several articles ("ARTÍCULO 10.- ... ARTÍCULO 16.- ...") into one
     * segment per article number, in order. A text without markers yields an empty map.
     */
    public Map<String, String> splitByArticle(String text) {
        Map<String, String> segments = new LinkedHashMap<>();
        if (text == null) {
            return segments;
        }
        Matcher marker = MARKER_ANYWHERE.matcher(text);
        List<Integer> starts = new ArrayList<>();
        List<String> numbers = new ArrayList<>();
        while (marker.find()) {
            starts.add(marker.start());
            numbers.add(ArticleNumber.normalize(marker.group(1)));
        }
        for (int i = 0; i < starts.size(); i++) {
            int from = starts.get(i);
            int to = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            segments.putIfAbsent(numbers.get(i), text.substring(from, to).trim());
        }
        return segments;
    }

    private static String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && QUOTES.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && QUOTES.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end).trim();
    }
}
