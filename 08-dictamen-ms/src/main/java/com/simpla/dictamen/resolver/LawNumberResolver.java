package com.simpla.dictamen.resolver;

import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.lexer.DictamenPatterns;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.util.SpanishText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which statute an operation amends when a dictamen touches several laws.
 * Only the header and intermediate text are searched: the replacement text quotes other laws freely.
 */
public class LawNumberResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LawNumberResolver.class);

    public static final String UNKNOWN = "UNKNOWN";

    private static final int MIN_DIGITS = 4;

    private static final Pattern LAW_MENTION = Pattern.compile(
            "(?<![\\p{L}])(?:decreto[\\s-]+)?ley\\s+"
                    + "(?:de\\s+[\\p{L}\\s]{1,80}?\\s+)?"
                    + "(?:n(?:[°º]|ro\\.?|[úu]m(?:ero)?\\.?)?\\s*)?"
                    + "([0-9]{1,3}(?:\\.[0-9]{3})+|[0-9]{4,6})(?:/[0-9]{2,4})?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern CONTEXT_CUE = Pattern.compile("(?<![\\p{L}])(?:de la|esta) ley(?![\\p{L}])");

    private final HeuristicsConfig config;
    private final Map<Pattern, String> aliases = new LinkedHashMap<>();
    private final List<String> crossReferencePhrases = new ArrayList<>();

    public LawNumberResolver(HeuristicsConfig config) {
        this.config = config;
        for (Map.Entry<String, String> alias : config.getLawAliases().entrySet()) {
            aliases.put(Pattern.compile(alias.getKey(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    alias.getValue());
        }
        for (String phrase : config.getCrossReferencePhrases()) {
            crossReferencePhrases.add(SpanishText.fold(phrase));
        }
    }

    /**
     * Sets the law number unless one was already assigned (for instance by a manual correction).
     */
    public void resolve(Operation operation) {
        if (operation.getLawNumber() != null && !operation.getLawNumber().isEmpty()) {
            return;
        }
        String law = resolveLaw(searchText(operation), operation.getTitleContext());
        if (UNKNOWN.equals(law)) {
            LOG.warn("Could not resolve the law amended by dictamen article {}", operation.getDictamenArticle());
        }
        operation.setLawNumber(law);
    }

    String resolveLaw(String text, String titleContext) {
        List<Mention> mentions = findMentions(text);

        Matcher verb = DictamenPatterns.OPERATIVE_VERB.matcher(text);
        int verbEnd = verb.find() ? verb.end() : 0;
        for (Mention mention : mentions) {
            int distance = mention.start - verbEnd;
            if (!mention.crossReference && distance >= 0 && distance <= config.getLawProximityWindow()) {
                return mention.number;
            }
        }

        for (Map.Entry<Pattern, String> alias : aliases.entrySet()) {
            if (alias.getKey().matcher(text).find()) {
                return alias.getValue();
            }
        }

        for (Mention mention : mentions) {
            if (!mention.crossReference) {
                return mention.number;
            }
        }

        if (titleContext != null && CONTEXT_CUE.matcher(SpanishText.fold(text)).find()) {
            String inferred = config.getTitleContextLaws().get(titleContext);
            if (inferred != null) {
                return inferred;
            }
        }
        return UNKNOWN;
    }

    /**
     * Canonical form of a law number: "20.744" and "20744/76" both become "20744".
     * @return the digits, or null if fewer than four remain
     */
    public static String normalize(String lawNumber) {
        if (lawNumber == null) {
            return null;
        }
        String digits = lawNumber.trim().replaceAll("/[0-9]{2,4}$", "").replaceAll("[^0-9]", "");
        return digits.length() >= MIN_DIGITS ? digits : null;
    }

    private List<Mention> findMentions(String text) {
        List<Mention> mentions = new ArrayList<>();
        Matcher m = LAW_MENTION.matcher(text);
        while (m.find()) {
            String number = normalize(m.group(1));
            if (number != null) {
                mentions.add(new Mention(number, m.start(), isCrossReference(text, m.start())));
            }
        }
        return mentions;
    }

    private boolean isCrossReference(String text, int mentionStart) {
        int from = Math.max(0, mentionStart - config.getCrossReferenceWindow());
        String before = SpanishText.fold(text.substring(from, mentionStart));
        for (String phrase : crossReferencePhrases) {
            if (before.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static String searchText(Operation operation) {
        StringBuilder text = new StringBuilder(operation.getHeaderText() == null ? "" : operation.getHeaderText());
        for (String line : operation.getIntermediateText()) {
            text.append(' ').append(line);
        }
        return text.toString();
    }

    private static final class Mention {
        final String number;
        final int start;
        final boolean crossReference;

        Mention(String number, int start, boolean crossReference) {
            this.number = number;
            this.start = start;
            this.crossReference = crossReference;
        }
    }
}
