package com.simpla.dictamen.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns normalized dictamen lines into a typed token stream for the operation state machine.
 * A header whose verb sits on the following line yields a single token covering both lines.
 */
public class DictamenTokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(DictamenTokenizer.class);

    private final HeaderClassifier classifier;

    public DictamenTokenizer() {
        this(new HeaderClassifier());
    }

    public DictamenTokenizer(HeaderClassifier classifier) {
        this.classifier = classifier;
    }

    public List<LineToken> tokenize(List<String> lines) {
        List<LineToken> tokens = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);

            if (line.trim().isEmpty()) {
                tokens.add(LineToken.blank(i));
                i++;
                continue;
            }

            Matcher title = DictamenPatterns.TITLE_HEADING.matcher(line);
            if (title.find()) {
                tokens.add(LineToken.title(line.trim(), i, title.group(1).toUpperCase()));
                i++;
                continue;
            }

            if (DictamenPatterns.STRUCTURAL_HEADING.matcher(line).find()) {
                tokens.add(LineToken.structural(line.trim(), i));
                i++;
                continue;
            }

            Optional<HeaderClassifier.HeaderMatch> header = classifier.classify(lines, i);
            if (header.isPresent()) {
                HeaderClassifier.HeaderMatch match = header.get();
                String text = match.getHeaderText();
                if (match.isOperation()) {
                    tokens.add(LineToken.operationHeader(text, i, match.getArticleNumber(),
                            match.getAction(), triggerEnd(text)));
                } else {
                    tokens.add(LineToken.articleHeader(text, i, match.getArticleNumber(), triggerEnd(text)));
                }
                i = match.getNextIndex();
                continue;
            }

            String text = line.trim();
            int triggerEnd = triggerEnd(text);
            tokens.add(triggerEnd >= 0 ? LineToken.trigger(text, i, triggerEnd) : LineToken.plain(text, i));
            i++;
        }

        LOG.debug("Tokenized {} lines into {} tokens", lines.size(), tokens.size());
        return tokens;
    }

    private static int triggerEnd(String text) {
        Matcher trigger = DictamenPatterns.TRIGGER.matcher(text);
        return trigger.find() ? trigger.end() : -1;
    }
}
