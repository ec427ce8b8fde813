package com.simpla.dictamen.resolver;

import com.simpla.dictamen.lexer.DictamenPatterns;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.ArticleNumber;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Resolves what a sealed operation acts on. Rules are tried from most to least specific and the
 * first hit wins; the number at the head of the captured statute text beats the one in the header.
 */
public class TargetResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TargetResolver.class);

    public void resolve(Operation operation) {
        if (operation.isTargetForced() || operation.getTarget() != null) {
            return;
        }
        Action action = operation.getAction();
        String tail = headerTail(operation.getHeaderText());
        String scope = withIntermediate(tail, operation.getIntermediateText());

        if (action == Action.DEROGATES) {
            Matcher chapter = DictamenPatterns.CHAPTER_DEROGATION.matcher(scope);
            if (chapter.find()) {
                operation.setTarget(Target.chapter(chapter.group(1), chapter.group(2)));
                return;
            }
        }

        Matcher inciso = DictamenPatterns.INCISO_OF_ARTICLE.matcher(scope);
        if (inciso.find()) {
            operation.setTarget(Target.inciso(inciso.group(1), inciso.group(2)));
            return;
        }

        List<String> listed = listedArticles(scope);
        if (listed.size() > 1) {
            operation.setListedArticles(listed);
            operation.setTarget(Target.article(listed.get(0)));
            return;
        }

        if (operation.hasReplacementText()) {
            Matcher body = DictamenPatterns.BODY_ARTICLE_NUMBER.matcher(operation.getReplacementText());
            if (body.find()) {
                operation.setTarget(Target.article(body.group(1)));
                return;
            }
        }

        if (action == Action.INCORPORATES) {
            Matcher incorporation = DictamenPatterns.INCORPORATION_AS_ARTICLE.matcher(scope);
            if (incorporation.find()) {
                operation.setTarget(Target.article(incorporation.group(1)));
                return;
            }
        }

        Matcher afterVerb = DictamenPatterns.ARTICLE_AFTER_VERB.matcher(scope);
        if (afterVerb.find()) {
            operation.setTarget(Target.article(afterVerb.group(1)));
            return;
        }

        Matcher any = DictamenPatterns.ANY_ARTICLE.matcher(tail);
        if (any.find()) {
            operation.setTarget(Target.article(any.group(1)));
            return;
        }

        if (action == Action.DEROGATES) {
            // indistinguishable from a target lost to a parsing gap, so it is never trusted silently
            operation.setTarget(Target.wholeLaw());
            operation.setRequiresReview(true);
            LOG.warn("Dictamen article {} derogates without a target; assuming whole law, flagged for review",
                    operation.getDictamenArticle());
            return;
        }

        LOG.debug("No target found for dictamen article {}", operation.getDictamenArticle());
    }

    static String headerTail(String headerText) {
        if (headerText == null) {
            return "";
        }
        Matcher shape = DictamenPatterns.HEADER_SHAPE.matcher(headerText);
        String tail = shape.matches() ? shape.group(2) : headerText.trim();
        // statute text transcribed after the trigger is body, never header
        Matcher trigger = DictamenPatterns.TRIGGER.matcher(tail);
        return trigger.find() ? tail.substring(0, trigger.end()).trim() : tail;
    }

    private static String withIntermediate(String tail, List<String> intermediate) {
        if (intermediate == null || intermediate.isEmpty()) {
            return tail;
        }
        return tail + " " + String.join(" ", intermediate);
    }

    static List<String> listedArticles(String text) {
        Matcher list = DictamenPatterns.ARTICLE_LIST.matcher(text);
        if (!list.find()) {
            return new ArrayList<>();
        }
        Set<String> numbers = new LinkedHashSet<>();
        Matcher number = DictamenPatterns.LISTED_NUMBER.matcher(list.group(1));
        while (number.find()) {
            numbers.add(ArticleNumber.normalize(number.group(1)));
        }
        return new ArrayList<>(numbers);
    }
}
