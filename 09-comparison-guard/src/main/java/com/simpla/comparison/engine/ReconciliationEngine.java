package com.simpla.comparison.engine;

import com.simpla.comparison.model.Article;
import com.simpla.comparison.model.Chapter;
import com.simpla.comparison.model.ComparedArticle;
import com.simpla.comparison.model.ComparedChapter;
import com.simpla.comparison.model.ComparedLaw;
import com.simpla.comparison.model.ComparedTitle;
import com.simpla.comparison.model.ComparisonMetadata;
import com.simpla.comparison.model.ComparisonTree;
import com.simpla.comparison.model.Disposition;
import com.simpla.comparison.model.Inciso;
import com.simpla.comparison.model.IssueType;
import com.simpla.comparison.model.Law;
import com.simpla.comparison.model.ReconciliationIssue;
import com.simpla.comparison.model.Title;
import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.config.HeuristicsConfig.ChapterFallback;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.ArticleNumber;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import com.simpla.dictamen.resolver.LawNumberResolver;
import com.simpla.dictamen.util.RomanNumerals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the operations of a dictamen to one law and produces the comparison tree.
 * <p>
 * The engine keeps no state between calls: {@link #reconcile(Law, List)} is a pure function of the
 * law and the operations, and the input law is never modified. Operations are applied in document
 * order, so when two of them touch the same article the later one wins.
 */
public class ReconciliationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationEngine.class);

    public static final String CHAPTER_ACTION = "derógase (capítulo completo)";

    private final HeuristicsConfig config;
    private final ArticleTextParser textParser = new ArticleTextParser();
    private final InsertionPointLocator locator = new InsertionPointLocator();

    public ReconciliationEngine(HeuristicsConfig config) {
        this.config = config;
    }

    public ComparisonTree reconcile(Law law, List<Operation> operations) {
        return new Reconciliation(law, operations).run();
    }

    private static final class ArticleChange {
        final Operation operation;
        final Disposition disposition;
        final String text;

        ArticleChange(Operation operation, Disposition disposition, String text) {
            this.operation = operation;
            this.disposition = disposition;
            this.text = text;
        }
    }

    private static final class Incorporation {
        final Operation operation;
        final String text;

        Incorporation(Operation operation, String text) {
            this.operation = operation;
            this.text = text;
        }
    }

    /**
     * State of a single {@code reconcile} call.
     */
    private final class Reconciliation {
        private final Law law;
        private final List<Operation> operations;
        private final String lawNumber;

        private final Set<String> existingNumbers = new HashSet<>();
        private final Map<String, ArticleChange> articleChanges = new LinkedHashMap<>();
        private final Map<String, List<Operation>> incisoChanges = new LinkedHashMap<>();
        private final Map<String, Incorporation> incorporations = new LinkedHashMap<>();
        private final List<Operation> chapterDerogations = new ArrayList<>();
        private final List<Operation> wholeLawDerogations = new ArrayList<>();
        private final Map<String, Operation> missingArticles = new LinkedHashMap<>();

        private final Map<Chapter, Operation> derogatedChapters = new IdentityHashMap<>();
        private final Map<Chapter, ChapterFallback> emptyChapterFallbacks = new IdentityHashMap<>();
        // first derogation of a missing chapter drives the synthesis; repeats are only marked applied with it
        private final Map<ChapterFallback, List<Operation>> missingChapterFallbacks = new LinkedHashMap<>();
        private final Set<String> derogatedChapterNumbers = new LinkedHashSet<>();

        private final Set<Operation> applied = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<ReconciliationIssue> issues = new ArrayList<>();

        Reconciliation(Law law, List<Operation> operations) {
            this.law = law;
            this.operations = operations;
            String normalized = LawNumberResolver.normalize(law.getNumber());
            this.lawNumber = normalized != null ? normalized : law.getNumber();
        }

        ComparisonTree run() {
            collectExistingNumbers();
            for (Operation operation : operations) {
                index(operation);
            }
            reportMissingArticles();
            resolveChapterDerogations();

            ComparedLaw output = traverse();
            if (wholeLawDerogations.isEmpty()) {
                synthesizeMissingChapters(output);
                insertIncorporations(output);
            }
            assignDispositions(output);

            ComparisonMetadata metadata = buildMetadata(output);
            LOG.info("Reconciled law {}: {} substituted, {} incorporated, {} derogated, {} of {} operations applied",
                    lawNumber, metadata.getSubstitutions(), metadata.getIncorporations(),
                    metadata.getDerogations(), metadata.getAppliedOperations(), operations.size());
            return new ComparisonTree(output, metadata);
        }

        private void collectExistingNumbers() {
            for (Title title : law.getTitles()) {
                collectScope(title.getArticles(), "título " + title.getNumber());
                for (Chapter chapter : title.getChapters()) {
                    collectScope(chapter.getArticles(),
                            "título " + title.getNumber() + ", capítulo " + chapter.getNumber());
                }
            }
        }

        private void collectScope(List<Article> articles, String scope) {
            Set<String> seen = new HashSet<>();
            for (Article article : articles) {
                String key = ArticleNumber.normalize(article.getNumber());
                existingNumbers.add(key);
                if (!seen.add(key)) {
                    issues.add(new ReconciliationIssue(IssueType.DUPLICATE_ARTICLE_NUMBER, null, lawNumber, key,
                            "Article number repeated in " + scope));
                }
            }
        }

        // Indexing

        private void index(Operation operation) {
            Target target = operation.getTarget();
            Action action = operation.getAction();
            if (target == null) {
                issue(IssueType.UNRESOLVED_TARGET, operation, null, "Operation has no target");
                return;
            }
            if (action == null) {
                issue(IssueType.UNSUPPORTED_TARGET, operation, target.toString(), "Operation has no action");
                return;
            }
            switch (target.getKind()) {
                case WHOLE_LAW:
                    if (action.isDerogation()) {
                        wholeLawDerogations.add(operation);
                    } else {
                        issue(IssueType.UNSUPPORTED_TARGET, operation, target.toString(),
                                "Only derogations can target the whole law");
                    }
                    break;
                case CHAPTER:
                    if (action.isDerogation()) {
                        chapterDerogations.add(operation);
                    } else {
                        issue(IssueType.UNSUPPORTED_TARGET, operation, target.toString(),
                                "Only derogations can target a chapter");
                    }
                    break;
                case INCISO:
                    String parent = ((Target.Inciso) target).getParentArticle();
                    if (!existingNumbers.contains(parent)) {
                        missingArticles.put(parent, operation);
                    } else {
                        incisoChanges.computeIfAbsent(parent, k -> new ArrayList<>()).add(operation);
                    }
                    break;
                default:
                    indexArticle(operation);
            }
        }

        private void indexArticle(Operation operation) {
            Action action = operation.getAction();
            List<String> numbers = operation.affectedArticles();
            Map<String, String> segments = textParser.splitByArticle(operation.getReplacementText());

            if (action == Action.INCORPORATES || action == Action.CREATES) {
                if (segments.size() >= 2) {
                    numbers = new ArrayList<>(segments.keySet());
                }
                for (String number : numbers) {
                    if (existingNumbers.contains(number)) {
                        issue(IssueType.INCORPORATION_TARGET_EXISTS, operation, number,
                                "Article already exists in the law");
                        continue;
                    }
                    String text = textFor(segments, number, operation.getReplacementText());
                    if (text == null) {
                        issue(IssueType.MISSING_REPLACEMENT_TEXT, operation, number, "No text to incorporate");
                        continue;
                    }
                    incorporations.put(number, new Incorporation(operation, text));
                }
                return;
            }

            for (String number : numbers) {
                if (!existingNumbers.contains(number)) {
                    missingArticles.put(number, operation);
                } else if (action.isDerogation()) {
                    articleChanges.put(number, new ArticleChange(operation, Disposition.DEROGATED, null));
                } else if (action.isReplacement()) {
                    String text = textFor(segments, number, operation.getReplacementText());
                    if (text == null) {
                        issue(IssueType.MISSING_REPLACEMENT_TEXT, operation, number, "No replacement text captured");
                    } else {
                        articleChanges.put(number, new ArticleChange(operation, Disposition.SUBSTITUTED, text));
                    }
                } else {
                    issue(IssueType.UNSUPPORTED_TARGET, operation, number, "Action not applicable to an article");
                }
            }
        }

        /**
         * Text that belongs to one article of a (possibly multi-article) replacement.
         */
        private String textFor(Map<String, String> segments, String number, String fullText) {
            String segment = segments.get(number);
            if (segment != null) {
                return segment;
            }
            if (segments.size() >= 2 || fullText == null || fullText.trim().isEmpty()) {
                return null;
            }
            return fullText;
        }

        private void reportMissingArticles() {
            if (!wholeLawDerogations.isEmpty()) {
                return;
            }
            for (Map.Entry<String, Operation> missing : missingArticles.entrySet()) {
                issue(IssueType.ARTICLE_NOT_FOUND_IN_LAW, missing.getValue(), missing.getKey(),
                        "Article not present in law " + lawNumber);
            }
        }

        // Chapter derogations

        private void resolveChapterDerogations() {
            for (Operation operation : chapterDerogations) {
                Target.Chapter target = (Target.Chapter) operation.getTarget();
                List<Title> titles = new ArrayList<>();
                List<Chapter> matches = new ArrayList<>();
                for (Title title : law.getTitles()) {
                    if (target.getTitle() != null && !RomanNumerals.sameNumber(title.getNumber(), target.getTitle())) {
                        continue;
                    }
                    for (Chapter chapter : title.getChapters()) {
                        if (RomanNumerals.sameNumber(chapter.getNumber(), target.getNumber())) {
                            titles.add(title);
                            matches.add(chapter);
                        }
                    }
                }

                if (matches.size() > 1) {
                    issue(IssueType.CHAPTER_NOT_FOUND, operation, target.toString(),
                            "Chapter number is ambiguous: present in " + matches.size() + " titles");
                    continue;
                }
                if (matches.isEmpty()) {
                    ChapterFallback fallback = config.findChapterFallback(lawNumber, target.getNumber(), target.getTitle());
                    if (fallback == null) {
                        issue(IssueType.CHAPTER_NOT_FOUND, operation, target.toString(), "Chapter not present in the law");
                    } else if (missingChapterFallbacks.containsKey(fallback)) {
                        List<Operation> derogations = missingChapterFallbacks.get(fallback);
                        LOG.info("Chapter {} of law {} already derogated by dictamen article {}",
                                target.getNumber(), lawNumber, derogations.get(0).getDictamenArticle());
                        derogations.add(operation);
                    } else {
                        missingChapterFallbacks.put(fallback, new ArrayList<>(Collections.singletonList(operation)));
                        derogatedChapterNumbers.add(target.getNumber());
                    }
                    continue;
                }

                Chapter chapter = matches.get(0);
                derogatedChapters.put(chapter, operation);
                derogatedChapterNumbers.add(target.getNumber());
                applied.add(operation);
                if (chapter.getArticles().isEmpty() && wholeLawDerogations.isEmpty()) {
                    ChapterFallback fallback = config.findChapterFallback(
                            lawNumber, chapter.getNumber(), titles.get(0).getNumber());
                    if (fallback != null) {
                        emptyChapterFallbacks.put(chapter, fallback);
                    } else {
                        LOG.warn("Derogated chapter {} of law {} has no articles", chapter.getNumber(), lawNumber);
                        issue(IssueType.EMPTY_CHAPTER_DEROGATED, operation, target.toString(),
                                "Derogated chapter has no articles in the law tree");
                    }
                }
            }
        }

        private List<ComparedArticle> synthesize(ChapterFallback fallback, String chapterNumber, Operation operation) {
            List<ComparedArticle> articles = new ArrayList<>();
            for (int i = 0; i < fallback.getTexts().size(); i++) {
                ComparedArticle article = new ComparedArticle();
                article.setNumber("CAP_" + chapterNumber + "_ART_" + (i + 1));
                article.setText(fallback.getTexts().get(i));
                article.setSynthetic(Boolean.TRUE);
                derogate(article, operation, CHAPTER_ACTION);
                articles.add(article);
            }
            return articles;
        }

        private void synthesizeMissingChapters(ComparedLaw output) {
            for (Map.Entry<ChapterFallback, List<Operation>> entry : missingChapterFallbacks.entrySet()) {
                ChapterFallback fallback = entry.getKey();
                ComparedTitle title = null;
                for (ComparedTitle candidate : output.getTitles()) {
                    if (RomanNumerals.sameNumber(candidate.getNumber(), fallback.getTitle())) {
                        title = candidate;
                        break;
                    }
                }
                if (title == null) {
                    title = new ComparedTitle(fallback.getTitle(), fallback.getTitleName());
                    output.getTitles().add(title);
                }
                ComparedChapter chapter = new ComparedChapter(fallback.getChapter(), fallback.getChapterName());
                chapter.setSynthetic(Boolean.TRUE);
                chapter.setDisposition(Disposition.DEROGATED);
                chapter.getArticles().addAll(synthesize(fallback, fallback.getChapter(), entry.getValue().get(0)));
                title.getChapters().add(chapter);
                applied.addAll(entry.getValue());
                LOG.info("Synthesized chapter {} under title {} of law {}", fallback.getChapter(),
                        fallback.getTitle(), lawNumber);
            }
        }

        // Traversal

        private ComparedLaw traverse() {
            ComparedLaw output = new ComparedLaw(law.getNumber(), law.getName());
            for (Title title : law.getTitles()) {
                ComparedTitle comparedTitle = new ComparedTitle(title.getNumber(), title.getName());
                for (Article article : title.getArticles()) {
                    comparedTitle.getArticles().add(compare(article, null));
                }
                for (Chapter chapter : title.getChapters()) {
                    Operation chapterOperation = derogatedChapters.get(chapter);
                    ComparedChapter comparedChapter = new ComparedChapter(chapter.getNumber(), chapter.getName());
                    for (Article article : chapter.getArticles()) {
                        comparedChapter.getArticles().add(compare(article, chapterOperation));
                    }
                    ChapterFallback fallback = emptyChapterFallbacks.get(chapter);
                    if (fallback != null) {
                        comparedChapter.getArticles().addAll(synthesize(fallback, chapter.getNumber(), chapterOperation));
                    }
                    if (chapterOperation != null) {
                        comparedChapter.setDisposition(Disposition.DEROGATED);
                    }
                    comparedTitle.getChapters().add(comparedChapter);
                }
                output.getTitles().add(comparedTitle);
            }
            return output;
        }

        private ComparedArticle compare(Article source, Operation chapterOperation) {
            ComparedArticle article = ComparedArticle.of(source);
            String key = ArticleNumber.normalize(source.getNumber());

            if (!wholeLawDerogations.isEmpty()) {
                Operation first = wholeLawDerogations.get(0);
                derogate(article, first, first.getAction().getVerb());
                return article;
            }
            if (chapterOperation != null) {
                derogate(article, chapterOperation, CHAPTER_ACTION);
                return article;
            }
            ArticleChange change = articleChanges.get(key);
            if (change != null) {
                if (change.disposition == Disposition.DEROGATED) {
                    derogate(article, change.operation, change.operation.getAction().getVerb());
                } else {
                    substitute(article, change);
                }
                return article;
            }
            List<Operation> incisoOperations = incisoChanges.get(key);
            if (incisoOperations != null) {
                applyIncisoChanges(article, incisoOperations);
            }
            return article;
        }

        private void derogate(ComparedArticle article, Operation operation, String action) {
            article.setDisposition(Disposition.DEROGATED);
            article.setAction(action);
            article.setDictamenArticle(operation.getDictamenArticle());
            applied.add(operation);
        }

        private void substitute(ComparedArticle article, ArticleChange change) {
            ArticleTextParser.ParsedText parsed = textParser.parse(change.text);
            article.setOriginalText(article.getText());
            article.setNewText(parsed.getBody().isEmpty() ? change.text.trim() : parsed.getBody());
            if (!parsed.getTitle().isEmpty()) {
                article.setNewTitle(parsed.getTitle());
            }
            if (!parsed.getIncisos().isEmpty()) {
                article.setNewIncisos(parsed.getIncisos());
            }
            article.setDisposition(Disposition.SUBSTITUTED);
            article.setAction(change.operation.getAction().getVerb());
            article.setDictamenArticle(change.operation.getDictamenArticle());
            applied.add(change.operation);
        }

        private void applyIncisoChanges(ComparedArticle article, List<Operation> incisoOperations) {
            List<Inciso> incisos = new ArrayList<>();
            for (Inciso inciso : article.getIncisos()) {
                incisos.add(new Inciso(inciso.getLetter(), inciso.getText()));
            }
            Operation last = null;
            for (Operation operation : incisoOperations) {
                String letter = ((Target.Inciso) operation.getTarget()).getLetter();
                Action action = operation.getAction();
                if (action.isDerogation()) {
                    incisos.removeIf(inciso -> letter.equals(inciso.getLetter()));
                } else {
                    String text = incisoText(operation, letter);
                    if (text == null) {
                        issue(IssueType.MISSING_REPLACEMENT_TEXT, operation, letter + ") del artículo "
                                + article.getNumber(), "No text captured for the inciso");
                        continue;
                    }
                    incisos.removeIf(inciso -> letter.equals(inciso.getLetter()));
                    incisos.add(new Inciso(letter, text));
                }
                applied.add(operation);
                last = operation;
            }
            if (last == null) {
                return;
            }
            incisos.sort(Comparator.comparing(Inciso::getLetter));
            String rendered = render(article.getText(), incisos);
            if (rendered.isEmpty()) {
                // nothing of the article survives
                derogate(article, last, last.getAction().getVerb());
                return;
            }
            article.setOriginalText(article.getText());
            article.setNewIncisos(incisos);
            article.setNewText(rendered);
            article.setDisposition(Disposition.SUBSTITUTED);
            article.setAction(last.getAction().getVerb());
            article.setDictamenArticle(last.getDictamenArticle());
        }

        private String incisoText(Operation operation, String letter) {
            if (!operation.hasReplacementText()) {
                return null;
            }
            ArticleTextParser.ParsedText parsed = textParser.parse(operation.getReplacementText());
            for (Inciso inciso : parsed.getIncisos()) {
                if (letter.equals(inciso.getLetter())) {
                    return inciso.getText();
                }
            }
            return parsed.getBody().isEmpty() ? null : parsed.getBody();
        }

        private String render(String body, List<Inciso> incisos) {
            StringBuilder text = new StringBuilder(body == null ? "" : body.trim());
            for (Inciso inciso : incisos) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(inciso.getLetter()).append(") ").append(inciso.getText());
            }
            return text.toString();
        }

        // Incorporations

        private void insertIncorporations(ComparedLaw output) {
            for (Map.Entry<String, Incorporation> entry : incorporations.entrySet()) {
                Incorporation incorporation = entry.getValue();
                ArticleTextParser.ParsedText parsed = textParser.parse(incorporation.text);

                ComparedArticle article = new ComparedArticle();
                article.setNumber(entry.getKey());
                article.setText("");
                article.setDisposition(Disposition.INCORPORATED);
                if (!parsed.getTitle().isEmpty()) {
                    article.setNewTitle(parsed.getTitle());
                }
                article.setNewText(parsed.getBody().isEmpty() ? incorporation.text.trim() : parsed.getBody());
                if (!parsed.getIncisos().isEmpty()) {
                    article.setNewIncisos(parsed.getIncisos());
                }
                article.setAction(incorporation.operation.getAction().getVerb());
                article.setDictamenArticle(incorporation.operation.getDictamenArticle());

                if (locator.insert(output, article) == null) {
                    issue(IssueType.NO_INSERTION_POINT, incorporation.operation, entry.getKey(),
                            "Law has no title to receive the article");
                } else {
                    applied.add(incorporation.operation);
                }
            }
        }

        // Dispositions and metadata

        private void assignDispositions(ComparedLaw output) {
            boolean wholeLaw = !wholeLawDerogations.isEmpty();
            boolean lawChanged = false;
            for (ComparedTitle title : output.getTitles()) {
                List<ComparedArticle> all = new ArrayList<>(title.getArticles());
                boolean chapterChanged = false;
                for (ComparedChapter chapter : title.getChapters()) {
                    if (wholeLaw) {
                        chapter.setDisposition(Disposition.DEROGATED);
                    } else if (chapter.getDisposition() != Disposition.DEROGATED) {
                        chapter.setDisposition(summarize(chapter.getArticles()));
                    }
                    chapterChanged |= chapter.getDisposition() != Disposition.UNCHANGED;
                    all.addAll(chapter.getArticles());
                }
                Disposition disposition = wholeLaw ? Disposition.DEROGATED : summarize(all);
                if (disposition == Disposition.UNCHANGED && chapterChanged) {
                    disposition = Disposition.SUBSTITUTED;
                }
                title.setDisposition(disposition);
                lawChanged |= disposition != Disposition.UNCHANGED;
            }
            if (wholeLaw) {
                output.setDisposition(Disposition.DEROGATED);
            } else {
                output.setDisposition(lawChanged ? Disposition.SUBSTITUTED : Disposition.UNCHANGED);
            }
        }

        private Disposition summarize(List<ComparedArticle> articles) {
            if (articles.isEmpty()) {
                return Disposition.UNCHANGED;
            }
            boolean allDerogated = true;
            boolean anyChanged = false;
            for (ComparedArticle article : articles) {
                allDerogated &= article.getDisposition() == Disposition.DEROGATED;
                anyChanged |= article.getDisposition() != Disposition.UNCHANGED;
            }
            if (allDerogated) {
                return Disposition.DEROGATED;
            }
            return anyChanged ? Disposition.SUBSTITUTED : Disposition.UNCHANGED;
        }

        private ComparisonMetadata buildMetadata(ComparedLaw output) {
            int substitutions = 0;
            int incorporated = 0;
            int derogations = 0;
            for (ComparedArticle article : ComparisonTrees.articles(output)) {
                switch (article.getDisposition()) {
                    case SUBSTITUTED: substitutions++; break;
                    case INCORPORATED: incorporated++; break;
                    case DEROGATED: derogations++; break;
                    default: break;
                }
            }

            if (!wholeLawDerogations.isEmpty()) {
                applied.addAll(wholeLawDerogations);
            }
            List<String> unapplied = new ArrayList<>();
            int appliedCount = 0;
            for (Operation operation : operations) {
                if (applied.contains(operation)) {
                    appliedCount++;
                } else {
                    unapplied.add(operation.getDictamenArticle());
                }
            }

            boolean needsReview = false;
            for (Operation operation : wholeLawDerogations) {
                needsReview |= operation.isRequiresReview();
            }

            ComparisonMetadata metadata = new ComparisonMetadata();
            metadata.setLawNumber(lawNumber);
            metadata.setSubstitutions(substitutions);
            metadata.setIncorporations(incorporated);
            metadata.setDerogations(derogations);
            metadata.setDerogatedChapters(new ArrayList<>(derogatedChapterNumbers));
            metadata.setWholeLawDerogated(!wholeLawDerogations.isEmpty());
            metadata.setWholeLawDerogationNeedsReview(needsReview);
            metadata.setAppliedOperations(appliedCount);
            metadata.setUnappliedOperations(unapplied);
            metadata.setIssues(issues);
            return metadata;
        }

        private void issue(IssueType type, Operation operation, String target, String detail) {
            issues.add(new ReconciliationIssue(type, operation.getDictamenArticle(), lawNumber, target, detail));
        }
    }
}
