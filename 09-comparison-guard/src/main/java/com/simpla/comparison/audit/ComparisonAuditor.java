package com.simpla.comparison.audit;

import com.simpla.comparison.engine.ComparisonTrees;
import com.simpla.comparison.model.ComparedArticle;
import com.simpla.comparison.model.ComparisonMetadata;
import com.simpla.comparison.model.ComparisonTree;
import com.simpla.comparison.model.IssueType;
import com.simpla.comparison.model.ReconciliationIssue;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.ArticleNumber;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import com.simpla.dictamen.resolver.LawNumberResolver;
import com.simpla.dictamen.util.RomanNumerals;
import com.simpla.dictamen.util.SpanishText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists every operation that needs a human look after a batch run: unknown laws, unresolved
 * targets, laws without a tree and operations that left no trace in their law's comparison tree.
 */
public class ComparisonAuditor {

    private static final Logger LOG = LoggerFactory.getLogger(ComparisonAuditor.class);

    private static final String[] BOILERPLATE = {"de forma", "comuniquese"};

    public List<ReconciliationIssue> audit(List<Operation> operations, BatchResult result) {
        Map<String, ReconciliationIssue> issues = new LinkedHashMap<>();

        for (Operation operation : operations) {
            if (isUnknownLaw(operation) && !isExemptFromLaw(operation)) {
                add(issues, new ReconciliationIssue(IssueType.UNKNOWN_LAW, operation.getDictamenArticle(),
                        LawNumberResolver.UNKNOWN, null, operation.getHeaderText()));
            }
            if (operation.getTarget() == null) {
                String law = isUnknownLaw(operation) ? LawNumberResolver.UNKNOWN
                        : LawNumberResolver.normalize(operation.getLawNumber());
                add(issues, new ReconciliationIssue(IssueType.UNRESOLVED_TARGET, operation.getDictamenArticle(),
                        law, null, "Operation has no target"));
            }
        }

        for (ReconciliationIssue issue : result.getIssues()) {
            add(issues, issue);
        }
        for (ComparisonTree tree : result.getComparisons().values()) {
            for (ReconciliationIssue issue : tree.getMetadata().getIssues()) {
                add(issues, issue);
            }
        }

        Map<String, List<Operation>> byLaw = ComparisonOrchestrator.groupByLaw(operations);
        for (Map.Entry<String, ComparisonTree> entry : result.getComparisons().entrySet()) {
            List<Operation> lawOperations = byLaw.get(entry.getKey());
            if (lawOperations != null) {
                traceOperations(entry.getKey(), entry.getValue(), lawOperations, issues);
            }
        }

        List<ReconciliationIssue> report = new ArrayList<>(issues.values());
        LOG.info("Audit found {} issues over {} operations", report.size(), operations.size());
        result.setIssues(report);
        return report;
    }

    private void traceOperations(String lawNumber, ComparisonTree tree, List<Operation> operations,
                                 Map<String, ReconciliationIssue> issues) {
        Set<String> traced = new HashSet<>();
        Set<String> presentNumbers = new HashSet<>();
        for (ComparedArticle article : ComparisonTrees.articles(tree.getLaw())) {
            if (article.getDictamenArticle() != null) {
                traced.add(article.getDictamenArticle());
            }
            presentNumbers.add(ArticleNumber.normalize(article.getNumber()));
        }
        Set<String> reported = new HashSet<>();
        for (ReconciliationIssue issue : issues.values()) {
            if (lawNumber.equals(issue.getLawNumber())) {
                reported.add(issue.getDictamenArticle());
            }
        }
        ComparisonMetadata metadata = tree.getMetadata();

        for (Operation operation : operations) {
            String id = operation.getDictamenArticle();
            if (traced.contains(id) || reported.contains(id) || operation.getTarget() == null) {
                continue;
            }
            if (metadata.isWholeLawDerogated() && operation.getAction() != null && operation.getAction().isDerogation()) {
                continue;
            }
            if (isCoveredChapter(operation.getTarget(), metadata.getDerogatedChapters())) {
                continue;
            }
            if (targetsPresentArticle(operation, presentNumbers)) {
                continue;
            }
            add(issues, new ReconciliationIssue(IssueType.ARTICLE_NOT_FOUND_IN_LAW, id, lawNumber,
                    String.join(", ", targetNumbers(operation)), "Operation left no trace in the comparison"));
        }
    }

    private static boolean isUnknownLaw(Operation operation) {
        return operation.getLawNumber() == null || LawNumberResolver.UNKNOWN.equals(operation.getLawNumber());
    }

    /**
     * New regimes ("Créase ...") and closing articles do not amend an existing law.
     */
    private static boolean isExemptFromLaw(Operation operation) {
        if (operation.getAction() == Action.CREATES) {
            return true;
        }
        String header = SpanishText.fold(operation.getHeaderText() == null ? "" : operation.getHeaderText());
        for (String phrase : BOILERPLATE) {
            if (header.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCoveredChapter(Target target, List<String> derogatedChapters) {
        if (!(target instanceof Target.Chapter)) {
            return false;
        }
        for (String chapter : derogatedChapters) {
            if (RomanNumerals.sameNumber(chapter, ((Target.Chapter) target).getNumber())) {
                return true;
            }
        }
        return false;
    }

    private static boolean targetsPresentArticle(Operation operation, Set<String> presentNumbers) {
        for (String number : targetNumbers(operation)) {
            if (presentNumbers.contains(number)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> targetNumbers(Operation operation) {
        List<String> numbers = new ArrayList<>(operation.affectedArticles());
        if (operation.getTarget() instanceof Target.Inciso) {
            numbers.add(((Target.Inciso) operation.getTarget()).getParentArticle());
        } else if (operation.getTarget() instanceof Target.Chapter) {
            numbers.add(((Target.Chapter) operation.getTarget()).getNumber());
        }
        return numbers;
    }

    private static void add(Map<String, ReconciliationIssue> issues, ReconciliationIssue issue) {
        String key = issue.getType() + "|" + issue.getDictamenArticle() + "|" + issue.getLawNumber() + "|" + issue.getTarget();
        issues.putIfAbsent(key, issue);
    }
}
