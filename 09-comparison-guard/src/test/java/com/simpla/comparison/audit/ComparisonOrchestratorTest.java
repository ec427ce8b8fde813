package com.simpla.comparison.audit;

import com.simpla.comparison.engine.ReconciliationEngine;
import com.simpla.comparison.model.IssueType;
import com.simpla.comparison.model.Law;
import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.simpla.comparison.LawFixtures.contractLaw;
import static com.simpla.comparison.LawFixtures.operation;
import static org.assertj.core.api.Assertions.assertThat;

class ComparisonOrchestratorTest {

    private ComparisonOrchestrator orchestrator;
    private List<Operation> operations;

    @BeforeEach
    void setUp() {
        orchestrator = new ComparisonOrchestrator(new ReconciliationEngine(HeuristicsConfig.defaults()));

        Operation lct = operation("1", Action.DEROGATES, Target.article("40"));
        lct.setLawNumber("20.744");
        Operation employment = operation("2", Action.DEROGATES, Target.article("8"));
        employment.setLawNumber("24013");
        Operation unknown = operation("3", Action.SUBSTITUTES, Target.article("1"), "Texto.");
        unknown.setLawNumber("UNKNOWN");
        Operation lctAgain = operation("4", Action.SUBSTITUTES, Target.article("30"), "ARTÍCULO 30.- Nuevo.");
        operations = Arrays.asList(lct, employment, unknown, lctAgain);
    }

    @Test
    void groupsByNormalizedLawInDocumentOrder() {
        Map<String, List<Operation>> byLaw = ComparisonOrchestrator.groupByLaw(operations);

        assertThat(byLaw.keySet()).containsExactly("20744", "24013");
        assertThat(byLaw.get("20744")).extracting(Operation::getDictamenArticle).containsExactly("1", "4");
    }

    @Test
    void reconcilesLawsWithATreeAndReportsTheRest() {
        BatchResult result = orchestrator.orchestrate(operations, Collections.singletonMap("20.744", contractLaw()));

        assertThat(result.getTotalOperations()).isEqualTo(4);
        assertThat(result.getComparisons()).containsOnlyKeys("20744");
        assertThat(result.getComparisons().get("20744").getMetadata().getAppliedOperations()).isEqualTo(2);
        assertThat(result.getMissingLaws()).containsExactly("24013");
        assertThat(result.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getType()).isEqualTo(IssueType.LAW_TREE_MISSING);
            assertThat(issue.getDictamenArticle()).isEqualTo("2");
            assertThat(issue.getLawNumber()).isEqualTo("24013");
        });
    }

    @Test
    void noLawsMeansNothingIsReconciled() {
        BatchResult result = orchestrator.orchestrate(operations, Collections.<String, Law>emptyMap());

        assertThat(result.getComparisons()).isEmpty();
        assertThat(result.getMissingLaws()).containsExactly("20744", "24013");
    }
}
