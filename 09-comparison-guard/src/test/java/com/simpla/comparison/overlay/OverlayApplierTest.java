package com.simpla.comparison.overlay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import com.simpla.dictamen.util.ObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.simpla.comparison.LawFixtures.operation;
import static org.assertj.core.api.Assertions.assertThat;

class OverlayApplierTest {

    private OverlayApplier applier;

    @BeforeEach
    void setUp() {
        applier = new OverlayApplier();
    }

    @Test
    void readsTheOverlayFormat() throws Exception {
        ObjectMapper mapper = ObjectMappers.create();
        OperationOverlay overlay = mapper.readValue("""
                {
                  "law_replacements": {"3": "24013"},
                  "manual_matches": [{"dictamen_articulo": "4", "target_ley": "20744", "target_articulo": "92 bis"}],
                  "null_target_overrides": ["9"]
                }
                """, OperationOverlay.class);

        assertThat(overlay.getLawReplacements()).containsEntry("3", "24013");
        assertThat(overlay.getManualMatches()).hasSize(1);
        assertThat(overlay.getManualMatches().get(0).getTargetArticle()).isEqualTo("92 bis");
        assertThat(overlay.getNullTargetOverrides()).containsExactly("9");
    }

    @Test
    void lawReplacementOnlyChangesTheLaw() {
        Operation op = operation("3", Action.SUBSTITUTES, Target.article("5"), "ARTÍCULO 5.- Texto.");
        OperationOverlay overlay = new OperationOverlay();
        overlay.getLawReplacements().put("3", "24013");

        int touched = applier.apply(Collections.singletonList(op), overlay);

        assertThat(touched).isEqualTo(1);
        assertThat(op.getLawNumber()).isEqualTo("24013");
        assertThat(op.getTarget()).isEqualTo(Target.article("5"));
        assertThat(op.isTargetForced()).isFalse();
    }

    @Test
    void manualMatchForcesTargetAndLaw() {
        Operation op = operation("4", Action.SUBSTITUTES, Target.article("10"), "Texto.");
        op.setListedArticles(Arrays.asList("10", "16"));
        OperationOverlay overlay = new OperationOverlay();
        overlay.getManualMatches().add(new OperationOverlay.ManualMatch("4", "24013", "92 bis"));
        overlay.getNullTargetOverrides().add("4");

        applier.apply(Collections.singletonList(op), overlay);

        assertThat(op.getTarget()).isEqualTo(Target.article("92 bis"));
        assertThat(op.isTargetForced()).isTrue();
        assertThat(op.getLawNumber()).isEqualTo("24013");
        assertThat(op.affectedArticles()).containsExactly("92 bis");
    }

    @Test
    void nullTargetOverrideConfirmsAWholeLawDerogation() {
        Operation op = operation("9", Action.DEROGATES, null);
        op.setRequiresReview(true);
        OperationOverlay overlay = new OperationOverlay();
        overlay.getNullTargetOverrides().add("9");

        applier.apply(Collections.singletonList(op), overlay);

        assertThat(op.getTarget()).isEqualTo(Target.wholeLaw());
        assertThat(op.isRequiresReview()).isFalse();
    }

    @Test
    void operationsWithoutCorrectionsAreLeftAlone() {
        List<Operation> ops = Arrays.asList(
                operation("1", Action.DEROGATES, Target.article("40")),
                operation("2", Action.DEROGATES, Target.article("41")));
        OperationOverlay overlay = new OperationOverlay();
        overlay.getLawReplacements().put("2", "11544");

        assertThat(applier.apply(ops, overlay)).isEqualTo(1);
        assertThat(ops.get(0).getLawNumber()).isEqualTo("20744");
        assertThat(applier.apply(ops, null)).isZero();
    }
}
