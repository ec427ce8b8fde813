package com.simpla.dictamen.parser;

import com.simpla.dictamen.lexer.DictamenTokenizer;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import com.simpla.dictamen.resolver.TargetResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OperationStateMachineTest {

    private DictamenTokenizer tokenizer;
    private OperationStateMachine machine;

    @BeforeEach
    void setUp() {
        tokenizer = new DictamenTokenizer();
        machine = new OperationStateMachine(new TargetResolver());
    }

    private List<Operation> run(String... lines) {
        return machine.run(tokenizer.tokenize(Arrays.asList(lines)));
    }

    @Test
    void triggerInHeaderStartsBodyWithTrailingText() {
        List<Operation> ops = run(
                "ARTÍCULO 5- Sustitúyese el artículo 30 de la Ley N° 20.744 por el siguiente: ARTÍCULO 30.- Texto nuevo.");

        assertThat(ops).hasSize(1);
        assertThat(ops.get(0).getReplacementText()).isEqualTo("ARTÍCULO 30.- Texto nuevo.");
        assertThat(ops.get(0).isSealed()).isTrue();
        assertThat(machine.getState()).isEqualTo(ParserState.IDLE);
    }

    @Test
    void nextHeaderSealsBodyAndBlankRunsCollapse() {
        List<Operation> ops = run(
                "ARTÍCULO 5- Sustitúyese el artículo 30 de la Ley N° 20.744",
                "por el siguiente:",
                "ARTÍCULO 30.- Primer párrafo.",
                "",
                "",
                "Segundo párrafo.",
                "",
                "ARTÍCULO 6- Derógase el artículo 40 de la Ley N° 20.744.");

        assertThat(ops).hasSize(2);
        assertThat(ops.get(0).getReplacementLines())
                .containsExactly("ARTÍCULO 30.- Primer párrafo.", "", "Segundo párrafo.");
        assertThat(ops.get(0).getTarget()).isEqualTo(Target.article("30"));
        assertThat(ops.get(1).getAction()).isEqualTo(Action.DEROGATES);
        assertThat(ops.get(1).getReplacementText()).isEmpty();
        assertThat(ops.get(1).getTarget()).isEqualTo(Target.article("40"));
    }

    @Test
    void structuralHeadingSealsAndTitleUpdatesContext() {
        List<Operation> ops = run(
                "TÍTULO II",
                "ARTÍCULO 1- Sustitúyese el artículo 2 de la Ley N° 20.744 por el siguiente:",
                "ARTÍCULO 2.- Texto.",
                "CAPÍTULO III",
                "Texto que no pertenece a ninguna operación.",
                "TÍTULO III",
                "ARTÍCULO 2- Derógase el artículo 9 de la Ley N° 20.744.");

        assertThat(ops).hasSize(2);
        assertThat(ops.get(0).getReplacementText()).isEqualTo("ARTÍCULO 2.- Texto.");
        assertThat(ops.get(0).getTitleContext()).isEqualTo("II");
        assertThat(ops.get(1).getTitleContext()).isEqualTo("III");
    }

    @Test
    void operationsBeforeAnyTitleHaveNoTitleContext() {
        List<Operation> ops = run("ARTÍCULO 1- Derógase el artículo 9 de la Ley N° 20.744.");

        assertThat(ops.get(0).getTitleContext()).isEqualTo(OperationStateMachine.NO_TITLE);
    }

    @Test
    void incorporationWithoutTriggerDetectsProse() {
        List<Operation> ops = run(
                "ARTÍCULO 8- Incorpórase como artículo 92 bis de la Ley N° 20.744",
                "El contrato de trabajo por tiempo indeterminado",
                "se entenderá celebrado a prueba durante los primeros seis meses.");

        assertThat(ops).hasSize(1);
        assertThat(ops.get(0).getReplacementLines()).containsExactly(
                "El contrato de trabajo por tiempo indeterminado",
                "se entenderá celebrado a prueba durante los primeros seis meses.");
        assertThat(ops.get(0).getTarget()).isEqualTo(Target.article("92 bis"));
    }

    @Test
    void incorporationWithoutTriggerStartsAtArticleHeader() {
        List<Operation> ops = run(
                "ARTÍCULO 8- Incorpórase a la Ley N° 20.744",
                "ARTÍCULO 92 ter.- Texto del artículo nuevo.");

        assertThat(ops.get(0).getReplacementText()).isEqualTo("ARTÍCULO 92 ter.- Texto del artículo nuevo.");
        assertThat(ops.get(0).getTarget()).isEqualTo(Target.article("92 ter"));
    }

    @Test
    void substitutionWithoutTriggerKeepsArticleHeaderAsIntermediateText() {
        List<Operation> ops = run(
                "ARTÍCULO 5- Sustitúyese el artículo 30 de la Ley N° 20.744",
                "ARTÍCULO 30.- Texto nuevo.");

        assertThat(ops).hasSize(1);
        assertThat(ops.get(0).getReplacementText()).isEmpty();
        assertThat(ops.get(0).getIntermediateText()).containsExactly("ARTÍCULO 30.- Texto nuevo.");
        assertThat(ops.get(0).getTarget()).isEqualTo(Target.article("30"));
    }

    @Test
    void intermediateTextIsCapped() {
        List<Operation> ops = run(
                "ARTÍCULO 3- Derógase",
                "uno", "", "dos", "", "tres", "", "cuatro", "", "cinco", "", "seis", "", "siete", "", "ocho");

        assertThat(ops.get(0).getIntermediateText())
                .hasSize(OperationStateMachine.MAX_INTERMEDIATE_LINES)
                .startsWith("uno", "dos");
    }

    @Test
    void endOfInputSealsOpenOperation() {
        List<Operation> ops = run(
                "ARTÍCULO 9- Sustitúyese el artículo 14 de la Ley N° 20.744 por el siguiente:",
                "ARTÍCULO 14.- Será nulo todo contrato.",
                "Segunda línea.");

        assertThat(ops).hasSize(1);
        assertThat(ops.get(0).getReplacementText())
                .isEqualTo("ARTÍCULO 14.- Será nulo todo contrato.\nSegunda línea.");
    }

    @Test
    void linesBeforeFirstHeaderAreIgnored() {
        List<Operation> ops = run("El Senado y la Cámara de Diputados", "sancionan con fuerza de ley:");

        assertThat(ops).isEmpty();
    }
}
