package com.simpla.dictamen.resolver;

import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class LawNumberResolverTest {

    private LawNumberResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LawNumberResolver(HeuristicsConfig.defaults());
    }

    @Test
    void proximateExplicitMention() {
        assertThat(resolver.resolveLaw(
                "ARTÍCULO 5- Sustitúyese el artículo 30 de la Ley N° 20.744 por el siguiente:", "I"))
                .isEqualTo("20744");
    }

    @Test
    void crossReferenceMentionIsOutranked() {
        assertThat(resolver.resolveLaw(
                "ARTÍCULO 6- Incorpórase, en los términos de la Ley N° 20.744, el artículo 5 bis a la Ley N° 24.013",
                "I"))
                .isEqualTo("24013");
    }

    @Test
    void namedLawAlias() {
        assertThat(resolver.resolveLaw(
                "ARTÍCULO 7- Sustitúyese el artículo 80 de la Ley de Contrato de Trabajo por el siguiente:", "II"))
                .isEqualTo("20744");
    }

    @Test
    void decreeLawWithYearSuffix() {
        assertThat(resolver.resolveLaw("ARTÍCULO 8- Derógase el artículo 3 del Decreto-Ley 14.250/53", "II"))
                .isEqualTo("14250");
    }

    @Test
    void titleContextInference() {
        String header = "ARTÍCULO 8- Sustitúyese el artículo 12 de esta ley por el siguiente:";

        assertThat(resolver.resolveLaw(header, "I")).isEqualTo("20744");
        assertThat(resolver.resolveLaw(header, "IV")).isEqualTo(LawNumberResolver.UNKNOWN);
    }

    @Test
    void replacementTextIsNotSearched() {
        Operation op = Operation.open("9", "ARTÍCULO 9- Incorpórase como artículo 2 bis el siguiente:",
                Action.INCORPORATES, "SIN_TITULO");
        op.seal(Collections.singletonList("ARTÍCULO 2 bis.- Conforme la Ley N° 24.013 se aplicará..."));

        resolver.resolve(op);

        assertThat(op.getLawNumber()).isEqualTo(LawNumberResolver.UNKNOWN);
    }

    @Test
    void intermediateTextIsSearched() {
        Operation op = Operation.open("9", "ARTÍCULO 9- Sustitúyese el artículo 7°", Action.SUBSTITUTES, "III");
        op.addIntermediateLine("de la Ley N° 27.555 por el siguiente:");
        op.seal(Collections.emptyList());

        resolver.resolve(op);

        assertThat(op.getLawNumber()).isEqualTo("27555");
    }

    @Test
    void presetLawNumberIsKept() {
        Operation op = Operation.open("9", "ARTÍCULO 9- Derógase el artículo 7 de la Ley N° 27.555",
                Action.DEROGATES, "III");
        op.setLawNumber("20744");
        op.seal(Collections.emptyList());

        resolver.resolve(op);

        assertThat(op.getLawNumber()).isEqualTo("20744");
    }

    @Test
    void normalizesNumbers() {
        assertThat(LawNumberResolver.normalize("20.744")).isEqualTo("20744");
        assertThat(LawNumberResolver.normalize("14.250/53")).isEqualTo("14250");
        assertThat(LawNumberResolver.normalize("123")).isNull();
        assertThat(LawNumberResolver.normalize(LawNumberResolver.UNKNOWN)).isNull();
    }
}
