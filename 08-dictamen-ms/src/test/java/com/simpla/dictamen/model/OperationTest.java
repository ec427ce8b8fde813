package com.simpla.dictamen.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simpla.dictamen.util.ObjectMappers;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationTest {

    private final ObjectMapper mapper = ObjectMappers.create();

    @Test
    void sealJoinsLinesAndDropsTrailingBlanks() {
        Operation op = Operation.open("1", "ARTÍCULO 1- Sustitúyese el artículo 2", Action.SUBSTITUTES, "I");

        op.seal(Arrays.asList("ARTÍCULO 2.- Primero.", "", "Segundo.", ""));

        assertThat(op.isSealed()).isTrue();
        assertThat(op.getReplacementText()).isEqualTo("ARTÍCULO 2.- Primero.\n\nSegundo.");
        assertThat(op.getReplacementLines()).containsExactly("ARTÍCULO 2.- Primero.", "", "Segundo.");
    }

    @Test
    void sealingTwiceIsAProgrammingError() {
        Operation op = Operation.open("1", "ARTÍCULO 1- Derógase el artículo 2", Action.DEROGATES, "I");
        op.seal(Collections.emptyList());

        assertThatThrownBy(() -> op.seal(Collections.emptyList()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void affectedArticlesPrefersTheListedNumbers() {
        Operation single = Operation.open("1", "h", Action.DEROGATES, "I");
        single.setTarget(Target.article("40"));
        Operation listed = Operation.open("2", "h", Action.DEROGATES, "I");
        listed.setTarget(Target.article("10"));
        listed.setListedArticles(Arrays.asList("10", "16", "21"));
        Operation chapter = Operation.open("3", "h", Action.DEROGATES, "I");
        chapter.setTarget(Target.chapter("VIII", "III"));

        assertThat(single.affectedArticles()).containsExactly("40");
        assertThat(listed.affectedArticles()).containsExactly("10", "16", "21");
        assertThat(chapter.affectedArticles()).isEmpty();
    }

    @Test
    void incisoTargetRequiresParentArticle() {
        assertThatThrownBy(() -> Target.inciso("c", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void serializesTargetWithTypeTag() throws Exception {
        Operation op = Operation.open("9", "ARTÍCULO 9- Sustitúyese el inciso c) del artículo 245",
                Action.SUBSTITUTES, "I");
        op.setTarget(Target.inciso("c)", "245"));
        op.seal(Collections.singletonList("c) Nuevo texto."));

        String json = mapper.writeValueAsString(op);

        assertThat(json).contains("\"tipo\":\"inciso\"");
        assertThat(json).contains("\"letra\":\"c\"");
        assertThat(json).contains("\"articulo_padre\":\"245\"");
        assertThat(json).contains("\"accion\":\"sustitúyese\"");
    }

    @Test
    void readsPreResolvedOperationsAsSealed() throws Exception {
        String json = """
                {
                  "dictamen_articulo": "3",
                  "accion": "Derógase",
                  "destino": {"tipo": "articulo", "numero": "40°"},
                  "ley_numero": "20744",
                  "campo_extra": true
                }
                """;

        Operation op = mapper.readValue(json, Operation.class);

        assertThat(op.isSealed()).isTrue();
        assertThat(op.getAction()).isEqualTo(Action.DEROGATES);
        assertThat(op.getTarget()).isEqualTo(Target.article("40"));
        assertThat(op.getLawNumber()).isEqualTo("20744");
    }
}
