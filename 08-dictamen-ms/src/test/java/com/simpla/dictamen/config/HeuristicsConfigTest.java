package com.simpla.dictamen.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicsConfigTest {

    @Test
    void bundledTablesCarryChapterEightFallback() {
        HeuristicsConfig config = HeuristicsConfig.defaults();

        HeuristicsConfig.ChapterFallback fallback = config.findChapterFallback("20744", "8", null);

        assertThat(fallback).isNotNull();
        assertThat(fallback.getTitle()).isEqualTo("III");
        assertThat(fallback.getTexts()).hasSize(7);
        assertThat(config.findChapterFallback("20744", "VIII", "II")).isNull();
        assertThat(config.findChapterFallback("24013", "VIII", null)).isNull();
    }

    @Test
    void bundledTablesKeepAliasOrder() {
        HeuristicsConfig config = HeuristicsConfig.defaults();

        assertThat(config.getLawAliases().keySet()).first().isEqualTo("ley de contrato de trabajo");
        assertThat(config.getLawProximityWindow()).isEqualTo(160);
        assertThat(config.getCrossReferenceWindow()).isEqualTo(40);
    }

    @Test
    void loadsTablesFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("heuristics.json");
        Files.write(file, """
                {
                  "alias_leyes": {"ley de riesgos": "24557"},
                  "ventana_proximidad": 80,
                  "desconocido": 1
                }
                """.getBytes(StandardCharsets.UTF_8));

        HeuristicsConfig config = HeuristicsConfig.loadFrom(file);

        assertThat(config.getLawAliases()).containsEntry("ley de riesgos", "24557");
        assertThat(config.getLawProximityWindow()).isEqualTo(80);
        assertThat(config.getCrossReferenceWindow()).isEqualTo(40);
        assertThat(config.getChapterFallbacks()).isEmpty();
    }
}
