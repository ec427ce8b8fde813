package com.simpla.dictamen.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleNumberTest {

    @Test
    void normalizesOrdinalSignAndSuffixSpacing() {
        assertThat(ArticleNumber.normalize("2°bis")).isEqualTo("2 bis");
        assertThat(ArticleNumber.normalize(" 14º  Ter ")).isEqualTo("14 ter");
        assertThat(ArticleNumber.normalize("30")).isEqualTo("30");
    }

    @Test
    void wordsStartingWithSuffixAreNotSuffixes() {
        assertThat(ArticleNumber.normalize("14 terminal")).isEqualTo("14");
    }

    @Test
    void keepsNonNumericNumbersVerbatim() {
        ArticleNumber synthetic = ArticleNumber.parse("CAP_VIII_ART_3");

        assertThat(synthetic.isNumeric()).isFalse();
        assertThat(synthetic.canonical()).isEqualTo("CAP_VIII_ART_3");
    }

    @Test
    void sortsByBaseThenSuffixRankWithNonNumericLast() {
        List<String> sorted = Arrays.asList("29 ter", "CAP_VIII_ART_1", "29", "3", "29 bis", "30").stream()
                .map(ArticleNumber::parse)
                .sorted()
                .map(ArticleNumber::canonical)
                .collect(Collectors.toList());

        assertThat(sorted).containsExactly("3", "29", "29 bis", "29 ter", "30", "CAP_VIII_ART_1");
    }

    @Test
    void suffixRankFollowsLatinOrdinals() {
        assertThat(ArticleNumber.parse("5").getSuffixRank()).isZero();
        assertThat(ArticleNumber.parse("5 bis").getSuffixRank()).isEqualTo(1);
        assertThat(ArticleNumber.parse("5 quater").getSuffixRank()).isEqualTo(3);
        assertThat(ArticleNumber.parse("5 decies").getSuffixRank()).isEqualTo(9);
    }
}
