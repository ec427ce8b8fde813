package com.simpla.comparison.engine;

import com.simpla.comparison.model.ComparedArticle;
import com.simpla.comparison.model.ComparedChapter;
import com.simpla.comparison.model.ComparedLaw;
import com.simpla.comparison.model.ComparedTitle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InsertionPointLocatorTest {

    private InsertionPointLocator locator;
    private ComparedLaw law;
    private ComparedTitle first;
    private ComparedTitle second;
    private ComparedChapter chapter;

    @BeforeEach
    void setUp() {
        locator = new InsertionPointLocator();
        law = new ComparedLaw("24013", "Ley Nacional de Empleo");

        first = new ComparedTitle("I", "Objetivos");
        first.getArticles().add(article("1"));
        first.getArticles().add(article("2"));
        law.getTitles().add(first);

        second = new ComparedTitle("II", "De la regularización");
        chapter = new ComparedChapter("I", "Del empleo no registrado");
        chapter.getArticles().add(article("7"));
        chapter.getArticles().add(article("10"));
        second.getChapters().add(chapter);
        second.getArticles().add(article("20"));
        law.getTitles().add(second);

        law.getTitles().add(new ComparedTitle("III", "Vacío"));
    }

    private static ComparedArticle article(String number) {
        ComparedArticle article = new ComparedArticle();
        article.setNumber(number);
        return article;
    }

    @Test
    void sameBaseNumberGoesNextToItsSibling() {
        InsertionPointLocator.Placement placement = locator.insert(law, article("10 bis"));

        assertThat(placement.getTitle()).isSameAs(second);
        assertThat(placement.getChapter()).isSameAs(chapter);
        assertThat(chapter.getArticles()).extracting(ComparedArticle::getNumber)
                .containsExactly("7", "10", "10 bis");
    }

    @Test
    void numberInsideATitleRangeStaysInThatTitle() {
        InsertionPointLocator.Placement placement = locator.locate(law, "15");

        assertThat(placement.getTitle()).isSameAs(second);
        assertThat(placement.getChapter()).isNull();
    }

    @Test
    void numberInAGapGoesToTheTitleEndingJustBelow() {
        InsertionPointLocator.Placement placement = locator.insert(law, article("4"));

        assertThat(placement.getTitle()).isSameAs(first);
        assertThat(first.getArticles()).extracting(ComparedArticle::getNumber).containsExactly("1", "2", "4");
    }

    @Test
    void numberBeyondEveryTitleGoesToTheLastTitleWithArticles() {
        assertThat(locator.locate(law, "300").getTitle()).isSameAs(second);
        assertThat(locator.locate(law, "0").getTitle()).isSameAs(second);
    }

    @Test
    void suffixesSortInLegalOrder() {
        locator.insert(law, article("2 ter"));
        locator.insert(law, article("2 bis"));

        assertThat(first.getArticles()).extracting(ComparedArticle::getNumber)
                .containsExactly("1", "2", "2 bis", "2 ter");
    }

    @Test
    void lawWithoutTitlesHasNoInsertionPoint() {
        assertThat(locator.insert(new ComparedLaw("1", "Vacía"), article("1"))).isNull();
    }
}
