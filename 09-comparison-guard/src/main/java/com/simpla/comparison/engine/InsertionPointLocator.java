package com.simpla.comparison.engine;

import com.simpla.comparison.model.ComparedArticle;
import com.simpla.comparison.model.ComparedChapter;
import com.simpla.comparison.model.ComparedLaw;
import com.simpla.comparison.model.ComparedTitle;
import com.simpla.dictamen.model.ArticleNumber;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds where a newly incorporated article belongs, using the numeric ranges of the existing
 * articles. Ordinal suffixes are ignored for ranges: "29 bis" falls where 29 is.
 */
public class InsertionPointLocator {

    public static final Comparator<ComparedArticle> LEGAL_ORDER =
            Comparator.comparing(article -> ArticleNumber.parse(article.getNumber()));

    public static final class Placement {
        private final ComparedTitle title;
        private final ComparedChapter chapter;

        Placement(ComparedTitle title, ComparedChapter chapter) {
            this.title = title;
            this.chapter = chapter;
        }

        public ComparedTitle getTitle() {
            return title;
        }

        /** Null when the article goes to the title's direct list. */
        public ComparedChapter getChapter() {
            return chapter;
        }

        public List<ComparedArticle> targetList() {
            return chapter != null ? chapter.getArticles() : title.getArticles();
        }
    }

    /**
     * @return the placement, or null when the law has no title at all
     */
    public Placement locate(ComparedLaw law, String articleNumber) {
        ComparedTitle title = locateTitle(law, ArticleNumber.parse(articleNumber));
        if (title == null) {
            return null;
        }
        return new Placement(title, locateChapter(title, ArticleNumber.parse(articleNumber)));
    }

    /**
     * Inserts and re-sorts the destination list by base number, then suffix rank.
     */
    public Placement insert(ComparedLaw law, ComparedArticle article) {
        Placement placement = locate(law, article.getNumber());
        if (placement == null) {
            return null;
        }
        List<ComparedArticle> list = placement.targetList();
        list.add(article);
        list.sort(LEGAL_ORDER);
        return placement;
    }

    private ComparedTitle locateTitle(ComparedLaw law, ArticleNumber number) {
        if (law.getTitles().isEmpty()) {
            return null;
        }
        ComparedTitle lastWithArticles = null;
        ComparedTitle nearestBelow = null;
        int nearestMax = Integer.MIN_VALUE;

        for (ComparedTitle title : law.getTitles()) {
            int[] range = range(articlesOf(title));
            if (range == null) {
                continue;
            }
            lastWithArticles = title;
            if (!number.isNumeric()) {
                continue;
            }
            if (range[0] <= number.getBase() && number.getBase() <= range[1]) {
                return title;
            }
            if (range[1] < number.getBase() && range[1] > nearestMax) {
                nearestMax = range[1];
                nearestBelow = title;
            }
        }
        if (nearestBelow != null) {
            return nearestBelow;
        }
        if (lastWithArticles != null) {
            return lastWithArticles;
        }
        return law.getTitles().get(law.getTitles().size() - 1);
    }

    private ComparedChapter locateChapter(ComparedTitle title, ArticleNumber number) {
        if (!number.isNumeric()) {
            return null;
        }
        for (ComparedChapter chapter : title.getChapters()) {
            for (ComparedArticle article : chapter.getArticles()) {
                ArticleNumber existing = ArticleNumber.parse(article.getNumber());
                if (existing.isNumeric() && existing.getBase() == number.getBase()) {
                    return chapter;
                }
            }
        }
        for (ComparedChapter chapter : title.getChapters()) {
            int[] range = range(chapter.getArticles());
            if (range != null && range[0] <= number.getBase() && number.getBase() <= range[1]) {
                return chapter;
            }
        }
        return null;
    }

    private static List<ComparedArticle> articlesOf(ComparedTitle title) {
        List<ComparedArticle> all = new ArrayList<>(title.getArticles());
        for (ComparedChapter chapter : title.getChapters()) {
            all.addAll(chapter.getArticles());
        }
        return all;
    }

    /**
     * @return {min, max} of the numeric bases, or null if there are none
     */
    private static int[] range(List<ComparedArticle> articles) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (ComparedArticle article : articles) {
            ArticleNumber number = ArticleNumber.parse(article.getNumber());
            if (number.isNumeric()) {
                min = Math.min(min, number.getBase());
                max = Math.max(max, number.getBase());
            }
        }
        return min == Integer.MAX_VALUE ? null : new int[]{min, max};
    }
}
