package com.simpla.comparison.engine;

import com.simpla.comparison.model.ComparedArticle;
import com.simpla.comparison.model.ComparedChapter;
import com.simpla.comparison.model.ComparedLaw;
import com.simpla.comparison.model.ComparedTitle;

import java.util.ArrayList;
import java.util.List;

public final class ComparisonTrees {

    private ComparisonTrees() {}

    /**
     * Every article of the tree in reading order: each title's direct articles, then its chapters.
     */
    public static List<ComparedArticle> articles(ComparedLaw law) {
        List<ComparedArticle> all = new ArrayList<>();
        if (law == null) {
            return all;
        }
        for (ComparedTitle title : law.getTitles()) {
            all.addAll(title.getArticles());
            for (ComparedChapter chapter : title.getChapters()) {
                all.addAll(chapter.getArticles());
            }
        }
        return all;
    }
}
