package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class ComparedTitle {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("nombre")
    private String name;

    @JsonProperty("estado")
    private Disposition disposition = Disposition.UNCHANGED;

    @JsonProperty("articulos")
    private List<ComparedArticle> articles = new ArrayList<>();

    @JsonProperty("capitulos")
    private List<ComparedChapter> chapters = new ArrayList<>();

    public ComparedTitle() {}

    public ComparedTitle(String number, String name) {
        this.number = number;
        this.name = name;
    }

    public String getNumber() { return number; }
    public void setNumber(String number) { this.number = number; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Disposition getDisposition() { return disposition; }
    public void setDisposition(Disposition disposition) { this.disposition = disposition; }

    public List<ComparedArticle> getArticles() { return articles; }
    public void setArticles(List<ComparedArticle> articles) { this.articles = articles; }

    public List<ComparedChapter> getChapters() { return chapters; }
    public void setChapters(List<ComparedChapter> chapters) { this.chapters = chapters; }
}
