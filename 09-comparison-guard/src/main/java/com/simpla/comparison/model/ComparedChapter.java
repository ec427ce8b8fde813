package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComparedChapter {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("nombre")
    private String name;

    @JsonProperty("estado")
    private Disposition disposition = Disposition.UNCHANGED;

    @JsonProperty("articulos")
    private List<ComparedArticle> articles = new ArrayList<>();

    @JsonProperty("sintetico")
    private Boolean synthetic;

    public ComparedChapter() {}

    public ComparedChapter(String number, String name) {
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

    public Boolean getSynthetic() { return synthetic; }
    public void setSynthetic(Boolean synthetic) { this.synthetic = synthetic; }
}
