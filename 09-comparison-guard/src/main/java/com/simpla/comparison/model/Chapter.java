package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class Chapter {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("nombre")
    private String name;

    @JsonProperty("articulos")
    private List<Article> articles = new ArrayList<>();

    public Chapter() {}

    public Chapter(String number, String name) {
        this.number = number;
        this.name = name;
    }

    public String getNumber() {
        return number;
    }

    public void setNumber(String number) {
        this.number = number;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<Article> getArticles() {
        return articles;
    }

    public void setArticles(List<Article> articles) {
        this.articles = articles != null ? articles : new ArrayList<>();
    }
}
