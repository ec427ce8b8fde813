package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Article of the law as published. Numbers are strings ("29 bis"); numeric JSON values are accepted.
 */
public class Article {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("titulo")
    private String title;

    @JsonProperty("texto")
    private String text;

    @JsonProperty("incisos")
    private List<Inciso> incisos = new ArrayList<>();

    public Article() {}

    public Article(String number, String title, String text) {
        this.number = number;
        this.title = title;
        this.text = text;
    }

    // Getters and setters
    public String getNumber() {
        return number;
    }

    public void setNumber(String number) {
        this.number = number;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public List<Inciso> getIncisos() {
        return incisos;
    }

    public void setIncisos(List<Inciso> incisos) {
        this.incisos = incisos != null ? incisos : new ArrayList<>();
    }
}
