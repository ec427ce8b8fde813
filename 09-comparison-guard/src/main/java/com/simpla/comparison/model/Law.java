package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class Law {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("nombre")
    private String name;

    @JsonProperty("titulos")
    private List<Title> titles = new ArrayList<>();

    public Law() {}

    public Law(String number, String name) {
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

    public List<Title> getTitles() {
        return titles;
    }

    public void setTitles(List<Title> titles) {
        this.titles = titles != null ? titles : new ArrayList<>();
    }
}
