package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class Inciso {

    @JsonProperty("letra")
    private String letter;

    @JsonProperty("texto")
    private String text;

    public Inciso() {}

    public Inciso(String letter, String text) {
        this.letter = letter;
        this.text = text;
    }

    public String getLetter() {
        return letter;
    }

    public void setLetter(String letter) {
        this.letter = letter;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
