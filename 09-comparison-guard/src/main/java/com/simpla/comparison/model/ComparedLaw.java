package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class ComparedLaw {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("nombre")
    private String name;

    @JsonProperty("estado")
    private Disposition disposition = Disposition.UNCHANGED;

    @JsonProperty("titulos")
    private List<ComparedTitle> titles = new ArrayList<>();

    public ComparedLaw() {}

    public ComparedLaw(String number, String name) {
        this.number = number;
        this.name = name;
    }

    public String getNumber() { return number; }
    public void setNumber(String number) { this.number = number; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Disposition getDisposition() { return disposition; }
    public void setDisposition(Disposition disposition) { this.disposition = disposition; }

    public List<ComparedTitle> getTitles() { return titles; }
    public void setTitles(List<ComparedTitle> titles) { this.titles = titles; }
}
