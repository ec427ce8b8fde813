package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Article of the comparison tree. {@code texto} and {@code incisos} always hold the law as published
 * (empty for incorporated articles); the {@code *_nuevo} fields hold what the dictamen proposes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComparedArticle {

    @JsonProperty("numero")
    private String number;

    @JsonProperty("titulo")
    private String title;

    @JsonProperty("texto")
    private String text;

    @JsonProperty("incisos")
    private List<Inciso> incisos = new ArrayList<>();

    @JsonProperty("estado")
    private Disposition disposition = Disposition.UNCHANGED;

    @JsonProperty("texto_original")
    private String originalText;

    @JsonProperty("titulo_nuevo")
    private String newTitle;

    @JsonProperty("texto_nuevo")
    private String newText;

    @JsonProperty("incisos_nuevos")
    private List<Inciso> newIncisos;

    @JsonProperty("accion")
    private String action;

    @JsonProperty("dictamen_articulo")
    private String dictamenArticle;

    @JsonProperty("sintetico")
    private Boolean synthetic;

    public ComparedArticle() {}

    public static ComparedArticle of(Article source) {
        ComparedArticle article = new ComparedArticle();
        article.number = source.getNumber();
        article.title = source.getTitle();
        article.text = source.getText();
        List<Inciso> copy = new ArrayList<>();
        for (Inciso inciso : source.getIncisos()) {
            copy.add(new Inciso(inciso.getLetter(), inciso.getText()));
        }
        article.incisos = copy;
        return article;
    }

    public String getNumber() { return number; }
    public void setNumber(String number) { this.number = number; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public List<Inciso> getIncisos() { return incisos; }
    public void setIncisos(List<Inciso> incisos) { this.incisos = incisos; }

    public Disposition getDisposition() { return disposition; }
    public void setDisposition(Disposition disposition) { this.disposition = disposition; }

    public String getOriginalText() { return originalText; }
    public void setOriginalText(String originalText) { this.originalText = originalText; }

    public String getNewTitle() { return newTitle; }
    public void setNewTitle(String newTitle) { this.newTitle = newTitle; }

    public String getNewText() { return newText; }
    public void setNewText(String newText) { this.newText = newText; }

    public List<Inciso> getNewIncisos() { return newIncisos; }
    public void setNewIncisos(List<Inciso> newIncisos) { this.newIncisos = newIncisos; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getDictamenArticle() { return dictamenArticle; }
    public void setDictamenArticle(String dictamenArticle) { this.dictamenArticle = dictamenArticle; }

    public Boolean getSynthetic() { return synthetic; }
    public void setSynthetic(Boolean synthetic) { this.synthetic = synthetic; }
}
