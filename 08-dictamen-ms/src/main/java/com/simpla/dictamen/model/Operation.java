package com.simpla.dictamen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One operative article of a dictamen: verb, target, affected law and the verbatim new text.
 * Opened by the parser when it meets an operation header and sealed once its body has been captured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Operation {

    @JsonProperty("dictamen_articulo")
    private String dictamenArticle;

    @JsonProperty("titulo_contexto")
    private String titleContext;

    @JsonProperty("encabezado")
    private String headerText;

    @JsonProperty("accion")
    private Action action;

    @JsonProperty("destino")
    private Target target;

    @JsonProperty("destino_articulos")
    private List<String> listedArticles = new ArrayList<>();

    @JsonProperty("ley_numero")
    private String lawNumber;

    @JsonProperty("texto_nuevo")
    private String replacementText;

    @JsonProperty("texto_nuevo_lineas")
    private List<String> replacementLines = new ArrayList<>();

    @JsonProperty("texto_intermedio")
    private List<String> intermediateText = new ArrayList<>();

    @JsonProperty("requiere_revision")
    private boolean requiresReview;

    @JsonProperty("destino_forzado")
    private boolean targetForced;

    @JsonIgnore
    private boolean sealed;

    // Jackson: deserialized operations are already complete
    private Operation() {
        this.sealed = true;
    }

    private Operation(String dictamenArticle, String headerText, Action action, String titleContext) {
        this.dictamenArticle = dictamenArticle;
        this.headerText = headerText;
        this.action = action;
        this.titleContext = titleContext;
        this.sealed = false;
    }

    public static Operation open(String dictamenArticle, String headerText, Action action, String titleContext) {
        return new Operation(dictamenArticle, headerText, action, titleContext);
    }

    /**
     * Stores the captured body. The text is the lines joined with newlines and trimmed.
     * @throws IllegalStateException if the operation was already sealed
     */
    public void seal(List<String> capturedLines) {
        if (sealed) {
            throw new IllegalStateException("Operation " + dictamenArticle + " is already sealed");
        }
        List<String> lines = new ArrayList<>(capturedLines);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).trim().isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).trim().isEmpty()) {
            lines.remove(0);
        }
        this.replacementLines = lines;
        this.replacementText = String.join("\n", lines).trim();
        this.sealed = true;
    }

    @JsonIgnore
    public boolean isSealed() {
        return sealed;
    }

    /**
     * Fixes the target from outside the resolver (manual corrections). Later resolution keeps it.
     */
    public void forceTarget(Target target) {
        this.target = target;
        this.targetForced = true;
    }

    /**
     * Article numbers this operation touches: every listed number for "los artículos 10, 16 y 21",
     * the single article otherwise, nothing for chapter, inciso or whole-law targets.
     */
    @JsonIgnore
    public List<String> affectedArticles() {
        if (!listedArticles.isEmpty()) {
            return Collections.unmodifiableList(listedArticles);
        }
        if (target instanceof Target.Article) {
            return Collections.singletonList(((Target.Article) target).getNumber());
        }
        return Collections.emptyList();
    }

    @JsonIgnore
    public boolean hasReplacementText() {
        return replacementText != null && !replacementText.isEmpty();
    }

    public void addIntermediateLine(String line) {
        intermediateText.add(line);
    }

    public String getDictamenArticle() {
        return dictamenArticle;
    }

    public void setDictamenArticle(String dictamenArticle) {
        this.dictamenArticle = dictamenArticle;
    }

    public String getTitleContext() {
        return titleContext;
    }

    public void setTitleContext(String titleContext) {
        this.titleContext = titleContext;
    }

    public String getHeaderText() {
        return headerText;
    }

    public void setHeaderText(String headerText) {
        this.headerText = headerText;
    }

    public Action getAction() {
        return action;
    }

    public void setAction(Action action) {
        this.action = action;
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        this.target = target;
    }

    public List<String> getListedArticles() {
        return listedArticles;
    }

    public void setListedArticles(List<String> listedArticles) {
        this.listedArticles = listedArticles != null ? new ArrayList<>(listedArticles) : new ArrayList<>();
    }

    public String getLawNumber() {
        return lawNumber;
    }

    public void setLawNumber(String lawNumber) {
        this.lawNumber = lawNumber;
    }

    public String getReplacementText() {
        return replacementText;
    }

    public List<String> getReplacementLines() {
        return replacementLines;
    }

    public List<String> getIntermediateText() {
        return intermediateText;
    }

    public boolean isRequiresReview() {
        return requiresReview;
    }

    public void setRequiresReview(boolean requiresReview) {
        this.requiresReview = requiresReview;
    }

    public boolean isTargetForced() {
        return targetForced;
    }

    @Override
    public String toString() {
        return "Operation{" +
                "dictamenArticle='" + dictamenArticle + '\'' +
                ", action=" + action +
                ", target=" + target +
                ", lawNumber='" + lawNumber + '\'' +
                '}';
    }
}
