package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationIssue {

    @JsonProperty("tipo")
    private IssueType type;

    @JsonProperty("dictamen_articulo")
    private String dictamenArticle;

    @JsonProperty("ley_numero")
    private String lawNumber;

    @JsonProperty("destino")
    private String target;

    @JsonProperty("detalle")
    private String detail;

    public ReconciliationIssue() {}

    public ReconciliationIssue(IssueType type, String dictamenArticle, String lawNumber, String target, String detail) {
        this.type = type;
        this.dictamenArticle = dictamenArticle;
        this.lawNumber = lawNumber;
        this.target = target;
        this.detail = detail;
    }

    public IssueType getType() {
        return type;
    }

    public String getDictamenArticle() {
        return dictamenArticle;
    }

    public String getLawNumber() {
        return lawNumber;
    }

    public String getTarget() {
        return target;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return type + " [" + dictamenArticle + " -> " + lawNumber + "/" + target + "]: " + detail;
    }
}
