package com.simpla.dictamen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.simpla.dictamen.util.SpanishText;

/**
 * Operative verbs of a dictamen article, normalized from their inflected Spanish forms.
 */
public enum Action {
    SUBSTITUTES("sustitúyese", "sustitu"),
    INCORPORATES("incorpórase", "incorpor"),
    DEROGATES("derógase", "derog"),
    MODIFIES("modifícase", "modific"),
    SUPPRESSES("suprímese", "suprim"),
    REPLACES("reemplázase", "reemplaz"),
    CREATES("créase", "crea");

    private final String verb;
    private final String stem;

    Action(String verb, String stem) {
        this.verb = verb;
        this.stem = stem;
    }

    @JsonValue
    public String getVerb() {
        return verb;
    }

    /**
     * Maps any inflection ("Sustitúyense", "derogase", ...) to its action.
     * @param verb the verb as written in the document
     * @return the action, or null when the word is not an operative verb
     */
    @JsonCreator
    public static Action fromVerb(String verb) {
        if (verb == null) {
            return null;
        }
        String folded = SpanishText.fold(verb.trim());
        for (Action action : values()) {
            if (folded.startsWith(action.stem) || folded.equals(action.name().toLowerCase())) {
                return action;
            }
        }
        return null;
    }

    public boolean isDerogation() {
        return this == DEROGATES || this == SUPPRESSES;
    }

    public boolean isReplacement() {
        return this == SUBSTITUTES || this == REPLACES || this == MODIFIES;
    }
}
