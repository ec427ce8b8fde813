package com.simpla.dictamen.lexer;

import com.simpla.dictamen.model.Action;

public final class LineToken {

    private final TokenType type;
    private final String text;
    private final int lineIndex;
    private final String articleNumber;
    private final String titleNumber;
    private final Action action;
    private final int triggerEnd;

    private LineToken(TokenType type, String text, int lineIndex, String articleNumber,
                      String titleNumber, Action action, int triggerEnd) {
        this.type = type;
        this.text = text;
        this.lineIndex = lineIndex;
        this.articleNumber = articleNumber;
        this.titleNumber = titleNumber;
        this.action = action;
        this.triggerEnd = triggerEnd;
    }

    public static LineToken blank(int lineIndex) {
        return new LineToken(TokenType.BLANK, "", lineIndex, null, null, null, -1);
    }

    public static LineToken title(String text, int lineIndex, String titleNumber) {
        return new LineToken(TokenType.TITLE_HEADING, text, lineIndex, null, titleNumber, null, -1);
    }

    public static LineToken structural(String text, int lineIndex) {
        return new LineToken(TokenType.STRUCTURAL_HEADING, text, lineIndex, null, null, null, -1);
    }

    public static LineToken operationHeader(String headerText, int lineIndex, String articleNumber,
                                            Action action, int triggerEnd) {
        return new LineToken(TokenType.OPERATION_HEADER, headerText, lineIndex, articleNumber, null, action, triggerEnd);
    }

    public static LineToken articleHeader(String text, int lineIndex, String articleNumber, int triggerEnd) {
        return new LineToken(TokenType.ARTICLE_HEADER, text, lineIndex, articleNumber, null, null, triggerEnd);
    }

    public static LineToken trigger(String text, int lineIndex, int triggerEnd) {
        return new LineToken(TokenType.TRIGGER, text, lineIndex, null, null, null, triggerEnd);
    }

    public static LineToken plain(String text, int lineIndex) {
        return new LineToken(TokenType.PLAIN_TEXT, text, lineIndex, null, null, null, -1);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /**
     * Index of the normalized line this token starts at.
     */
    public int getLineIndex() {
        return lineIndex;
    }

    public String getArticleNumber() {
        return articleNumber;
    }

    public String getTitleNumber() {
        return titleNumber;
    }

    public Action getAction() {
        return action;
    }

    public boolean hasTrigger() {
        return triggerEnd >= 0;
    }

    /**
     * Text following the trigger phrase, trimmed; empty when the trigger ends the line.
     */
    public String textAfterTrigger() {
        return hasTrigger() ? text.substring(triggerEnd).trim() : "";
    }

    public String textBeforeTrigger() {
        return hasTrigger() ? text.substring(0, triggerEnd).trim() : text;
    }

    @Override
    public String toString() {
        return type + "@" + lineIndex + "[" + text + "]";
    }
}
