package com.simpla.dictamen.lexer;

import com.simpla.dictamen.model.ArticleNumber;

import java.util.regex.Pattern;

/**
 * Regular expressions for Argentine legislative drafting conventions, shared by the tokenizer
 * and the target resolver.
 */
public final class DictamenPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** Article number with optional ordinal sign and Latin suffix: "30", "5°", "29 bis", "14° ter". */
    public static final String ARTICLE_NUMBER =
            "[0-9]+(?:\\s*[°º])?(?:\\s*" + ArticleNumber.SUFFIX_REGEX + "(?![\\p{L}]))?";

    private static final String ROMAN_OR_DIGITS = "(?:[IVXLCDM]+|[0-9]+)(?![\\p{L}0-9])";

    private static final String VERB_FORMS =
            "sustit[úu]ye(?:n)?se|incorp[óo]ra(?:n)?se|der[óo]ga(?:n)?se|modif[íi]ca(?:n)?se"
                    + "|cr[ée]a(?:n)?se|supr[íi]me(?:n)?se|reempl[áa]za(?:n)?se";

    public static final Pattern HEADER_SHAPE = Pattern.compile(
            "^\\s*ART[ÍI]CULO\\s+(" + ARTICLE_NUMBER + ")\\s*[°º]?\\s*\\.?\\s*[-–—]\\s*(.*?)\\s*$", FLAGS);

    public static final Pattern STRUCTURAL_HEADING = Pattern.compile(
            "^\\s*(T[ÍI]TULO|CAP[ÍI]TULO|SECCI[ÓO]N|ANEXO)(?![\\p{L}])", FLAGS);

    public static final Pattern TITLE_HEADING = Pattern.compile(
            "^\\s*T[ÍI]TULO\\s+(" + ROMAN_OR_DIGITS + ")", FLAGS);

    public static final Pattern OPERATIVE_VERB = Pattern.compile(
            "(?<![\\p{L}])(" + VERB_FORMS + ")(?![\\p{L}])", FLAGS);

    public static final Pattern TRIGGER = Pattern.compile(
            "(?:por\\s+)?(?:el\\s+siguiente(?:\\s+texto)?|los\\s+siguientes(?:\\s+textos)?)\\s*:", FLAGS);

    /** Number at the head of captured statute text; quotes opening a transcription are tolerated. */
    public static final Pattern BODY_ARTICLE_NUMBER = Pattern.compile(
            "^[\\s\"“'«]*ART[ÍI]CULO\\s+(" + ARTICLE_NUMBER + ")\\s*[°º]?\\s*[.\\-–—]", FLAGS);

    public static final Pattern CHAPTER_DEROGATION = Pattern.compile(
            "der[óo]g\\p{L}*se\\s+(?:el\\s+)?cap[íi]tulo\\s+(" + ROMAN_OR_DIGITS + ")"
                    + "(?:\\s+del?\\s+(?:la\\s+)?t[íi]tulo\\s+(" + ROMAN_OR_DIGITS + "))?", FLAGS);

    public static final Pattern INCISO_OF_ARTICLE = Pattern.compile(
            "inciso\\s+([a-zñ])\\)\\s+(?:del|al)\\s+art[íi]culo\\s+(" + ARTICLE_NUMBER + ")", FLAGS);

    public static final Pattern ARTICLE_LIST = Pattern.compile(
            "(?:sustit|der[óo]g|modif|supr[íi]m|reempl)\\p{L}*\\s+los\\s+art[íi]culos\\s+("
                    + ARTICLE_NUMBER + "(?:\\s*(?:,|y|e)\\s*" + ARTICLE_NUMBER + ")+)", FLAGS);

    public static final Pattern LISTED_NUMBER = Pattern.compile("(" + ARTICLE_NUMBER + ")", FLAGS);

    public static final Pattern INCORPORATION_AS_ARTICLE = Pattern.compile(
            "incorp[óo]ra(?:n)?se\\s+como\\s+art[íi]culo\\s+(" + ARTICLE_NUMBER + ")", FLAGS);

    public static final Pattern ARTICLE_AFTER_VERB = Pattern.compile(
            "(?:" + VERB_FORMS + ")\\s+(?:el\\s+)?art[íi]culo\\s+(" + ARTICLE_NUMBER + ")", FLAGS);

    public static final Pattern ANY_ARTICLE = Pattern.compile(
            "art[íi]culo\\s+(" + ARTICLE_NUMBER + ")", FLAGS);

    public static final Pattern PURE_NUMBER = Pattern.compile("^\\s*[0-9]+\\s*$");

    private DictamenPatterns() {}
}
