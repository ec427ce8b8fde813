package com.simpla.dictamen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * What a dictamen operation acts on. Exactly one variant applies to an operation:
 * an article, an inciso of an article, a whole chapter, or the whole law.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "tipo")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Target.Article.class, name = "articulo"),
        @JsonSubTypes.Type(value = Target.Inciso.class, name = "inciso"),
        @JsonSubTypes.Type(value = Target.Chapter.class, name = "capitulo"),
        @JsonSubTypes.Type(value = Target.WholeLaw.class, name = "ley_completa")
})
public abstract class Target {

    public enum Kind {
        ARTICLE, INCISO, CHAPTER, WHOLE_LAW
    }

    Target() {}

    @JsonIgnore
    public abstract Kind getKind();

    public static Article article(String number) {
        return new Article(number);
    }

    public static Inciso inciso(String letter, String parentArticle) {
        return new Inciso(letter, parentArticle);
    }

    public static Chapter chapter(String number, String title) {
        return new Chapter(number, title);
    }

    public static WholeLaw wholeLaw() {
        return new WholeLaw();
    }

    public static final class Article extends Target {
        private final String number;

        @JsonCreator
        public Article(@JsonProperty("numero") String number) {
            if (number == null || number.trim().isEmpty()) {
                throw new IllegalArgumentException("Article target requires a number");
            }
            this.number = ArticleNumber.normalize(number);
        }

        @JsonProperty("numero")
        public String getNumber() {
            return number;
        }

        @Override
        public Kind getKind() {
            return Kind.ARTICLE;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Article && number.equals(((Article) o).number);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.ARTICLE, number);
        }

        @Override
        public String toString() {
            return "Article(" + number + ")";
        }
    }

    public static final class Inciso extends Target {
        private final String letter;
        private final String parentArticle;

        @JsonCreator
        public Inciso(@JsonProperty("letra") String letter,
                      @JsonProperty("articulo_padre") String parentArticle) {
            if (letter == null || letter.trim().isEmpty()) {
                throw new IllegalArgumentException("Inciso target requires a letter");
            }
            if (parentArticle == null || parentArticle.trim().isEmpty()) {
                throw new IllegalArgumentException("Inciso target requires a parent article");
            }
            this.letter = letter.trim().replace(")", "").toLowerCase();
            this.parentArticle = ArticleNumber.normalize(parentArticle);
        }

        @JsonProperty("letra")
        public String getLetter() {
            return letter;
        }

        @JsonProperty("articulo_padre")
        public String getParentArticle() {
            return parentArticle;
        }

        @Override
        public Kind getKind() {
            return Kind.INCISO;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Inciso)) return false;
            Inciso other = (Inciso) o;
            return letter.equals(other.letter) && parentArticle.equals(other.parentArticle);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.INCISO, letter, parentArticle);
        }

        @Override
        public String toString() {
            return "Inciso(" + letter + ") of Article(" + parentArticle + ")";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Chapter extends Target {
        private final String number;
        private final String title;

        @JsonCreator
        public Chapter(@JsonProperty("numero") String number,
                       @JsonProperty("titulo") String title) {
            if (number == null || number.trim().isEmpty()) {
                throw new IllegalArgumentException("Chapter target requires a number");
            }
            this.number = number.trim().toUpperCase();
            this.title = title == null || title.trim().isEmpty() ? null : title.trim().toUpperCase();
        }

        @JsonProperty("numero")
        public String getNumber() {
            return number;
        }

        /**
         * Title of the target law holding the chapter, when the dictamen names it.
         */
        @JsonProperty("titulo")
        public String getTitle() {
            return title;
        }

        @Override
        public Kind getKind() {
            return Kind.CHAPTER;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Chapter)) return false;
            Chapter other = (Chapter) o;
            return number.equals(other.number) && Objects.equals(title, other.title);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.CHAPTER, number, title);
        }

        @Override
        public String toString() {
            return title == null ? "Chapter(" + number + ")" : "Chapter(" + number + ", title " + title + ")";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class WholeLaw extends Target {

        public WholeLaw() {}

        @Override
        public Kind getKind() {
            return Kind.WHOLE_LAW;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof WholeLaw;
        }

        @Override
        public int hashCode() {
            return Kind.WHOLE_LAW.hashCode();
        }

        @Override
        public String toString() {
            return "WholeLaw";
        }
    }
}
