package com.simpla.dictamen.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simpla.dictamen.util.ObjectMappers;
import com.simpla.dictamen.util.RomanNumerals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristic tables used by the resolver and the reconciliation engine: named-law aliases,
 * title-context laws, cross-reference phrases, search windows and chapter fallback texts.
 * Loaded from {@code dictamen-heuristics.json} on the classpath unless
 * {@code DICTAMEN_HEURISTICS_PATH} points to another file.
 */
public class HeuristicsConfig {

    private static final Logger LOG = LoggerFactory.getLogger(HeuristicsConfig.class);

    public static final String RESOURCE = "dictamen-heuristics.json";
    public static final String PATH_ENV = "DICTAMEN_HEURISTICS_PATH";

    @JsonProperty("alias_leyes")
    private Map<String, String> lawAliases = new LinkedHashMap<>();

    @JsonProperty("leyes_por_titulo")
    private Map<String, String> titleContextLaws = new LinkedHashMap<>();

    @JsonProperty("frases_remision")
    private List<String> crossReferencePhrases = new ArrayList<>();

    @JsonProperty("ventana_proximidad")
    private int lawProximityWindow = 160;

    @JsonProperty("ventana_remision")
    private int crossReferenceWindow = 40;

    @JsonProperty("capitulos_sustitutos")
    private List<ChapterFallback> chapterFallbacks = new ArrayList<>();

    public HeuristicsConfig() {}

    public static HeuristicsConfig load() throws IOException {
        String path = getEnvOrDefault(PATH_ENV, null);
        if (path != null) {
            return loadFrom(Paths.get(path));
        }
        return loadFromClasspath();
    }

    public static HeuristicsConfig loadFrom(Path path) throws IOException {
        LOG.info("Loading heuristics from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static HeuristicsConfig loadFromClasspath() throws IOException {
        try (InputStream in = HeuristicsConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Classpath resource not found: " + RESOURCE);
            }
            return read(in);
        }
    }

    /**
     * Bundled tables. The resource ships inside the jar, so failing to read it is a packaging error.
     */
    public static HeuristicsConfig defaults() {
        try {
            return loadFromClasspath();
        } catch (IOException e) {
            throw new IllegalStateException("Bundled " + RESOURCE + " is unreadable", e);
        }
    }

    private static HeuristicsConfig read(InputStream in) throws IOException {
        ObjectMapper mapper = ObjectMappers.create();
        HeuristicsConfig config = mapper.readValue(in, HeuristicsConfig.class);
        LOG.debug("Heuristics loaded: {} law aliases, {} chapter fallbacks",
                config.lawAliases.size(), config.chapterFallbacks.size());
        return config;
    }

    private static String getEnvOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null && !value.trim().isEmpty() ? value : defaultValue;
    }

    /**
     * @param titleNumber title named by the dictamen, or null when it only names the chapter
     * @return the fallback for that chapter of that law, or null
     */
    public ChapterFallback findChapterFallback(String lawNumber, String chapterNumber, String titleNumber) {
        for (ChapterFallback fallback : chapterFallbacks) {
            if (fallback.getLaw() != null && !fallback.getLaw().equals(lawNumber)) {
                continue;
            }
            if (!RomanNumerals.sameNumber(fallback.getChapter(), chapterNumber)) {
                continue;
            }
            if (titleNumber == null || RomanNumerals.sameNumber(fallback.getTitle(), titleNumber)) {
                return fallback;
            }
        }
        return null;
    }

    public Map<String, String> getLawAliases() {
        return lawAliases;
    }

    public void setLawAliases(Map<String, String> lawAliases) {
        this.lawAliases = lawAliases;
    }

    public Map<String, String> getTitleContextLaws() {
        return titleContextLaws;
    }

    public void setTitleContextLaws(Map<String, String> titleContextLaws) {
        this.titleContextLaws = titleContextLaws;
    }

    public List<String> getCrossReferencePhrases() {
        return crossReferencePhrases;
    }

    public void setCrossReferencePhrases(List<String> crossReferencePhrases) {
        this.crossReferencePhrases = crossReferencePhrases;
    }

    public int getLawProximityWindow() {
        return lawProximityWindow;
    }

    public void setLawProximityWindow(int lawProximityWindow) {
        this.lawProximityWindow = lawProximityWindow;
    }

    public int getCrossReferenceWindow() {
        return crossReferenceWindow;
    }

    public void setCrossReferenceWindow(int crossReferenceWindow) {
        this.crossReferenceWindow = crossReferenceWindow;
    }

    public List<ChapterFallback> getChapterFallbacks() {
        return chapterFallbacks;
    }

    public void setChapterFallbacks(List<ChapterFallback> chapterFallbacks) {
        this.chapterFallbacks = chapterFallbacks;
    }

    /**
     * Article texts of a chapter that the law tree is known to be missing, used to synthesize
     * placeholder articles when the dictamen derogates the whole chapter.
     */
    public static class ChapterFallback {
        @JsonProperty("ley")
        private String law;

        @JsonProperty("capitulo")
        private String chapter;

        @JsonProperty("nombre_capitulo")
        private String chapterName;

        @JsonProperty("titulo")
        private String title;

        @JsonProperty("nombre_titulo")
        private String titleName;

        @JsonProperty("textos")
        private List<String> texts = new ArrayList<>();

        public ChapterFallback() {}

        public String getLaw() { return law; }
        public void setLaw(String law) { this.law = law; }

        public String getChapter() { return chapter; }
        public void setChapter(String chapter) { this.chapter = chapter; }

        public String getChapterName() { return chapterName; }
        public void setChapterName(String chapterName) { this.chapterName = chapterName; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getTitleName() { return titleName; }
        public void setTitleName(String titleName) { this.titleName = titleName; }

        public List<String> getTexts() { return texts; }
        public void setTexts(List<String> texts) { this.texts = texts; }
    }
}
