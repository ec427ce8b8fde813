package com.simpla.comparison.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simpla.comparison.model.Law;
import com.simpla.dictamen.resolver.LawNumberResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads normalized law trees from a data directory. Each law lives in
 * {@code normalized_ley_<number>.json} with the tree under a top-level {@code ley} field.
 */
public class LawTreeRepository {

    private static final Logger LOG = LoggerFactory.getLogger(LawTreeRepository.class);

    private final Path dataDirectory;
    private final ObjectMapper objectMapper;

    public LawTreeRepository(Path dataDirectory, ObjectMapper objectMapper) {
        this.dataDirectory = dataDirectory;
        this.objectMapper = objectMapper;
    }

    public Path pathFor(String lawNumber) {
        String normalized = LawNumberResolver.normalize(lawNumber);
        return dataDirectory.resolve("normalized_ley_" + (normalized != null ? normalized : lawNumber) + ".json");
    }

    public boolean exists(String lawNumber) {
        return Files.isRegularFile(pathFor(lawNumber));
    }

    /**
     * @return the law tree, or null when there is no file for that law
     * @throws IOException if the file exists but cannot be read or is not a law tree
     */
    public Law findByNumber(String lawNumber) throws IOException {
        Path path = pathFor(lawNumber);
        if (!Files.isRegularFile(path)) {
            LOG.debug("No law tree at {}", path);
            return null;
        }
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode root = objectMapper.readTree(in);
            JsonNode lawNode = root.has("ley") ? root.get("ley") : root;
            if (lawNode == null || !lawNode.isObject()) {
                throw new IOException("Not a law tree: " + path);
            }
            Law law = objectMapper.treeToValue(lawNode, Law.class);
            if (law.getNumber() == null) {
                law.setNumber(LawNumberResolver.normalize(lawNumber));
            }
            LOG.info("Loaded law {} from {} ({} titles)", law.getNumber(), path, law.getTitles().size());
            return law;
        }
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }
}
