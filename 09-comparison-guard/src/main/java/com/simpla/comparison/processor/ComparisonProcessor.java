package com.simpla.comparison.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simpla.comparison.audit.BatchResult;
import com.simpla.comparison.audit.ComparisonAuditor;
import com.simpla.comparison.audit.ComparisonOrchestrator;
import com.simpla.comparison.dto.BatchRequestDTO;
import com.simpla.comparison.dto.BatchResponseDTO;
import com.simpla.comparison.dto.CompareRequestDTO;
import com.simpla.comparison.dto.CompareResponseDTO;
import com.simpla.comparison.dto.ErrorKind;
import com.simpla.comparison.dto.ParseResponseDTO;
import com.simpla.comparison.engine.ReconciliationEngine;
import com.simpla.comparison.model.ComparisonTree;
import com.simpla.comparison.model.Law;
import com.simpla.comparison.overlay.OverlayApplier;
import com.simpla.comparison.repository.LawTreeRepository;
import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.parser.DictamenParser;
import com.simpla.dictamen.parser.ParsedDictamen;
import com.simpla.dictamen.resolver.LawNumberResolver;
import com.simpla.dictamen.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core business logic of the comparison service: parse a dictamen, reconcile operations against
 * law trees and audit the result.
 * This class is transport-agnostic and can be used by REST or any other interface.
 */
public class ComparisonProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ComparisonProcessor.class);

    private final ObjectMapper objectMapper;
    private final DictamenParser parser;
    private final ReconciliationEngine engine;
    private final ComparisonOrchestrator orchestrator;
    private final ComparisonAuditor auditor;
    private final OverlayApplier overlayApplier;
    private final LawTreeRepository lawTreeRepository;

    public ComparisonProcessor() {
        this(loadHeuristics(), Paths.get(getEnvOrDefault("COMPARISON_DATA_DIR", "data")));
    }

    public ComparisonProcessor(HeuristicsConfig config, Path dataDirectory) {
        this.objectMapper = ObjectMappers.create();
        this.parser = new DictamenParser(config);
        this.engine = new ReconciliationEngine(config);
        this.orchestrator = new ComparisonOrchestrator(engine);
        this.auditor = new ComparisonAuditor();
        this.overlayApplier = new OverlayApplier();
        this.lawTreeRepository = new LawTreeRepository(dataDirectory, objectMapper);

        LOG.info("ComparisonProcessor initialized with data directory {}", dataDirectory.toAbsolutePath());
    }

    private static HeuristicsConfig loadHeuristics() {
        try {
            return HeuristicsConfig.load();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load dictamen heuristics: " + e.getMessage(), e);
        }
    }

    private static String getEnvOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Parse dictamen lines into operations.
     * Accepts a JSON array of lines or an object with a {@code lineas} array.
     */
    public ParseResponseDTO processParse(String jsonData) {
        LOG.debug("Processing parse request with data length: {}", jsonData == null ? 0 : jsonData.length());

        try {
            List<String> lines = parseLines(jsonData);
            ParsedDictamen parsed = parser.parse(lines);
            String operationsJson = objectMapper.writeValueAsString(parsed);

            String message = "Parsed " + parsed.getOperations().size() + " operations from " + lines.size() + " lines";
            return new ParseResponseDTO(true, message, operationsJson);

        } catch (InvalidDataFormatException | JsonProcessingException e) {
            return ParseResponseDTO.failure("Invalid parse request: " + e.getMessage(), ErrorKind.INVALID_INPUT);
        } catch (Exception e) {
            LOG.error("Error parsing dictamen", e);
            return ParseResponseDTO.failure("Error parsing dictamen: " + e.getMessage(), ErrorKind.INTERNAL);
        }
    }

    /**
     * Reconcile operations against the law tree sent in the request.
     */
    public CompareResponseDTO processCompare(String jsonData) {
        try {
            CompareRequestDTO request = readRequest(jsonData, CompareRequestDTO.class);
            if (request.getLaw() == null) {
                throw new InvalidDataFormatException("Invalid data format: 'ley' field not found");
            }
            return compare(request.getLaw(), request.getOperations());

        } catch (InvalidDataFormatException | JsonProcessingException e) {
            return CompareResponseDTO.failure("Invalid compare request: " + e.getMessage(), ErrorKind.INVALID_INPUT);
        } catch (Exception e) {
            LOG.error("Error comparing law", e);
            return CompareResponseDTO.failure("Error comparing law: " + e.getMessage(), ErrorKind.INTERNAL);
        }
    }

    /**
     * Reconcile operations against a law tree stored in the data directory.
     */
    public CompareResponseDTO processCompareStored(String lawNumber, String operationsJson) {
        LOG.info("Comparing stored law {}", lawNumber);

        try {
            List<Operation> operations = parseOperations(operationsJson);
            Law law = lawTreeRepository.findByNumber(lawNumber);
            if (law == null) {
                String message = "Law tree not found for law: " + lawNumber;
                return CompareResponseDTO.failure(message, ErrorKind.NOT_FOUND);
            }
            return compare(law, operations);

        } catch (InvalidDataFormatException | JsonProcessingException e) {
            return CompareResponseDTO.failure("Invalid compare request: " + e.getMessage(), ErrorKind.INVALID_INPUT);
        } catch (Exception e) {
            LOG.error("Error comparing stored law {}", lawNumber, e);
            return CompareResponseDTO.failure("Error comparing law: " + e.getMessage(), ErrorKind.INTERNAL);
        }
    }

    /**
     * Full run: parse, apply manual corrections, reconcile every amended law and audit.
     */
    public BatchResponseDTO processBatch(String jsonData) {
        try {
            BatchRequestDTO request = readRequest(jsonData, BatchRequestDTO.class);
            if (request.getLines().isEmpty()) {
                throw new InvalidDataFormatException("Invalid data format: 'lineas' is empty");
            }

            List<Operation> operations = new ArrayList<>(parser.parse(request.getLines()).getOperations());
            overlayApplier.apply(operations, request.getOverlay());

            Map<String, Law> laws = new LinkedHashMap<>(request.getLaws());
            for (String lawNumber : ComparisonOrchestrator.groupByLaw(operations).keySet()) {
                if (!containsLaw(laws, lawNumber)) {
                    Law stored = lawTreeRepository.findByNumber(lawNumber);
                    if (stored != null) {
                        laws.put(lawNumber, stored);
                    }
                }
            }

            BatchResult result = orchestrator.orchestrate(operations, laws);
            auditor.audit(operations, result);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("operaciones", operations);
            payload.put("resultado", result);
            String batchJson = objectMapper.writeValueAsString(payload);

            String message = "Reconciled " + result.getComparisons().size() + " laws with "
                    + result.getIssues().size() + " issues";
            return new BatchResponseDTO(true, message, batchJson);

        } catch (InvalidDataFormatException | JsonProcessingException e) {
            return BatchResponseDTO.failure("Invalid batch request: " + e.getMessage(), ErrorKind.INVALID_INPUT);
        } catch (Exception e) {
            LOG.error("Error processing batch", e);
            return BatchResponseDTO.failure("Error processing batch: " + e.getMessage(), ErrorKind.INTERNAL);
        }
    }

    /**
     * Operations carrying another law's number are left out; operations without a law number
     * are assumed to belong to the law being compared.
     */
    private CompareResponseDTO compare(Law law, List<Operation> operations) throws JsonProcessingException {
        String lawNumber = LawNumberResolver.normalize(law.getNumber());
        List<Operation> selected = new ArrayList<>();
        for (Operation operation : operations) {
            String operationLaw = operation.getLawNumber();
            if (operationLaw == null || operationLaw.isEmpty()) {
                selected.add(operation);
            } else if (!LawNumberResolver.UNKNOWN.equals(operationLaw)
                    && (lawNumber == null || lawNumber.equals(LawNumberResolver.normalize(operationLaw)))) {
                selected.add(operation);
            }
        }
        if (selected.size() < operations.size()) {
            LOG.info("Skipped {} operations that amend other laws", operations.size() - selected.size());
        }

        ComparisonTree tree = engine.reconcile(law, selected);
        String comparisonJson = objectMapper.writeValueAsString(tree);
        String message = "Compared law " + law.getNumber() + ": "
                + tree.getMetadata().getAppliedOperations() + " of " + selected.size() + " operations applied";
        return new CompareResponseDTO(true, message, comparisonJson);
    }

    private List<String> parseLines(String jsonData) throws IOException, InvalidDataFormatException {
        JsonNode root = readTree(jsonData);
        JsonNode linesNode = root.isArray() ? root : root.path("lineas");
        if (!linesNode.isArray()) {
            throw new InvalidDataFormatException("Invalid data format: expected an array of lines or a 'lineas' field");
        }
        return objectMapper.convertValue(linesNode, new TypeReference<List<String>>() {});
    }

    private List<Operation> parseOperations(String jsonData) throws IOException, InvalidDataFormatException {
        JsonNode root = readTree(jsonData);
        JsonNode operationsNode = root.isArray() ? root : root.path("operaciones");
        if (!operationsNode.isArray()) {
            throw new InvalidDataFormatException("Invalid data format: expected an array of operations");
        }
        return objectMapper.readerFor(new TypeReference<List<Operation>>() {}).readValue(operationsNode);
    }

    private <T> T readRequest(String jsonData, Class<T> type) throws IOException, InvalidDataFormatException {
        JsonNode root = readTree(jsonData);
        if (!root.isObject()) {
            throw new InvalidDataFormatException("Invalid data format: expected a JSON object");
        }
        return objectMapper.treeToValue(root, type);
    }

    private JsonNode readTree(String jsonData) throws IOException, InvalidDataFormatException {
        if (jsonData == null || jsonData.trim().isEmpty()) {
            throw new InvalidDataFormatException("Invalid data format: empty request body");
        }
        return objectMapper.readTree(jsonData);
    }

    private static boolean containsLaw(Map<String, Law> laws, String lawNumber) {
        for (String key : laws.keySet()) {
            if (lawNumber.equals(LawNumberResolver.normalize(key))) {
                return true;
            }
        }
        return false;
    }

    public LawTreeRepository getLawTreeRepository() {
        return lawTreeRepository;
    }

    public static class InvalidDataFormatException extends Exception {
        public InvalidDataFormatException(String message) {
            super(message);
        }
    }
}
