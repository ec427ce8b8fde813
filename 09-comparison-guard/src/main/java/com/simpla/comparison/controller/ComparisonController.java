package com.simpla.comparison.controller;

import com.simpla.comparison.dto.BatchResponseDTO;
import com.simpla.comparison.dto.CompareResponseDTO;
import com.simpla.comparison.dto.ErrorKind;
import com.simpla.comparison.dto.ParseResponseDTO;
import com.simpla.comparison.dto.ProcessorResponseDTO;
import com.simpla.comparison.processor.ComparisonProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API Controller for dictamen parsing and law comparison.
 * Delegates all business logic to ComparisonProcessor.
 */
@RestController
@RequestMapping("/api/v1/comparison")
public class ComparisonController {

    private static final Logger LOG = LoggerFactory.getLogger(ComparisonController.class);

    private final ComparisonProcessor processor;

    public ComparisonController(ComparisonProcessor processor) {
        this.processor = processor;
    }

    /**
     * Parse dictamen lines
     * POST /api/v1/comparison/parse
     *
     * Request body: JSON array of lines, or {"lineas": [...]}
     * Response: ParseResponseDTO with the operations
     */
    @PostMapping("/parse")
    public ResponseEntity<ParseResponseDTO> parse(@RequestBody String jsonData) {
        try {
            ParseResponseDTO response = processor.processParse(jsonData);
            return ResponseEntity.status(statusOf(response)).body(response);
        } catch (Exception e) {
            LOG.error("Unexpected error in parse", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ParseResponseDTO.failure(
                    "Error processing parse request: " + e.getMessage(), ErrorKind.INTERNAL));
        }
    }

    /**
     * Compare a law with dictamen operations
     * POST /api/v1/comparison/compare
     *
     * Request body: {"ley": {...}, "operaciones": [...]}
     * Response: CompareResponseDTO with the comparison tree
     */
    @PostMapping("/compare")
    public ResponseEntity<CompareResponseDTO> compare(@RequestBody String jsonData) {
        try {
            CompareResponseDTO response = processor.processCompare(jsonData);
            return ResponseEntity.status(statusOf(response)).body(response);
        } catch (Exception e) {
            LOG.error("Unexpected error in compare", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(CompareResponseDTO.failure(
                    "Error processing compare request: " + e.getMessage(), ErrorKind.INTERNAL));
        }
    }

    /**
     * Compare a stored law with dictamen operations
     * POST /api/v1/comparison/compare/{leyNumero}
     *
     * Path parameter: leyNumero (required)
     * Request body: JSON array of operations
     */
    @PostMapping("/compare/{leyNumero}")
    public ResponseEntity<CompareResponseDTO> compareStored(@PathVariable("leyNumero") String lawNumber,
                                                            @RequestBody String operationsJson) {
        try {
            CompareResponseDTO response = processor.processCompareStored(lawNumber, operationsJson);
            return ResponseEntity.status(statusOf(response)).body(response);
        } catch (Exception e) {
            LOG.error("Unexpected error comparing stored law {}", lawNumber, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(CompareResponseDTO.failure(
                    "Error processing compare request: " + e.getMessage(), ErrorKind.INTERNAL));
        }
    }

    /**
     * Parse, correct, reconcile and audit a whole dictamen
     * POST /api/v1/comparison/batch
     *
     * Request body: {"lineas": [...], "leyes": {"20744": {...}}, "overlay": {...}}
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchResponseDTO> batch(@RequestBody String jsonData) {
        try {
            BatchResponseDTO response = processor.processBatch(jsonData);
            return ResponseEntity.status(statusOf(response)).body(response);
        } catch (Exception e) {
            LOG.error("Unexpected error in batch", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(BatchResponseDTO.failure(
                    "Error processing batch request: " + e.getMessage(), ErrorKind.INTERNAL));
        }
    }

    /**
     * Health check endpoint
     * GET /api/v1/comparison/health
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Comparison service is healthy");
    }

    private static HttpStatus statusOf(ProcessorResponseDTO response) {
        if (response.isSuccess()) {
            return HttpStatus.OK;
        }
        if (response.getErrorKind() == ErrorKind.INVALID_INPUT) {
            return HttpStatus.BAD_REQUEST;
        }
        if (response.getErrorKind() == ErrorKind.NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
