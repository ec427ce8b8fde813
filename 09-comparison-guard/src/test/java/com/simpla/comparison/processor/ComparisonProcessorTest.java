package com.simpla.comparison.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simpla.comparison.dto.BatchResponseDTO;
import com.simpla.comparison.dto.CompareResponseDTO;
import com.simpla.comparison.dto.ErrorKind;
import com.simpla.comparison.dto.ParseResponseDTO;
import com.simpla.comparison.model.LawDocument;
import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.util.ObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.simpla.comparison.LawFixtures.contractLaw;
import static org.assertj.core.api.Assertions.assertThat;

class ComparisonProcessorTest {

    private static final List<String> DICTAMEN = Arrays.asList(
            "TÍTULO I",
            "ARTÍCULO 1°- Sustitúyese el artículo 30 de la Ley N° 20.744 por el siguiente:",
            "“ARTÍCULO 30.- Subcontratación. Quienes cedan total o parcialmente serán solidarios.”",
            "ARTÍCULO 2°- Derógase el Capítulo VIII del Título III de la Ley N° 20.744.",
            "ARTÍCULO 3°- Derógase el artículo 8° de la Ley N° 24.013.",
            "ARTÍCULO 4°- Derógase el artículo 40 de la Ley N° 20.744.");

    @TempDir
    Path dataDir;

    private ObjectMapper mapper;
    private ComparisonProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        mapper = ObjectMappers.create();
        processor = new ComparisonProcessor(HeuristicsConfig.defaults(), dataDir);
        mapper.writeValue(dataDir.resolve("normalized_ley_20744.json").toFile(), new LawDocument(contractLaw()));
    }

    @Test
    void parsesAnArrayOfLines() throws Exception {
        ParseResponseDTO response = processor.processParse(mapper.writeValueAsString(DICTAMEN));

        assertThat(response.isSuccess()).isTrue();
        JsonNode operations = mapper.readTree(response.getOperationsJson()).path("operaciones");
        assertThat(operations).hasSize(4);
        assertThat(operations.get(0).path("destino").path("tipo").asText()).isEqualTo("articulo");
        assertThat(operations.get(0).path("ley_numero").asText()).isEqualTo("20744");
        assertThat(operations.get(1).path("destino").path("tipo").asText()).isEqualTo("capitulo");
    }

    @Test
    void parsesAnObjectWithLines() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lineas", DICTAMEN);

        ParseResponseDTO response = processor.processParse(mapper.writeValueAsString(body));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getMessage()).startsWith("Parsed 4 operations");
    }

    @Test
    void rejectsMalformedInput() {
        assertThat(processor.processParse("{not json").getErrorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(processor.processParse("{\"otra\": 1}").getErrorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(processor.processCompare("[]").getErrorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(processor.processBatch("{\"lineas\": []}").getErrorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
    }

    @Test
    void comparesAgainstALawSentInTheRequest() throws Exception {
        JsonNode operations = mapper.readTree(processor.processParse(mapper.writeValueAsString(DICTAMEN))
                .getOperationsJson()).path("operaciones");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ley", contractLaw());
        body.put("operaciones", operations);

        CompareResponseDTO response = processor.processCompare(mapper.writeValueAsString(body));

        assertThat(response.isSuccess()).isTrue();
        JsonNode metadata = mapper.readTree(response.getComparisonJson()).path("metadatos");
        assertThat(metadata.path("ley_numero").asText()).isEqualTo("20744");
        assertThat(metadata.path("total_sustituciones").asInt()).isEqualTo(1);
        assertThat(metadata.path("total_derogaciones").asInt()).isEqualTo(8);
        assertThat(metadata.path("capitulos_derogados").get(0).asText()).isEqualTo("VIII");
        assertThat(metadata.path("operaciones_aplicadas").asInt()).isEqualTo(3);
    }

    @Test
    void comparesAgainstAStoredLaw() throws Exception {
        JsonNode operations = mapper.readTree(processor.processParse(mapper.writeValueAsString(DICTAMEN))
                .getOperationsJson()).path("operaciones");

        CompareResponseDTO found = processor.processCompareStored("20.744", mapper.writeValueAsString(operations));
        CompareResponseDTO missing = processor.processCompareStored("24013", mapper.writeValueAsString(operations));

        assertThat(found.isSuccess()).isTrue();
        assertThat(mapper.readTree(found.getComparisonJson()).path("ley").path("estado").asText())
                .isEqualTo("sustituido");
        assertThat(missing.isSuccess()).isFalse();
        assertThat(missing.getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void batchRunsTheWholePipeline() throws Exception {
        Map<String, Object> overlay = new LinkedHashMap<>();
        overlay.put("law_replacements", Map.of("3", "11544"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lineas", DICTAMEN);
        body.put("overlay", overlay);

        BatchResponseDTO response = processor.processBatch(mapper.writeValueAsString(body));

        assertThat(response.isSuccess()).isTrue();
        JsonNode payload = mapper.readTree(response.getBatchJson());
        JsonNode result = payload.path("resultado");
        assertThat(payload.path("operaciones").get(2).path("ley_numero").asText()).isEqualTo("11544");
        assertThat(result.path("comparaciones").has("20744")).isTrue();
        assertThat(result.path("leyes_sin_arbol").get(0).asText()).isEqualTo("11544");
        assertThat(result.path("incidencias")).hasSize(1);
        assertThat(result.path("incidencias").get(0).path("tipo").asText()).isEqualTo("LAW_TREE_MISSING");
    }
}
