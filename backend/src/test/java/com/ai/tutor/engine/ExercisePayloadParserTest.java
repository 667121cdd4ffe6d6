package com.ai.tutor.engine;

import com.ai.tutor.dto.ExercisePayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExercisePayloadParser Tests")
class ExercisePayloadParserTest {

    private final ExercisePayloadParser parser = new ExercisePayloadParser(new ObjectMapper());

    @Test
    @DisplayName("Scenario D: a non-JSON answer becomes the statement with empty solution and methodology")
    void shouldFallBackOnNonJson() {
        String raw = "Claro, aquí tienes un ejercicio: calcula 3/4 de 20";

        ExercisePayload payload = parser.parse(raw);

        assertThat(payload.getContent()).isEqualTo(raw);
        assertThat(payload.getSolution()).isEmpty();
        assertThat(payload.getMethodology()).isEmpty();
        assertThat(payload.getAvailableProcedures()).isEmpty();
        assertThat(payload.getExpectedProcedures()).isEmpty();
    }

    @Test
    @DisplayName("Should read a payload wrapped in a json code fence")
    void shouldParseFencedJson() {
        String raw = """
                Aquí está:
                ```json
                {
                  "content": "Calcula 2/3 + 1/6 🍕",
                  "solution": "5/6",
                  "methodology": "Común denominador 6",
                  "available_procedures": [
                    {"id": 1, "name": "Mínimo común múltiplo", "description": "Para igualar denominadores"},
                    {"id": 2, "name": "Teorema de Pitágoras", "description": "Triángulos rectángulos"}
                  ],
                  "expected_procedures": [1]
                }
                ```
                """;

        ExercisePayload payload = parser.parse(raw);

        assertThat(payload.getContent()).isEqualTo("Calcula 2/3 + 1/6 🍕");
        assertThat(payload.getSolution()).isEqualTo("5/6");
        assertThat(payload.getAvailableProcedures()).hasSize(2);
        assertThat(payload.getAvailableProcedures().get(0).getName()).isEqualTo("Mínimo común múltiplo");
        assertThat(payload.getExpectedProcedures()).containsExactly(1);
    }

    @Test
    @DisplayName("Should keep a structured solution as its JSON text")
    void shouldKeepStructuredSolutionAsJson() {
        String raw = "{\"content\": \"Resuelve el sistema\", \"solution\": {\"x\": 1, \"y\": 2}, "
                + "\"methodology\": [\"Sustitución\", \"Comprobar\"], \"expected_procedures\": [\"2\", 3, \"x\"]}";

        ExercisePayload payload = parser.parse(raw);

        assertThat(payload.getSolution()).isEqualTo("{\"x\":1,\"y\":2}");
        assertThat(payload.getMethodology()).isEqualTo("[\"Sustitución\",\"Comprobar\"]");
        assertThat(payload.getExpectedProcedures()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Should fall back when the JSON has no content")
    void shouldFallBackWithoutContent() {
        String raw = "{\"solution\": \"5\"}";

        assertThat(parser.parse(raw).getContent()).isEqualTo(raw);
        assertThat(parser.parse(null).getContent()).isEmpty();
    }

    @Test
    @DisplayName("Should strip bare and tagged code fences")
    void shouldStripFences() {
        assertThat(ExercisePayloadParser.stripCodeFences("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(ExercisePayloadParser.stripCodeFences("```mermaid\nflowchart TD\n  A-->B\n```"))
                .isEqualTo("flowchart TD\n  A-->B");
        assertThat(ExercisePayloadParser.stripCodeFences("  sin bloque  ")).isEqualTo("sin bloque");
    }
}
