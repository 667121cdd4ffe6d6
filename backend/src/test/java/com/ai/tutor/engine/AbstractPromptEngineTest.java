package com.ai.tutor.engine;

import com.ai.tutor.dto.EvaluationResult;
import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.dto.SourceMetadata;
import com.ai.tutor.dto.TopicOutline;
import com.ai.tutor.model.Difficulty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AbstractPromptEngine Tests")
class AbstractPromptEngineTest {

    /** Answers every prompt with a canned reply and records what it was asked. */
    private static class CannedEngine extends AbstractPromptEngine {

        private final String reply;
        private final List<String> prompts = new ArrayList<>();
        private final List<Double> temperatures = new ArrayList<>();

        CannedEngine(String reply) {
            super(new ObjectMapper(), HttpClient.newHttpClient(), Duration.ofSeconds(1));
            this.reply = reply;
        }

        @Override
        public String name() {
            return "canned";
        }

        @Override
        protected String complete(String systemPrompt, String userPrompt, double temperature) {
            prompts.add(userPrompt);
            temperatures.add(temperature);
            return reply;
        }
    }

    @Test
    @DisplayName("Should put topic, course, difficulty and context into the exercise prompt")
    void shouldBuildExercisePrompt() {
        CannedEngine engine = new CannedEngine("{\"content\": \"Resuelve x + 1 = 3\", \"solution\": \"2\"}");

        ExercisePayload payload = engine.generateExercise("Ecuaciones", "Una ecuación es...", Difficulty.HARD, null);

        assertThat(payload.getContent()).isEqualTo("Resuelve x + 1 = 3");
        assertThat(engine.prompts.get(0))
                .contains("Tema: Ecuaciones")
                .contains("Curso: No especificado")
                .contains(Difficulty.HARD.promptDescription())
                .contains("Una ecuación es...");
        assertThat(engine.temperatures).containsExactly(AbstractPromptEngine.CREATIVE);
    }

    @Test
    @DisplayName("Should read an evaluation verdict")
    void shouldParseEvaluation() {
        CannedEngine engine = new CannedEngine("```json\n{\"is_correct_result\": true, \"is_correct_methodology\": false, "
                + "\"errors_found\": [\"Signo\"], \"feedback\": \"Casi\"}\n```");

        EvaluationResult result = engine.evaluateSubmission("e", "2", "m", "2", "pasos");

        assertThat(result.isCorrectResult()).isTrue();
        assertThat(result.isCorrectMethodology()).isFalse();
        assertThat(result.getErrorsFound()).containsExactly("Signo");
        assertThat(result.getFeedback()).isEqualTo("Casi");
    }

    @Test
    @DisplayName("Should turn an unreadable evaluation into a negative verdict carrying the raw text")
    void shouldFallBackOnUnreadableEvaluation() {
        CannedEngine engine = new CannedEngine("La respuesta es correcta");

        EvaluationResult result = engine.evaluateSubmission("e", "2", "m", "2", "pasos");

        assertThat(result.isCorrectResult()).isFalse();
        assertThat(result.getFeedback()).isEqualTo("La respuesta es correcta");
    }

    @Test
    @DisplayName("Should extract named topics and ignore blank ones")
    void shouldExtractTopics() {
        CannedEngine engine = new CannedEngine("{\"topics\": [{\"name\": \"Números enteros\", \"description\": \"Z\"},"
                + " {\"name\": \"\"}, {\"name\": \"Fracciones\"}]}");

        List<TopicOutline> topics = engine.extractTopics(List.of("Índice", "Tema 1"),
                SourceMetadata.builder().title("Matemáticas 1").course("1º ESO").build());

        assertThat(topics).extracting(TopicOutline::getName).containsExactly("Números enteros", "Fracciones");
        assertThat(engine.prompts.get(0)).contains("LIBRO: Matemáticas 1").contains("Índice\n\nTema 1");
    }

    @Test
    @DisplayName("Should return no topics for an unreadable answer")
    void shouldReturnNoTopicsForGarbage() {
        CannedEngine engine = new CannedEngine("No he encontrado temas");

        assertThat(engine.extractTopics(List.of("x"), new SourceMetadata())).isEmpty();
    }

    @Test
    @DisplayName("Should return the bare Mermaid diagram for a visual scheme")
    void shouldStripMermaidFence() {
        CannedEngine engine = new CannedEngine("```mermaid\nflowchart TD\n  A[Datos] --> B[Ecuación]\n```");

        assertThat(engine.generateVisualScheme("e", "")).isEqualTo("flowchart TD\n  A[Datos] --> B[Ecuación]");
    }
}
