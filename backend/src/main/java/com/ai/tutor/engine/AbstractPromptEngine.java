package com.ai.tutor.engine;

import com.ai.tutor.dto.EvaluationResult;
import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.dto.SourceMetadata;
import com.ai.tutor.dto.TopicOutline;
import com.ai.tutor.exception.GenerativeEngineException;
import com.ai.tutor.model.Difficulty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared prompts and answer parsing for every provider. Subclasses only know
 * how to send one system + user prompt pair and read the reply text.
 */
@Slf4j
public abstract class AbstractPromptEngine implements GenerativeEngine {

    static final double CREATIVE = 0.8;
    static final double BALANCED = 0.7;
    static final double PRECISE = 0.3;

    private static final int MAX_TOPIC_SAMPLE_CHUNKS = 10;

    protected final ObjectMapper objectMapper;
    protected final HttpClient httpClient;
    protected final Duration timeout;
    private final ExercisePayloadParser payloadParser;

    protected AbstractPromptEngine(ObjectMapper objectMapper, HttpClient httpClient, Duration timeout) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.payloadParser = new ExercisePayloadParser(objectMapper);
    }

    /**
     * Sends one completion request and returns the reply text.
     *
     * @throws GenerativeEngineException on transport errors, timeouts or a non-2xx status
     */
    protected abstract String complete(String systemPrompt, String userPrompt, double temperature);

    @Override
    public ExercisePayload generateExercise(String topic, String context, Difficulty difficulty, String course) {
        String prompt = """
                Eres un profesor de matemáticas experto. Genera UN ejercicio de matemáticas con las siguientes características:

                Tema: %s
                Curso: %s
                Dificultad: %s

                Contexto del libro de texto:
                %s

                Genera el ejercicio en formato JSON con esta estructura exacta:
                {
                    "content": "Enunciado completo del ejercicio",
                    "solution": "Respuesta correcta (solo el resultado final)",
                    "methodology": "Pasos detallados para resolver el ejercicio",
                    "available_procedures": [
                        {"id": 1, "name": "Nombre del procedimiento/técnica/propiedad", "description": "Breve explicación de qué es y cuándo se usa"},
                        {"id": 2, "name": "Otro procedimiento", "description": "Breve explicación"}
                    ],
                    "expected_procedures": [1, 3, 5]
                }

                Sobre los procedimientos:
                - available_procedures: todas las técnicas, propiedades o reglas relacionadas con el ejercicio, tanto las que sirven como las que no
                - expected_procedures: ids de los procedimientos necesarios para resolverlo correctamente
                - Incluye entre 6 y 10 procedimientos disponibles
                - Cada procedimiento debe tener una "description" breve (1-2 líneas)
                - No propongas acciones al final, el estudiante no puede responder a tu mensaje.
                """.formatted(topic, orUnspecified(course), difficulty.promptDescription(), context);

        String raw = complete("Eres un profesor de matemáticas experto.", prompt, CREATIVE);
        return payloadParser.parse(raw);
    }

    @Override
    public EvaluationResult evaluateSubmission(String exercise, String expectedSolution, String expectedMethodology,
                                               String studentAnswer, String studentMethodology) {
        String prompt = """
                Evalúa la solución de un estudiante de matemáticas.

                EJERCICIO:
                %s

                SOLUCIÓN ESPERADA:
                %s

                METODOLOGÍA ESPERADA:
                %s

                RESPUESTA DEL ESTUDIANTE:
                %s

                PROCEDIMIENTO DEL ESTUDIANTE:
                %s

                Responde en formato JSON:
                {
                    "is_correct_result": true/false,
                    "is_correct_methodology": true/false,
                    "errors_found": ["lista", "de", "errores"],
                    "feedback": "Retroalimentación breve"
                }

                Criterios:
                - is_correct_result: ¿la respuesta final es correcta?
                - is_correct_methodology: ¿el procedimiento es correcto aunque haya errores de cálculo menores?
                - errors_found: errores conceptuales o procedimentales concretos
                """.formatted(exercise, nullToEmpty(expectedSolution), nullToEmpty(expectedMethodology),
                nullToEmpty(studentAnswer), nullToEmpty(studentMethodology));

        String raw = complete("Eres un profesor de matemáticas experto en evaluar trabajos de estudiantes.",
                prompt, PRECISE);
        try {
            JsonNode root = objectMapper.readTree(ExercisePayloadParser.stripCodeFences(raw));
            if (root != null && root.isObject()) {
                return objectMapper.treeToValue(root, EvaluationResult.class);
            }
        } catch (JsonProcessingException e) {
            log.warn("Evaluation answer from {} is not valid JSON: {}", name(), e.getOriginalMessage());
        }
        return EvaluationResult.builder()
                .correctResult(false)
                .correctMethodology(false)
                .errorsFound(new ArrayList<>(List.of("Error al evaluar")))
                .feedback(raw)
                .build();
    }

    @Override
    public String generateFeedback(String exercise, String studentAnswer, String studentMethodology,
                                   List<String> errors, String context) {
        String prompt = """
                Genera retroalimentación didáctica detallada para un estudiante.

                EJERCICIO:
                %s

                RESPUESTA DEL ESTUDIANTE:
                %s

                PROCEDIMIENTO DEL ESTUDIANTE:
                %s

                ERRORES IDENTIFICADOS:
                %s
                %s
                La retroalimentación debe señalar dónde está el error, explicar por qué es incorrecto
                y mostrar cómo abordarlo, con un tono motivador y un máximo de 200 palabras.
                """.formatted(exercise, nullToEmpty(studentAnswer), nullToEmpty(studentMethodology),
                errors == null ? "" : String.join(", ", errors), contextSection(context));

        return complete("Eres un tutor de matemáticas paciente y didáctico.", prompt, BALANCED);
    }

    @Override
    public String generateHint(String exercise, String context) {
        String prompt = """
                Genera una pista útil para ayudar a resolver este ejercicio de matemáticas:

                EJERCICIO:
                %s
                %s
                La pista debe orientar sin revelar la solución, sugerir el primer paso o concepto clave
                y no superar las 50 palabras.
                """.formatted(exercise, contextSection(context));

        return complete("Eres un tutor de matemáticas que da pistas útiles sin revelar la solución.",
                prompt, BALANCED);
    }

    @Override
    public String generateVisualScheme(String exercise, String context) {
        String prompt = """
                Crea un esquema visual de la estrategia para resolver este ejercicio de matemáticas.

                EJERCICIO:
                %s
                %s
                Responde solo con un diagrama en sintaxis Mermaid (flowchart TD), con nodos breves en español,
                que muestre los pasos sin dar el resultado final.
                """.formatted(exercise, contextSection(context));

        String raw = complete("Eres un profesor de matemáticas que explica con diagramas.", prompt, BALANCED);
        return ExercisePayloadParser.stripCodeFences(raw);
    }

    @Override
    public List<TopicOutline> extractTopics(List<String> textChunks, SourceMetadata metadata) {
        List<String> sample = textChunks.subList(0, Math.min(MAX_TOPIC_SAMPLE_CHUNKS, textChunks.size()));
        String prompt = """
                Extrae los temas y subtemas de este libro de matemáticas en formato JSON.

                LIBRO: %s
                CURSO: %s
                MATERIA: %s

                TEXTO:
                %s

                Formato de respuesta esperado:
                {
                    "topics": [
                        {"name": "Nombre del tema", "description": "Breve descripción"}
                    ]
                }

                Busca especialmente en el índice o tabla de contenidos si está presente.
                """.formatted(
                metadata.getTitle() != null ? metadata.getTitle() : "Sin título",
                orUnspecified(metadata.getCourse()),
                metadata.getSubject() != null ? metadata.getSubject() : "Matemáticas",
                String.join("\n\n", sample));

        String raw = complete("Eres un experto en análisis de contenido educativo.", prompt, PRECISE);
        List<TopicOutline> topics = new ArrayList<>();
        try {
            JsonNode node = objectMapper.readTree(ExercisePayloadParser.stripCodeFences(raw)).path("topics");
            for (JsonNode item : node) {
                TopicOutline outline = objectMapper.treeToValue(item, TopicOutline.class);
                if (outline.getName() != null && !outline.getName().isBlank()) {
                    topics.add(outline);
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Topic list from {} is not valid JSON: {}", name(), e.getOriginalMessage());
        }
        return topics;
    }

    @Override
    public String generateTopicSummary(String topic, String context, String course) {
        String prompt = """
                Eres un profesor de matemáticas experto. Genera un resumen de estudio completo y didáctico sobre el siguiente tema:

                TEMA: %s
                CURSO: %s

                CONTENIDO DEL LIBRO DE TEXTO:
                %s

                Incluye conceptos clave, definiciones, fórmulas y propiedades, procedimientos paso a paso,
                uno o dos ejemplos resueltos y consejos para evitar errores comunes.
                Usa formato Markdown con secciones bien diferenciadas (800-1200 palabras).
                """.formatted(topic, orUnspecified(course), context);

        return complete("Eres un profesor de matemáticas experto en crear materiales de estudio didácticos.",
                prompt, BALANCED);
    }

    /**
     * Posts a JSON body and returns the parsed reply. Shared by the HTTP
     * providers.
     */
    protected JsonNode postJson(String url, ObjectNode body, Map<String, String> headers) {
        long startTime = System.currentTimeMillis();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            headers.forEach(builder::header);

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("{} response status: {} ({}ms)", name(), response.statusCode(),
                    System.currentTimeMillis() - startTime);

            if (response.statusCode() / 100 != 2) {
                throw new GenerativeEngineException(name(),
                        name() + " API error [" + response.statusCode() + "]: " + response.body());
            }
            return objectMapper.readTree(response.body());
        } catch (HttpTimeoutException e) {
            throw new GenerativeEngineException(name(), name() + " did not answer within " + timeout, e);
        } catch (IOException e) {
            throw new GenerativeEngineException(name(), name() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerativeEngineException(name(), name() + " request interrupted", e);
        }
    }

    private static String contextSection(String context) {
        if (context == null || context.isBlank()) {
            return "";
        }
        return "\nCONTEXTO DEL TEMA:\n" + context + "\n";
    }

    private static String orUnspecified(String value) {
        return value == null || value.isBlank() ? "No especificado" : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
