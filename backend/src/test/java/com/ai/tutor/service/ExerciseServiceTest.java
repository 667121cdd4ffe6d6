package com.ai.tutor.service;

import com.ai.tutor.cache.InMemoryCacheStore;
import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.EvaluationResult;
import com.ai.tutor.dto.ExercisePayload;
import com.ai.tutor.dto.ExerciseRequest;
import com.ai.tutor.dto.ExerciseResponse;
import com.ai.tutor.dto.HintResponse;
import com.ai.tutor.dto.ProcedureDescriptor;
import com.ai.tutor.dto.SubmissionRequest;
import com.ai.tutor.dto.SubmissionResponse;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.exception.GenerativeEngineException;
import com.ai.tutor.exception.TopicNotFoundException;
import com.ai.tutor.model.Difficulty;
import com.ai.tutor.model.Exercise;
import com.ai.tutor.model.Submission;
import com.ai.tutor.model.Topic;
import com.ai.tutor.pool.ExercisePoolCache;
import com.ai.tutor.pool.PoolKey;
import com.ai.tutor.prefetch.PrefetchService;
import com.ai.tutor.repository.ExerciseRepository;
import com.ai.tutor.repository.SubmissionRepository;
import com.ai.tutor.repository.TopicRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExerciseService Tests")
class ExerciseServiceTest {

    @Mock
    private TopicRepository topicRepository;
    @Mock
    private ExerciseRepository exerciseRepository;
    @Mock
    private SubmissionRepository submissionRepository;
    @Mock
    private ContextCacheService contextCacheService;
    @Mock
    private StudentHistoryService studentHistoryService;
    @Mock
    private PrefetchService prefetchService;
    @Mock
    private GenerativeEngine generativeEngine;

    private ExercisePoolCache poolCache;
    private ExerciseService service;

    @BeforeEach
    void setUp() {
        TutorProperties properties = new TutorProperties();
        poolCache = new ExercisePoolCache(new InMemoryCacheStore(), new ObjectMapper(), properties);
        service = new ExerciseService(topicRepository, exerciseRepository, submissionRepository, poolCache,
                contextCacheService, new ExerciseGenerationService(generativeEngine), studentHistoryService,
                prefetchService, generativeEngine, properties);

        lenient().when(generativeEngine.name()).thenReturn("stub");
        lenient().when(exerciseRepository.save(any(Exercise.class))).thenAnswer(invocation -> {
            Exercise exercise = invocation.getArgument(0);
            exercise.setId(100L);
            return exercise;
        });
    }

    @Test
    @DisplayName("Scenario A: a pooled exercise is served without calling the engine")
    void shouldServeFromPoolWithoutGenerating() {
        Topic topic = topic(1L, "Fracciones", "1º ESO");
        when(topicRepository.findById(1L)).thenReturn(Optional.of(topic));
        when(studentHistoryService.completedContents("s1")).thenReturn(Set.of("Ejercicio antiguo"));
        PoolKey key = PoolKey.of(topic, Difficulty.MEDIUM, null);
        poolCache.add(key, payload("Suma 1/2 + 1/3"));
        poolCache.add(key, payload("Simplifica 6/8"));
        poolCache.add(key, payload("Compara 2/3 y 3/4"));

        ExerciseResponse response = service.requestExercise("s1",
                ExerciseRequest.builder().topicId(1L).difficulty(Difficulty.MEDIUM).build());

        assertThat(response.isFromPool()).isTrue();
        assertThat(response.getContent()).isIn("Suma 1/2 + 1/3", "Simplifica 6/8", "Compara 2/3 y 3/4");
        assertThat(poolCache.size(key)).isEqualTo(2);
        verify(generativeEngine, never()).generateExercise(anyString(), anyString(), any(), any());
        verify(prefetchService).scheduleRefill("s1", "1º ESO", 1L, Difficulty.MEDIUM);
    }

    @Test
    @DisplayName("Scenario B: an empty pool triggers exactly one synchronous generation")
    void shouldGenerateOnPoolMiss() {
        Topic topic = topic(2L, "Álgebra", "3º ESO");
        when(topicRepository.findById(2L)).thenReturn(Optional.of(topic));
        when(studentHistoryService.completedContents("s1")).thenReturn(Set.of());
        when(contextCacheService.getContext(2L, 2)).thenReturn("Una ecuación de primer grado...");
        ExercisePayload generated = ExercisePayload.builder()
                .content("Resuelve 2x + 3 = 7")
                .solution("x = 2")
                .methodology("Restar 3 y dividir entre 2")
                .availableProcedures(List.of(new ProcedureDescriptor(1, "Transposición", "Pasar términos")))
                .expectedProcedures(List.of(1))
                .build();
        when(generativeEngine.generateExercise("Álgebra", "Una ecuación de primer grado...", Difficulty.HARD, "3º ESO"))
                .thenReturn(generated);

        ExerciseResponse response = service.requestExercise("s1",
                ExerciseRequest.builder().topicId(2L).difficulty(Difficulty.HARD).course("3º ESO").build());

        assertThat(response.isFromPool()).isFalse();
        assertThat(response.getId()).isEqualTo(100L);
        verify(generativeEngine, times(1)).generateExercise(anyString(), anyString(), any(), any());

        ArgumentCaptor<Exercise> saved = ArgumentCaptor.forClass(Exercise.class);
        verify(exerciseRepository).save(saved.capture());
        assertThat(saved.getValue().getContent()).isEqualTo("Resuelve 2x + 3 = 7");
        assertThat(saved.getValue().getSolution()).isEqualTo("x = 2");
        assertThat(saved.getValue().getMethodology()).isEqualTo("Restar 3 y dividir entre 2");
        assertThat(saved.getValue().getAvailableProcedures()).hasSize(1);
        assertThat(saved.getValue().getExpectedProcedures()).containsExactly(1);
        verify(prefetchService).scheduleRefill("s1", "3º ESO", 2L, Difficulty.HARD);
    }

    @Test
    @DisplayName("Should generate when every pooled exercise is already in the student's history")
    void shouldGenerateWhenPoolExhaustedForStudent() {
        Topic topic = topic(1L, "Fracciones", "1º ESO");
        when(topicRepository.findById(1L)).thenReturn(Optional.of(topic));
        PoolKey key = PoolKey.of(topic, Difficulty.EASY, null);
        poolCache.add(key, payload("Ya hecho"));
        when(studentHistoryService.completedContents("s1")).thenReturn(Set.of("Ya hecho"));
        when(contextCacheService.getContext(1L, 2)).thenReturn("contexto");
        when(generativeEngine.generateExercise(any(), any(), any(), any())).thenReturn(payload("Nuevo"));

        ExerciseResponse response = service.requestExercise("s1",
                ExerciseRequest.builder().topicId(1L).difficulty(Difficulty.EASY).build());

        assertThat(response.getContent()).isEqualTo("Nuevo");
        assertThat(poolCache.contents(key)).containsExactly("Ya hecho");
    }

    @Test
    @DisplayName("Should report an unknown topic")
    void shouldRejectUnknownTopic() {
        when(topicRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.requestExercise("s1", ExerciseRequest.builder().topicId(9L).build()))
                .isInstanceOf(TopicNotFoundException.class);
        verify(prefetchService, never()).scheduleRefill(anyString(), any(), anyLong(), any());
    }

    @Test
    @DisplayName("Should propagate an engine failure on the interactive path")
    void shouldPropagateEngineFailure() {
        when(topicRepository.findById(1L)).thenReturn(Optional.of(topic(1L, "Fracciones", "1º ESO")));
        when(studentHistoryService.completedContents("s1")).thenReturn(Set.of());
        when(contextCacheService.getContext(1L, 2)).thenReturn("contexto");
        when(generativeEngine.generateExercise(any(), any(), any(), any()))
                .thenThrow(new GenerativeEngineException("stub", "timeout"));

        assertThatThrownBy(() -> service.requestExercise("s1", ExerciseRequest.builder().topicId(1L).build()))
                .isInstanceOf(GenerativeEngineException.class);
        verify(exerciseRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should mark methodology correct only when every expected procedure was selected")
    void shouldApplyExpectedProcedureSubsetRule() {
        Exercise exercise = Exercise.builder().id(5L).topicId(1L).content("Resuelve 2x = 4").solution("x = 2")
                .methodology("Dividir").expectedProcedures(List.of(1, 3)).difficulty(Difficulty.EASY).build();
        when(exerciseRepository.findById(5L)).thenReturn(Optional.of(exercise));
        when(generativeEngine.evaluateSubmission(any(), any(), any(), any(), any())).thenReturn(
                EvaluationResult.builder().correctResult(true).correctMethodology(false).feedback("Bien").build());
        when(submissionRepository.save(any(Submission.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SubmissionResponse ok = service.submit(5L, "s1", SubmissionRequest.builder()
                .answer("x = 2").selectedProcedures(List.of(3, 1, 4)).build());
        SubmissionResponse missing = service.submit(5L, "s1", SubmissionRequest.builder()
                .answer("x = 2").selectedProcedures(List.of(1)).build());

        assertThat(ok.isCorrectMethodology()).isTrue();
        assertThat(missing.isCorrectMethodology()).isFalse();
        assertThat(ok.getSolution()).isNull();
        verify(generativeEngine, never()).generateFeedback(any(), any(), any(), anyList(), any());
    }

    @Test
    @DisplayName("Should ask for detailed feedback after a wrong answer and reveal the solution on retry")
    void shouldGenerateFeedbackForWrongAnswer() {
        Exercise exercise = Exercise.builder().id(5L).topicId(1L).content("Resuelve 2x = 4").solution("x = 2")
                .difficulty(Difficulty.EASY).build();
        when(exerciseRepository.findById(5L)).thenReturn(Optional.of(exercise));
        when(generativeEngine.evaluateSubmission(any(), any(), any(), any(), any())).thenReturn(
                EvaluationResult.builder().correctResult(false).errorsFound(List.of("Divide mal")).feedback("No").build());
        when(generativeEngine.generateFeedback(eq("Resuelve 2x = 4"), eq("x = 8"), isNull(), eq(List.of("Divide mal")), isNull()))
                .thenReturn("Revisa la división");
        when(submissionRepository.save(any(Submission.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SubmissionResponse response = service.submit(5L, "s1",
                SubmissionRequest.builder().answer("x = 8").retry(true).build());

        assertThat(response.isCorrectResult()).isFalse();
        assertThat(response.getDetailedFeedback()).isEqualTo("Revisa la división");
        assertThat(response.getSolution()).isEqualTo("x = 2");
    }

    @Test
    @DisplayName("Should give a text hint at level 1 and a visual scheme at level 2")
    void shouldServeHintsByLevel() {
        Exercise exercise = Exercise.builder().id(5L).topicId(1L).content("Resuelve 2x = 4")
                .difficulty(Difficulty.EASY).build();
        when(exerciseRepository.findById(5L)).thenReturn(Optional.of(exercise));
        when(contextCacheService.getContext(1L, 2)).thenReturn("contexto");
        when(generativeEngine.generateHint("Resuelve 2x = 4", "contexto")).thenReturn("Aísla la x");
        when(generativeEngine.generateVisualScheme("Resuelve 2x = 4", "contexto")).thenReturn("flowchart TD");

        HintResponse text = service.hint(5L, 1);
        HintResponse visual = service.hint(5L, 2);

        assertThat(text.getType()).isEqualTo("text");
        assertThat(text.getHint()).isEqualTo("Aísla la x");
        assertThat(visual.getType()).isEqualTo("visual");
        assertThat(visual.getHint()).isEqualTo("flowchart TD");
        assertThatThrownBy(() -> service.hint(5L, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Topic topic(long id, String name, String course) {
        return Topic.builder().id(id).sourceId(1L).name(name).course(course).build();
    }

    private static ExercisePayload payload(String content) {
        return ExercisePayload.builder().content(content).solution("s").methodology("m").build();
    }
}
