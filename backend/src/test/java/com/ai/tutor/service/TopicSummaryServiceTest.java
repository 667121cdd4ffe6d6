package com.ai.tutor.service;

import com.ai.tutor.cache.CacheAsideClient;
import com.ai.tutor.cache.InMemoryCacheStore;
import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.TopicSummaryResponse;
import com.ai.tutor.engine.GenerativeEngine;
import com.ai.tutor.exception.TopicNotFoundException;
import com.ai.tutor.model.Topic;
import com.ai.tutor.repository.TopicRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TopicSummaryService Tests")
class TopicSummaryServiceTest {

    @Mock
    private TopicRepository topicRepository;

    @Mock
    private ContextCacheService contextCacheService;

    @Mock
    private GenerativeEngine generativeEngine;

    private TopicSummaryService summaryService;

    private final Topic topic = Topic.builder().id(1L).sourceId(5L).name("Fracciones").course("1º ESO").build();

    @BeforeEach
    void setUp() {
        CacheAsideClient cacheAsideClient = new CacheAsideClient(new InMemoryCacheStore(), new ObjectMapper());
        summaryService = new TopicSummaryService(topicRepository, contextCacheService, generativeEngine,
                cacheAsideClient, new TutorProperties());
    }

    @Test
    @DisplayName("Should generate a summary once per topic and course")
    void shouldMemoizeSummary() {
        when(topicRepository.findById(1L)).thenReturn(Optional.of(topic));
        when(contextCacheService.getContext(1L, 3)).thenReturn("Una fracción es...");
        when(generativeEngine.generateTopicSummary("Fracciones", "Una fracción es...", "1º ESO"))
                .thenReturn("## Fracciones");

        TopicSummaryResponse first = summaryService.summarize(1L, null);
        TopicSummaryResponse second = summaryService.summarize(1L, "");

        assertThat(first.getSummary()).isEqualTo("## Fracciones");
        assertThat(second.getSummary()).isEqualTo("## Fracciones");
        assertThat(second.getCourse()).isEqualTo("1º ESO");
        verify(generativeEngine, times(1)).generateTopicSummary("Fracciones", "Una fracción es...", "1º ESO");
    }

    @Test
    @DisplayName("Should keep separate summaries for different courses")
    void shouldKeySummaryByCourse() {
        when(topicRepository.findById(1L)).thenReturn(Optional.of(topic));
        when(contextCacheService.getContext(1L, 3)).thenReturn("ctx");
        when(generativeEngine.generateTopicSummary("Fracciones", "ctx", "1º ESO")).thenReturn("básico");
        when(generativeEngine.generateTopicSummary("Fracciones", "ctx", "2º ESO")).thenReturn("avanzado");

        assertThat(summaryService.summarize(1L, "1º ESO").getSummary()).isEqualTo("básico");
        assertThat(summaryService.summarize(1L, "2º ESO").getSummary()).isEqualTo("avanzado");
    }

    @Test
    @DisplayName("Should not cache a blank summary")
    void shouldNotCacheBlankSummary() {
        when(topicRepository.findById(1L)).thenReturn(Optional.of(topic));
        when(contextCacheService.getContext(1L, 3)).thenReturn("");
        when(generativeEngine.generateTopicSummary("Fracciones", "", "1º ESO")).thenReturn(" ", "## Ahora sí");

        assertThat(summaryService.summarize(1L, null).getSummary()).isBlank();
        assertThat(summaryService.summarize(1L, null).getSummary()).isEqualTo("## Ahora sí");
    }

    @Test
    @DisplayName("Should fail for an unknown topic")
    void shouldFailForUnknownTopic() {
        when(topicRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> summaryService.summarize(99L, null)).isInstanceOf(TopicNotFoundException.class);
    }
}
