package com.ai.tutor.service;

import com.ai.tutor.dto.RetrievedChunk;
import com.ai.tutor.embedding.EmbeddingGenerator;
import com.ai.tutor.repository.TextChunkRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalService Tests")
class RetrievalServiceTest {

    @Mock
    private EmbeddingGenerator embeddingGenerator;
    @Mock
    private TextChunkRepository chunkRepository;

    @InjectMocks
    private RetrievalService retrievalService;

    @Test
    @DisplayName("Should embed the query and search the given source")
    void shouldSearchScopedSource() {
        float[] vector = {0.1f, 0.2f};
        when(embeddingGenerator.generateEmbedding("ecuaciones")).thenReturn(vector);
        List<RetrievedChunk> expected = List.of(new RetrievedChunk("a", 0.9), new RetrievedChunk("b", 0.4));
        when(chunkRepository.findNearest(vector, 5L, 2)).thenReturn(expected);

        assertThat(retrievalService.retrieve("ecuaciones", 5L, 2)).isEqualTo(expected);
        verify(chunkRepository).findNearest(vector, 5L, 2);
    }

    @Test
    @DisplayName("Should return nothing without touching the model when topK is not positive")
    void shouldReturnEmptyForNonPositiveTopK() {
        assertThat(retrievalService.retrieve("ecuaciones", 5L, 0)).isEmpty();
        assertThat(retrievalService.retrieve("ecuaciones", null, -1)).isEmpty();
        verifyNoInteractions(embeddingGenerator, chunkRepository);
    }

    @Test
    @DisplayName("Should return an empty list when the source has no chunks")
    void shouldReturnEmptyForEmptySource() {
        when(embeddingGenerator.generateEmbedding(anyString())).thenReturn(new float[]{1f});
        when(chunkRepository.findNearest(any(), any(), anyInt())).thenReturn(List.of());

        assertThat(retrievalService.retrieve("ecuaciones", 42L, 3)).isEmpty();
    }
}
