package com.ai.tutor.service;

import com.ai.tutor.config.TutorProperties;
import com.ai.tutor.dto.SourceChunk;
import com.ai.tutor.embedding.EmbeddingGenerator;
import com.ai.tutor.exception.EmbeddingDimensionException;
import com.ai.tutor.repository.TextChunkRepository;
import com.ai.tutor.repository.TextChunkRepository.ChunkRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VectorStoreService Tests")
class VectorStoreServiceTest {

    @Mock
    private TextChunkRepository chunkRepository;
    @Mock
    private EmbeddingGenerator embeddingGenerator;
    @Mock
    private TransactionTemplate transactionTemplate;

    private VectorStoreService service;

    @BeforeEach
    void setUp() {
        TutorProperties properties = new TutorProperties();
        properties.getRetrieval().setStoreBatchSize(2);
        service = new VectorStoreService(chunkRepository, embeddingGenerator, transactionTemplate, properties);

        lenient().when(embeddingGenerator.dimensions()).thenReturn(3);
        lenient().when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(null);
        });
        lenient().when(chunkRepository.insertBatch(anyList()))
                .thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
    }

    @Test
    @DisplayName("Should write chunks in bounded batches, one transaction each")
    void shouldStoreInBatches() {
        when(embeddingGenerator.batchEncode(anyList())).thenAnswer(invocation -> {
            List<?> texts = invocation.getArgument(0);
            return texts.stream().map(t -> new float[]{1f, 2f, 3f}).toList();
        });
        List<SourceChunk> chunks = List.of(
                new SourceChunk("a", 0, "1"), new SourceChunk("b", 1, "1"), new SourceChunk("c", 2, "2"));

        int stored = service.storeChunks(10L, chunks);

        assertThat(stored).isEqualTo(3);
        verify(transactionTemplate, times(2)).execute(any());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChunkRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(chunkRepository, times(2)).insertBatch(rows.capture());
        assertThat(rows.getAllValues().get(1)).singleElement().satisfies(row -> {
            assertThat(row.sourceId()).isEqualTo(10L);
            assertThat(row.text()).isEqualTo("c");
            assertThat(row.chunkIndex()).isEqualTo(2);
            assertThat(row.locator()).isEqualTo("2");
        });
    }

    @Test
    @DisplayName("Should refuse a batch holding a vector of the wrong dimension")
    void shouldRejectWrongDimension() {
        when(embeddingGenerator.batchEncode(anyList()))
                .thenReturn(List.of(new float[]{1f, 2f, 3f}, new float[]{1f, 2f}));

        assertThatThrownBy(() -> service.storeChunks(10L, List.of(
                new SourceChunk("a", 0, null), new SourceChunk("b", 1, null))))
                .isInstanceOf(EmbeddingDimensionException.class);
        verify(chunkRepository, never()).insertBatch(anyList());
    }

    @Test
    @DisplayName("Should do nothing for an empty chunk list")
    void shouldIgnoreEmptyInput() {
        assertThat(service.storeChunks(10L, List.of())).isZero();
        verify(embeddingGenerator, never()).batchEncode(anyList());
    }
}
