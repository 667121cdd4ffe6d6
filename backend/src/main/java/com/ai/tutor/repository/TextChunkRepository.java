package com.ai.tutor.repository;

import com.ai.tutor.dto.RetrievedChunk;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * JDBC access to the {@code text_chunks} table (pgvector).
 *
 * <p>
 * Similarity ranking is done by PostgreSQL: rows are ordered by the cosine
 * distance operator {@code <=>}, which the HNSW index on {@code embedding}
 * serves without scanning the table. The score returned is
 * {@code 1 - cosine_distance}.
 * </p>
 */
@Repository
@RequiredArgsConstructor
public class TextChunkRepository {

    private static final String INSERT_SQL = """
            INSERT INTO text_chunks (source_id, chunk_text, chunk_index, locator, embedding)
            VALUES (?, ?, ?, ?, CAST(? AS vector))
            """;

    private static final String NEAREST_SQL = """
            SELECT chunk_text, 1 - (embedding <=> CAST(? AS vector)) AS similarity
            FROM text_chunks
            ORDER BY embedding <=> CAST(? AS vector)
            LIMIT ?
            """;

    private static final String NEAREST_IN_SOURCE_SQL = """
            SELECT chunk_text, 1 - (embedding <=> CAST(? AS vector)) AS similarity
            FROM text_chunks
            WHERE source_id = ?
            ORDER BY embedding <=> CAST(? AS vector)
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;

    /** One row to be written. */
    public record ChunkRow(long sourceId, String text, int chunkIndex, String locator, float[] embedding) {
    }

    public int insertBatch(List<ChunkRow> rows) {
        int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ChunkRow row = rows.get(i);
                ps.setLong(1, row.sourceId());
                ps.setString(2, row.text());
                ps.setInt(3, row.chunkIndex());
                if (row.locator() != null) {
                    ps.setString(4, row.locator());
                } else {
                    ps.setNull(4, Types.VARCHAR);
                }
                ps.setString(5, toVectorLiteral(row.embedding()));
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
        return counts.length;
    }

    public List<RetrievedChunk> findNearest(float[] query, Long sourceId, int limit) {
        String vector = toVectorLiteral(query);
        if (sourceId == null) {
            return jdbcTemplate.query(NEAREST_SQL,
                    (rs, rowNum) -> new RetrievedChunk(rs.getString("chunk_text"), rs.getDouble("similarity")),
                    vector, vector, limit);
        }
        return jdbcTemplate.query(NEAREST_IN_SOURCE_SQL,
                (rs, rowNum) -> new RetrievedChunk(rs.getString("chunk_text"), rs.getDouble("similarity")),
                vector, sourceId, vector, limit);
    }

    public List<String> findTextsBySource(long sourceId, int limit) {
        return jdbcTemplate.queryForList(
                "SELECT chunk_text FROM text_chunks WHERE source_id = ? ORDER BY chunk_index LIMIT ?",
                String.class, sourceId, limit);
    }

    public long countBySource(long sourceId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM text_chunks WHERE source_id = ?", Long.class, sourceId);
        return count != null ? count : 0;
    }

    public int deleteBySource(long sourceId) {
        return jdbcTemplate.update("DELETE FROM text_chunks WHERE source_id = ?", sourceId);
    }

    /** pgvector text form: {@code [0.1,0.2,...]}. */
    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 12);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }
}
