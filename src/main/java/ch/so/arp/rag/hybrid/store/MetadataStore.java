package ch.so.arp.rag.hybrid.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ObjLongConsumer;

import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * Append-only chunk table accessed through {@link JdbcClient}. Every insert runs
 * in its own auto-committed statement, so rows written before a failure stay
 * readable. Errors surface as Spring's {@code DataAccessException}.
 */
public class MetadataStore {

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS chunks (
              id BIGINT AUTO_INCREMENT PRIMARY KEY,
              tenant_id VARCHAR(255),
              doc_id VARCHAR(255),
              source VARCHAR(1024),
              chunk_index INTEGER,
              content CLOB,
              embedding BLOB
            )
            """;

    private static final String CREATE_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_chunks_tenant_doc ON chunks(tenant_id, doc_id)";

    private static final String INSERT_SQL = """
            INSERT INTO chunks (tenant_id, doc_id, source, chunk_index, content, embedding)
            VALUES (:tenantId, :docId, :source, :chunkIndex, :content, :embedding)
            """;

    private static final String SELECT_COLUMNS =
            "SELECT id, tenant_id, doc_id, source, chunk_index, content, embedding FROM chunks";

    private final JdbcClient jdbcClient;

    public MetadataStore(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    public void ensureSchema() {
        jdbcClient.sql(CREATE_TABLE_SQL).update();
        jdbcClient.sql(CREATE_INDEX_SQL).update();
    }

    /**
     * Append one chunk and return the id assigned to it.
     */
    public long insert(NewChunk chunk, float[] embedding) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql(INSERT_SQL)
                .param("tenantId", chunk.tenantId())
                .param("docId", chunk.docId())
                .param("source", chunk.source())
                .param("chunkIndex", chunk.chunkIndex())
                .param("content", chunk.content())
                .param("embedding", Vectors.toBytes(embedding))
                .update(keyHolder, "id");
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for chunk " + chunk.source() + "#" + chunk.chunkIndex());
        }
        return key.longValue();
    }

    public Optional<Chunk> findById(long id) {
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE id = :id")
                .param("id", id)
                .query(ChunkMapper.INSTANCE)
                .optional();
    }

    /**
     * Load the rows with the given ids keyed by id. Missing ids are absent from
     * the map.
     */
    public Map<Long, Chunk> findByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        List<Chunk> rows = jdbcClient.sql(SELECT_COLUMNS + " WHERE id IN (:ids)")
                .param("ids", ids)
                .query(ChunkMapper.INSTANCE)
                .list();
        Map<Long, Chunk> byId = new LinkedHashMap<>();
        rows.forEach(row -> byId.put(row.id(), row));
        return byId;
    }

    /**
     * Stream every stored vector in id order.
     */
    public void scanVectors(ObjLongConsumer<float[]> consumer) {
        jdbcClient.sql("SELECT id, embedding FROM chunks ORDER BY id")
                .query((RowCallbackHandler) rs -> consumer.accept(Vectors.fromBytes(rs.getBytes("embedding")),
                        rs.getLong("id")));
    }

    public long count() {
        return jdbcClient.sql("SELECT COUNT(*) FROM chunks").query(Long.class).single();
    }

    /**
     * Vector length of the most recently written row, if any.
     */
    public Optional<Integer> latestDimension() {
        return jdbcClient.sql("SELECT embedding FROM chunks ORDER BY id DESC LIMIT 1")
                .query((rs, rowNum) -> Vectors.fromBytes(rs.getBytes("embedding")).length)
                .optional();
    }

    private enum ChunkMapper implements RowMapper<Chunk> {
        INSTANCE;

        @Override
        public Chunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Chunk(
                    rs.getLong("id"),
                    rs.getString("tenant_id"),
                    rs.getString("doc_id"),
                    rs.getString("source"),
                    rs.getInt("chunk_index"),
                    rs.getString("content"),
                    Vectors.fromBytes(rs.getBytes("embedding")));
        }
    }
}
