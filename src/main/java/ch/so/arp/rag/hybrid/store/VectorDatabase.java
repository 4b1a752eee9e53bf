package ch.so.arp.rag.hybrid.store;

import java.util.List;
import java.util.Optional;

/**
 * Vector database abstraction combining durable chunk metadata with a nearest
 * neighbour index. Implementations must make every committed
 * {@link #addChunks(List, List)} visible to the next {@link #search} call.
 */
public interface VectorDatabase {

    /**
     * Persist the chunks and index their embeddings.
     *
     * @param chunks     the chunk attributes, one per embedding
     * @param embeddings embedding vectors, all of the same length
     * @return the ids assigned to the chunks, in input order
     */
    List<Long> addChunks(List<NewChunk> chunks, List<float[]> embeddings);

    /**
     * Find the chunks closest to the query vector that belong to the tenant and,
     * when given, to the document. Filtering is applied after ranking.
     *
     * @param queryVector the query embedding
     * @param k           maximum number of results
     * @param tenantId    tenant filter, {@code null} or blank to disable
     * @param docId       document filter, {@code null} or blank to disable
     * @return hits ordered by descending similarity
     */
    List<SearchHit> search(float[] queryVector, int k, String tenantId, String docId);

    Optional<Chunk> findChunk(long id);
}
