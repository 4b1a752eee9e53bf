package ch.so.arp.rag.hybrid.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * {@link VectorDatabase} that keeps chunk rows in the {@link MetadataStore} and
 * their normalized vectors in an in-memory {@link VectorIndex} persisted as a
 * snapshot file.
 * <p>
 * A single lock serializes adds, index searches and snapshot writes. Every add
 * rewrites the snapshot before returning, so a search issued after a completed
 * add always sees its chunks.
 * <p>
 * When an add arrives with a vector length that differs from the loaded index,
 * the index is discarded and rebuilt from a full scan of the metadata table.
 * That rebuild costs O(corpus size) and blocks all other callers; it is meant
 * for the rare case of an embedding model change, not for steady-state
 * ingestion.
 */
public class VectorStoreEngine implements VectorDatabase {

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorStoreEngine.class);

    private static final int OVERFETCH_FACTOR = 5;

    private final MetadataStore metadataStore;
    private final Path snapshotPath;
    private final ReentrantLock lock = new ReentrantLock();

    private VectorIndex index;
    private volatile IndexState state = IndexState.ABSENT;

    public VectorStoreEngine(MetadataStore metadataStore, Path snapshotPath) {
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
        this.snapshotPath = Objects.requireNonNull(snapshotPath, "snapshotPath");
        lock.lock();
        try {
            metadataStore.ensureSchema();
            loadOrRebuild();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Metadata store is unavailable", ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Long> addChunks(List<NewChunk> chunks, List<float[]> embeddings) {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(embeddings, "embeddings");
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException(
                    "Got " + chunks.size() + " chunks but " + embeddings.size() + " embeddings");
        }
        if (chunks.isEmpty()) {
            return List.of();
        }
        int dimension = embeddings.get(0).length;
        List<float[]> normalized = new ArrayList<>(embeddings.size());
        for (float[] embedding : embeddings) {
            if (embedding.length != dimension || dimension == 0) {
                throw new IllegalArgumentException("All embeddings in a batch must share one non-zero length");
            }
            normalized.add(Vectors.normalize(embedding));
        }

        lock.lock();
        try {
            List<Long> ids = new ArrayList<>(chunks.size());
            DataAccessException failure = null;
            try {
                for (int i = 0; i < chunks.size(); i++) {
                    ids.add(metadataStore.insert(chunks.get(i), normalized.get(i)));
                }
            } catch (DataAccessException ex) {
                failure = ex;
            }
            if (!ids.isEmpty()) {
                try {
                    indexCommitted(ids, normalized, dimension);
                } catch (DataAccessException ex) {
                    throw new StoreUnavailableException("Metadata store failed during index rebuild", ex);
                }
            }
            if (failure != null) {
                throw new StoreUnavailableException("Metadata store rejected chunk " + (ids.size() + 1) + " of "
                        + chunks.size() + "; " + ids.size() + " chunks were stored", failure);
            }
            LOGGER.debug("Indexed {} chunks with dimension {}", ids.size(), dimension);
            return List.copyOf(ids);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<SearchHit> search(float[] queryVector, int k, String tenantId, String docId) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1");
        }
        List<VectorIndex.ScoredId> neighbours;
        lock.lock();
        try {
            if (index == null || index.size() == 0) {
                return List.of();
            }
            if (queryVector.length != index.dimension()) {
                LOGGER.warn("Query vector length {} does not match index dimension {}; returning no results",
                        queryVector.length, index.dimension());
                return List.of();
            }
            int searchK = Math.min(Math.max(k * OVERFETCH_FACTOR, k), index.size());
            neighbours = index.search(Vectors.normalize(queryVector), searchK);
        } finally {
            lock.unlock();
        }

        Map<Long, Chunk> rows;
        try {
            rows = metadataStore.findByIds(neighbours.stream().map(VectorIndex.ScoredId::id).toList());
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Metadata store is unavailable", ex);
        }
        List<SearchHit> hits = new ArrayList<>(k);
        for (VectorIndex.ScoredId neighbour : neighbours) {
            Chunk chunk = rows.get(neighbour.id());
            if (chunk == null) {
                continue;
            }
            if (isFilter(tenantId) && !tenantId.equals(chunk.tenantId())) {
                continue;
            }
            if (isFilter(docId) && !docId.equals(chunk.docId())) {
                continue;
            }
            hits.add(new SearchHit(chunk, neighbour.score()));
            if (hits.size() >= k) {
                break;
            }
        }
        return hits;
    }

    @Override
    public Optional<Chunk> findChunk(long id) {
        try {
            return metadataStore.findById(id);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Metadata store is unavailable", ex);
        }
    }

    public IndexState state() {
        return state;
    }

    public int indexedCount() {
        lock.lock();
        try {
            return index == null ? 0 : index.size();
        } finally {
            lock.unlock();
        }
    }

    private static boolean isFilter(String value) {
        return value != null && !value.isBlank();
    }

    private void indexCommitted(List<Long> ids, List<float[]> normalized, int dimension) {
        if (index != null && index.dimension() != dimension) {
            LOGGER.warn("Embedding dimension changed from {} to {}; rebuilding index from metadata store",
                    index.dimension(), dimension);
            // the scan picks up the rows that were just inserted
            rebuild(dimension);
            return;
        }
        if (index == null) {
            index = new VectorIndex(dimension);
        }
        for (int i = 0; i < ids.size(); i++) {
            index.add(ids.get(i), normalized.get(i));
        }
        state = IndexState.LOADED;
        persist();
    }

    private void loadOrRebuild() {
        Optional<Integer> latestDimension = metadataStore.latestDimension();
        if (Files.exists(snapshotPath)) {
            try {
                VectorIndex loaded = VectorIndex.readFrom(snapshotPath);
                long stored = metadataStore.count();
                if (loaded.dimension() == latestDimension.orElse(loaded.dimension()) && loaded.size() == stored) {
                    index = loaded;
                    state = IndexState.LOADED;
                    LOGGER.info("Loaded vector index snapshot {} ({} vectors, dimension {})", snapshotPath,
                            loaded.size(), loaded.dimension());
                    return;
                }
                LOGGER.warn("Snapshot {} is stale (dimension {}, {} vectors) against metadata ({} rows); rebuilding",
                        snapshotPath, loaded.dimension(), loaded.size(), stored);
            } catch (IOException ex) {
                LOGGER.warn("Unable to read snapshot {}: {}; rebuilding", snapshotPath, ex.getMessage());
            }
        }
        if (latestDimension.isEmpty()) {
            index = null;
            state = IndexState.ABSENT;
            deleteSnapshot();
            return;
        }
        rebuild(latestDimension.get());
    }

    private void rebuild(int dimension) {
        state = IndexState.REBUILDING;
        long started = System.nanoTime();
        VectorIndex rebuilt = new VectorIndex(dimension);
        long[] skipped = new long[1];
        metadataStore.scanVectors((vector, id) -> {
            if (vector.length == dimension) {
                rebuilt.add(id, Vectors.normalize(vector));
            } else {
                skipped[0]++;
            }
        });
        if (skipped[0] > 0) {
            LOGGER.warn("Skipped {} stored vectors whose length differs from {}", skipped[0], dimension);
        }
        index = rebuilt;
        state = IndexState.LOADED;
        LOGGER.info("Rebuilt vector index with {} vectors (dimension {}) in {} ms", rebuilt.size(), dimension,
                (System.nanoTime() - started) / 1_000_000);
        persist();
    }

    private void persist() {
        try {
            index.writeTo(snapshotPath);
        } catch (IOException ex) {
            throw new StoreUnavailableException("Unable to write index snapshot " + snapshotPath, ex);
        }
    }

    private void deleteSnapshot() {
        try {
            Files.deleteIfExists(snapshotPath);
        } catch (IOException ex) {
            throw new StoreUnavailableException("Unable to remove stale snapshot " + snapshotPath, ex);
        }
    }
}
