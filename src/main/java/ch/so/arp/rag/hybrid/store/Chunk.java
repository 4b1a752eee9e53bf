package ch.so.arp.rag.hybrid.store;

/**
 * Persisted unit of ingested text together with its tenant and document
 * provenance. The {@code id} is assigned by the {@link MetadataStore} and is the
 * only handle shared between the metadata table and the {@link VectorIndex}.
 */
public record Chunk(
        long id,
        String tenantId,
        String docId,
        String source,
        int chunkIndex,
        String content,
        float[] embedding) {

    /**
     * Citation key in the form {@code source#chunkIndex}.
     */
    public String citationKey() {
        return (source == null ? "unknown" : source) + "#" + chunkIndex;
    }
}
