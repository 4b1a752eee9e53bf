package ch.so.arp.rag.hybrid.store;

/**
 * Chunk attributes supplied at ingestion time, before an id has been assigned.
 */
public record NewChunk(String tenantId, String docId, String source, int chunkIndex, String content) {
}
