package ch.so.arp.rag.hybrid.store;

/**
 * A chunk returned by dense search with its inner-product score against the
 * normalized query vector.
 */
public record SearchHit(Chunk chunk, double score) {
}
