package ch.so.arp.rag.hybrid;

import ch.so.arp.rag.hybrid.store.Chunk;

/**
 * A chunk travelling through the pipeline with the score of the stage that last
 * ranked it. Never persisted.
 */
public record RetrievalCandidate(Chunk chunk, double score, CandidateStage stage) {

    public RetrievalCandidate withScore(double newScore, CandidateStage newStage) {
        return new RetrievalCandidate(chunk, newScore, newStage);
    }

    /**
     * Deduplication and citation key, {@code source#chunkIndex}.
     */
    public String citationKey() {
        return chunk.citationKey();
    }

    public String content() {
        return chunk.content() == null ? "" : chunk.content();
    }
}
