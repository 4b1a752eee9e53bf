package ch.so.arp.rag.hybrid;

import java.util.concurrent.atomic.AtomicLong;

import ch.so.arp.rag.hybrid.store.Chunk;

final class Candidates {

    private static final AtomicLong IDS = new AtomicLong();

    private Candidates() {
    }

    static Chunk chunk(String source, int chunkIndex, String content) {
        return new Chunk(IDS.incrementAndGet(), "t1", "d1", source, chunkIndex, content, new float[0]);
    }

    static RetrievalCandidate candidate(String source, int chunkIndex, String content) {
        return new RetrievalCandidate(chunk(source, chunkIndex, content), 0.0d, CandidateStage.DENSE);
    }
}
