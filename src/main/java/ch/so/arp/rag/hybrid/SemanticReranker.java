package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.store.Vectors;

/**
 * Reranks candidates by cosine similarity between freshly embedded query and
 * candidate texts.
 */
class SemanticReranker implements Reranker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticReranker.class);

    private final Embedder embedder;

    SemanticReranker(Embedder embedder) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
    }

    @Override
    public List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<float[]> queryVectors = embedder.embed(List.of(query));
        if (queryVectors.size() != 1) {
            throw new EmbeddingUnavailableException("Expected 1 query embedding but got " + queryVectors.size());
        }
        float[] queryVector = queryVectors.get(0);
        List<float[]> candidateVectors = embedder.embed(candidates.stream().map(RetrievalCandidate::content).toList());
        if (candidateVectors.size() != candidates.size()) {
            throw new EmbeddingUnavailableException(
                    "Expected " + candidates.size() + " embeddings but got " + candidateVectors.size());
        }
        List<RetrievalCandidate> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            double score = Vectors.cosine(queryVector, candidateVectors.get(i));
            scored.add(candidates.get(i).withScore(score, CandidateStage.SEMANTIC));
        }
        scored.sort(Comparator.comparingDouble(RetrievalCandidate::score).reversed());
        LOGGER.debug("Semantic reranker scored {} candidates", scored.size());
        return scored;
    }
}
