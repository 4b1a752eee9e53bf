package ch.so.arp.rag.hybrid;

import java.util.List;

/**
 * Strategy abstraction used to compute embeddings. Implementations can either
 * call a remote embedding API or provide deterministic placeholders that are
 * suited for tests and local development.
 */
public interface Embedder {

    /**
     * Create one embedding vector per text, in input order.
     *
     * @param texts the texts to embed
     * @return the embeddings represented as float arrays
     * @throws EmbeddingUnavailableException if the embedding backend fails
     */
    List<float[]> embed(List<String> texts);
}
