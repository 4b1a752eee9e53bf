package ch.so.arp.rag.hybrid;

import java.util.List;

/**
 * Strategy interface that reorders an already retrieved candidate set. Scores
 * are only comparable within one call. Equal scores keep input order.
 */
public interface Reranker {

    List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates);
}
