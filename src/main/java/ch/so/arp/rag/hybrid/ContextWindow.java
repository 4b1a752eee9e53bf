package ch.so.arp.rag.hybrid;

import java.util.List;

/**
 * Citation-tagged context text and the candidates it contains, in order.
 */
public record ContextWindow(String text, List<RetrievalCandidate> used) {
}
