package ch.so.arp.rag.hybrid;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import ch.so.arp.rag.hybrid.store.Chunk;

/**
 * Answer with its context, citations and the optional agentic outputs.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueryResponse(
        String requestId,
        String query,
        String answer,
        String context,
        Citations citations,
        List<ChunkView> results,
        String toolUsed,
        String toolOutput,
        List<String> followUps,
        QueryPlan plan,
        TokenUsage usage) {

    /**
     * {@code used} chunks made it into the context window; {@code related} ones
     * were ranked but did not fit.
     */
    public record Citations(List<CitationRef> used, List<CitationRef> related) {

        static Citations empty() {
            return new Citations(List.of(), List.of());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CitationRef(String source, String chunkIndex) {

        static CitationRef of(Chunk chunk) {
            return new CitationRef(chunk.source(), String.valueOf(chunk.chunkIndex()));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ChunkView(String content, String tenantId, String docId, String source, int chunkIndex) {

        static ChunkView of(Chunk chunk) {
            return new ChunkView(chunk.content(), chunk.tenantId(), chunk.docId(), chunk.source(), chunk.chunkIndex());
        }
    }
}
