package ch.so.arp.rag.hybrid;

/**
 * Stages of the query pipeline in execution order, with their span names.
 */
public enum PipelineStage {
    QUERY_RECEPTION("query_reception"),
    PLANNING("planning"),
    DENSE_RETRIEVAL("dense_retrieval"),
    LEXICAL_RERANK("bm25_retrieval"),
    SEMANTIC_RERANK("reranking"),
    CONTEXT_BUILDING("context_building"),
    TOOL_ROUTING("tool_routing"),
    GENERATION("generation"),
    FOLLOW_UPS("followups");

    private final String spanName;

    PipelineStage(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}
