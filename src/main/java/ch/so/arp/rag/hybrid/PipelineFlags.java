package ch.so.arp.rag.hybrid;

/**
 * Stage toggles resolved for one request.
 */
record PipelineFlags(
        boolean planning,
        boolean tools,
        boolean documentActions,
        boolean followUps,
        boolean semanticRerank,
        boolean includeCitations) {

    static PipelineFlags resolve(QueryRequest request, RagProperties.Features features) {
        return new PipelineFlags(
                request.enablePlanning() != null ? request.enablePlanning() : features.isPlanning(),
                request.enableTools() != null ? request.enableTools() : features.isTools(),
                features.isDocActions(),
                request.enableFollowups() != null ? request.enableFollowups() : features.isFollowups(),
                request.rerank(),
                request.includeCitations());
    }
}
