package ch.so.arp.rag.hybrid;

/**
 * A collaborator failed while the pipeline was in {@link #getStage()}. The
 * cause is one of {@link EmbeddingUnavailableException},
 * {@link GenerationUnavailableException} or
 * {@link ch.so.arp.rag.hybrid.store.StoreUnavailableException}.
 */
public class PipelineStageException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineStageException(PipelineStage stage, RuntimeException cause) {
        super("Stage " + stage.spanName() + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
