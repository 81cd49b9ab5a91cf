package ai.wer.aligner.pipeline;

/**
 * Base type for failures to resolve the function of a pipeline stage. Callers distinguish the two causes through
 * {@link NoRegistryException} and {@link PipelineNotFoundException}.
 */
public abstract class PipelineResolutionException extends RuntimeException {

    private final PipelineStage stage;

    protected PipelineResolutionException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineStage stage() {
        return stage;
    }
}
