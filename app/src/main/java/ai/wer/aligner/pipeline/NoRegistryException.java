package ai.wer.aligner.pipeline;

/**
 * Raised when a derived value is requested from an instance that was never attached to anything owning a
 * {@link PipelineRegistry}.
 */
public class NoRegistryException extends PipelineResolutionException {

    public NoRegistryException(PipelineStage stage) {
        super(stage, "No " + stage.registryLabel() + " reachable: attach the owner to a dataset or registry first");
    }
}
