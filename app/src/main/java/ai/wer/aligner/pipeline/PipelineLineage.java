package ai.wer.aligner.pipeline;

import java.util.Optional;

/**
 * Anything that can reach a {@link PipelineRegistry} through its owners.
 */
@FunctionalInterface
public interface PipelineLineage {

    Optional<PipelineRegistry> pipelines();

    static PipelineLineage of(PipelineRegistry registry) {
        Optional<PipelineRegistry> resolved = Optional.of(registry);
        return () -> resolved;
    }

    static PipelineLineage detached() {
        return Optional::empty;
    }
}
