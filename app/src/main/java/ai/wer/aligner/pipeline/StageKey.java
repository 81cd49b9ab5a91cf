package ai.wer.aligner.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Cache key for a stage-derived value: the active names of every stage up to and including {@code stage}.
 */
public record StageKey(PipelineStage stage, List<String> names) {

    public StageKey {
        Objects.requireNonNull(stage, "stage");
        names = List.copyOf(Objects.requireNonNull(names, "names"));
        if (names.size() != stage.ordinal() + 1) {
            throw new IllegalArgumentException("Key for " + stage + " must hold " + (stage.ordinal() + 1)
                    + " names but got " + names.size());
        }
    }

    /**
     * Name of the function this key resolves for its own stage.
     */
    public String stageName() {
        return names.get(names.size() - 1);
    }
}
