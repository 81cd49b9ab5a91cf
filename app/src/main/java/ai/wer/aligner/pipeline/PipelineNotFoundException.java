package ai.wer.aligner.pipeline;

import java.util.Set;
import java.util.TreeSet;

/**
 * Raised when the active name of a stage is not registered.
 */
public class PipelineNotFoundException extends PipelineResolutionException {

    private final String name;

    public PipelineNotFoundException(PipelineStage stage, String name, Set<String> available) {
        super(stage, "'" + name + "' not found in " + stage.registryLabel() + " (available: "
                + String.join(", ", new TreeSet<>(available)) + ")");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
