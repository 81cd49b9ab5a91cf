package ai.wer.aligner.config;

import ai.wer.aligner.diff.EditAlgorithm;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * <p>Input is either a tab-separated file or a single reference/hypothesis pair; {@code keywords} apply to the
 * single pair only.
 */
public record Config(
        Optional<Path> input,
        Optional<String> reference,
        Optional<String> hypothesis,
        List<String> keywords,
        PipelineSelection pipeline,
        EditAlgorithm algorithm,
        MatchMode matchMode,
        LogFormat logFormat,
        boolean showAlignment
) {

    public Config {
        input = input == null ? Optional.empty() : input;
        reference = reference == null ? Optional.empty() : reference;
        hypothesis = hypothesis == null ? Optional.empty() : hypothesis;
        keywords = keywords == null
                ? List.of()
                : keywords.stream()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(matchMode, "matchMode");
        Objects.requireNonNull(logFormat, "logFormat");
        if (input.isPresent() && (reference.isPresent() || hypothesis.isPresent())) {
            throw new IllegalArgumentException("--input cannot be combined with --ref or --hyp");
        }
        if (input.isEmpty() && (reference.isEmpty() || hypothesis.isEmpty())) {
            throw new IllegalArgumentException("either --input or both --ref and --hyp must be provided");
        }
        if (input.isPresent() && !keywords.isEmpty()) {
            throw new IllegalArgumentException("--keyword applies to --ref/--hyp only; use keyword columns with --input");
        }
    }
}
