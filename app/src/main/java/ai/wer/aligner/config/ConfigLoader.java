package ai.wer.aligner.config;

import ai.wer.aligner.cli.CliArguments;
import ai.wer.aligner.diff.EditAlgorithm;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_STANDARDIZER = "WER_STANDARDIZER";
    static final String ENV_TOKENIZER = "WER_TOKENIZER";
    static final String ENV_NORMALIZER = "WER_NORMALIZER";
    static final String ENV_ALGORITHM = "WER_ALGORITHM";
    static final String ENV_MATCH_MODE = "WER_MATCH_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        PipelineSelection pipeline = new PipelineSelection(
                firstNonBlank(arguments.standardizer(), ENV_STANDARDIZER, PipelineSelection.DEFAULT_NAME),
                firstNonBlank(arguments.tokenizer(), ENV_TOKENIZER, PipelineSelection.DEFAULT_NAME),
                firstNonBlank(arguments.normalizer(), ENV_NORMALIZER, PipelineSelection.DEFAULT_NAME));

        return new Config(
                Optional.ofNullable(arguments.input()),
                Optional.ofNullable(arguments.reference()),
                Optional.ofNullable(arguments.hypothesis()),
                arguments.keywords(),
                pipeline,
                resolveAlgorithm(arguments),
                resolveMatchMode(arguments),
                resolveLogFormat(arguments),
                arguments.showAlignment());
    }

    private EditAlgorithm resolveAlgorithm(CliArguments arguments) {
        EditAlgorithm cliAlgorithm = arguments.algorithm();
        if (cliAlgorithm != null) {
            return cliAlgorithm;
        }
        return environmentReader.getNonBlank(ENV_ALGORITHM)
                .map(EditAlgorithm::from)
                .orElse(EditAlgorithm.LEVENSHTEIN);
    }

    private MatchMode resolveMatchMode(CliArguments arguments) {
        if (arguments.raw()) {
            return MatchMode.RAW;
        }
        return environmentReader.getNonBlank(ENV_MATCH_MODE)
                .map(MatchMode::from)
                .orElse(MatchMode.NORMALIZED);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue.trim();
        }
        return environmentReader.getNonBlank(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
