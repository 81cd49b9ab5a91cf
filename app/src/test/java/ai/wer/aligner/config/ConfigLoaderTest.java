package ai.wer.aligner.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.wer.aligner.cli.CliArguments;
import ai.wer.aligner.diff.EditAlgorithm;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--ref", "the quick brown fox",
                "--hyp", "the quick brown dog",
                "--keyword", "quick brown",
                "--keyword", "fox",
                "--tokenizer", "whitespace",
                "--raw",
                "--algorithm", "myers",
                "--log-format", "json",
                "--show-alignment");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.reference()).contains("the quick brown fox");
        assertThat(config.hypothesis()).contains("the quick brown dog");
        assertThat(config.keywords()).containsExactly("quick brown", "fox");
        assertThat(config.pipeline()).isEqualTo(new PipelineSelection("default", "whitespace", "default"));
        assertThat(config.matchMode()).isEqualTo(MatchMode.RAW);
        assertThat(config.algorithm()).isEqualTo(EditAlgorithm.MYERS);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.showAlignment()).isTrue();
        assertThat(config.input()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_STANDARDIZER, "none");
        envValues.put(ConfigLoader.ENV_NORMALIZER, " lowercase ");
        envValues.put(ConfigLoader.ENV_ALGORITHM, "histogram");
        envValues.put(ConfigLoader.ENV_MATCH_MODE, "raw");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "data.tsv");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.input()).contains(Path.of("data.tsv"));
        assertThat(config.pipeline()).isEqualTo(new PipelineSelection("none", "default", "lowercase"));
        assertThat(config.algorithm()).isEqualTo(EditAlgorithm.HISTOGRAM);
        assertThat(config.matchMode()).isEqualTo(MatchMode.RAW);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_TOKENIZER, "whitespace",
                ConfigLoader.ENV_ALGORITHM, "myers",
                ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--ref", "a", "--hyp", "b", "--tokenizer", "default", "--algorithm", "levenshtein",
                "--log-format", "text");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.pipeline().tokenizer()).isEqualTo("default");
        assertThat(config.algorithm()).isEqualTo(EditAlgorithm.LEVENSHTEIN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.matchMode()).isEqualTo(MatchMode.NORMALIZED);
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--ref", "a", "--hyp", "b");

        Config config = new ConfigLoader(key -> Optional.of("  ")).load(cliArguments);

        assertThat(config.pipeline()).isEqualTo(PipelineSelection.defaults());
        assertThat(config.algorithm()).isEqualTo(EditAlgorithm.LEVENSHTEIN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void requiresEitherInputOrPair() {
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        Throwable missing = catchThrowable(() -> loader.load(
                CommandLine.populateCommand(new CliArguments(), "--ref", "only")));
        Throwable both = catchThrowable(() -> loader.load(
                CommandLine.populateCommand(new CliArguments(), "--input", "x.tsv", "--ref", "a", "--hyp", "b")));
        Throwable keywordsWithInput = catchThrowable(() -> loader.load(
                CommandLine.populateCommand(new CliArguments(), "--input", "x.tsv", "--keyword", "a")));

        assertThat(missing).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--ref and --hyp");
        assertThat(both).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("cannot be combined");
        assertThat(keywordsWithInput).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--keyword");
    }

    @Test
    void invalidEnvironmentValueFails() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--ref", "a", "--hyp", "b");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                key -> ConfigLoader.ENV_MATCH_MODE.equals(key) ? Optional.of("fuzzy") : Optional.empty())
                .load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("fuzzy");
    }
}
