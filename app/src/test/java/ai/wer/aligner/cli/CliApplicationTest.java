package ai.wer.aligner.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.wer.aligner.config.ConfigLoader;
import ai.wer.aligner.dataset.TsvDatasetReader;
import ai.wer.aligner.pipeline.DefaultPipelines;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                DefaultPipelines.registry(), new TsvDatasetReader());
        CommandLine commandLine = new CommandLine(new CliArguments());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return application.run(args, commandLine);
    }

    @Test
    void reportsCountsAndRatesForSinglePair() {
        int exitCode = run("--ref", "The quick brown fox", "--hyp", "the quick brown dog",
                "--keyword", "quick brown", "--keyword", "fox");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("examples: 1")
                .contains("matches: 3 substitutions: 1 insertions: 0 deletions: 0")
                .contains("WER: 0.2500 (1/4)")
                .contains("CER: 0.1053 (2/19)")
                .contains("KWER[keywords]: 0.5000 (1/2)");
        assertThat(PipelineContext.current()).isEqualTo(PipelineSelection.defaults());
    }

    @Test
    void rawComparisonCountsCaseDifferences() {
        int exitCode = run("--ref", "The quick fox", "--hyp", "the quick fox", "--raw", "--show-alignment");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Op(SUBSTITUTE: \"the\" -> \"The\")")
                .contains("WER: 0.3333 (1/3)");
    }

    @Test
    void scoresTabSeparatedInput() throws IOException {
        Path file = tempDir.resolve("data.tsv");
        Files.writeString(file, "ref\thyp\tplaces\n"
                + "visit paris today\tvisit parish today\tparis\n"
                + "rome is old\trome is old\trome\n", StandardCharsets.UTF_8);

        int exitCode = run("--input", file.toString(), "--algorithm", "myers");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("examples: 2")
                .contains("WER: 0.1667 (1/6)")
                .contains("CER: 0.0357 (1/28)")
                .contains("KWER[places]: 0.5000 (1/2)");
    }

    @Test
    void unknownPipelineNameIsInvalidInput() {
        int exitCode = run("--ref", "a", "--hyp", "a", "--normalizer", "stemmer");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("'stemmer' not found in normalizers");
    }

    @Test
    void missingInputIsInvalidInput() {
        int exitCode = run("--ref", "a");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--ref and --hyp");
    }

    @Test
    void unknownOptionPrintsUsage() {
        int exitCode = run("--bogus");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Usage: wer-aligner");
    }

    @Test
    void helpIsPrinted() {
        int exitCode = run("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("--algorithm").contains("--keyword");
    }
}
