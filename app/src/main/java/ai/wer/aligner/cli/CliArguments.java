package ai.wer.aligner.cli;

import ai.wer.aligner.config.LogFormat;
import ai.wer.aligner.diff.EditAlgorithm;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "wer-aligner", mixinStandardHelpOptions = true,
        description = "Aligns hypothesis transcripts against references and reports word and keyword error rates")
public class CliArguments {

    @CommandLine.Option(names = "--input", description = "Tab-separated file with ref, hyp and keyword columns", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--ref", description = "Reference text", paramLabel = "TEXT")
    private String reference;

    @CommandLine.Option(names = "--hyp", description = "Hypothesis text", paramLabel = "TEXT")
    private String hypothesis;

    @CommandLine.Option(names = "--keyword", description = "Keyword term to score in the reference (repeatable)", paramLabel = "TERM")
    private List<String> keywords = new ArrayList<>();

    @CommandLine.Option(names = "--standardizer", description = "Standardizer name", paramLabel = "NAME")
    private String standardizer;

    @CommandLine.Option(names = "--tokenizer", description = "Tokenizer name", paramLabel = "NAME")
    private String tokenizer;

    @CommandLine.Option(names = "--normalizer", description = "Normalizer name", paramLabel = "NAME")
    private String normalizer;

    @CommandLine.Option(names = "--raw", description = "Compare raw token text instead of normalized text")
    private boolean raw;

    @CommandLine.Option(names = "--algorithm", description = "Edit distance: levenshtein, myers or histogram", converter = EditAlgorithmConverter.class)
    private EditAlgorithm algorithm;

    @CommandLine.Option(names = "--show-alignment", description = "Print the operations of every example")
    private boolean showAlignment;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public String reference() {
        return reference;
    }

    public String hypothesis() {
        return hypothesis;
    }

    public List<String> keywords() {
        return keywords;
    }

    public String standardizer() {
        return standardizer;
    }

    public String tokenizer() {
        return tokenizer;
    }

    public String normalizer() {
        return normalizer;
    }

    public boolean raw() {
        return raw;
    }

    public EditAlgorithm algorithm() {
        return algorithm;
    }

    public boolean showAlignment() {
        return showAlignment;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
