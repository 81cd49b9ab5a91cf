package ai.wer.aligner.cli;

import ai.wer.aligner.alignment.Alignment;
import ai.wer.aligner.config.Config;
import ai.wer.aligner.config.ConfigLoader;
import ai.wer.aligner.config.SystemEnvironmentReader;
import ai.wer.aligner.dataset.Dataset;
import ai.wer.aligner.dataset.Example;
import ai.wer.aligner.dataset.TsvDatasetReader;
import ai.wer.aligner.logging.LoggingConfigurator;
import ai.wer.aligner.metrics.CharacterErrorRate;
import ai.wer.aligner.metrics.ErrorRate;
import ai.wer.aligner.metrics.KeywordErrorRate;
import ai.wer.aligner.metrics.WordErrorRate;
import ai.wer.aligner.pipeline.DefaultPipelines;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineRegistry;
import ai.wer.aligner.pipeline.PipelineResolutionException;
import ai.wer.aligner.pipeline.PipelineScope;
import ai.wer.aligner.pipeline.PipelineSelection;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and metric reporting.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final String CLI_VOCABULARY = "keywords";
    static final String MDC_PIPELINE = "pipeline";

    private final ConfigLoader configLoader;
    private final PipelineRegistry registry;
    private final TsvDatasetReader datasetReader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), DefaultPipelines.registry(), new TsvDatasetReader());
    }

    CliApplication(ConfigLoader configLoader, PipelineRegistry registry, TsvDatasetReader datasetReader) {
        this.configLoader = configLoader;
        this.registry = registry;
        this.datasetReader = datasetReader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        return run(args, new CommandLine(new CliArguments()));
    }

    int run(String[] args, CommandLine commandLine) {
        CliArguments cliArguments = commandLine.getCommand();
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
            registry.validate(config.pipeline());
        } catch (IllegalArgumentException | PipelineResolutionException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Scoring with pipeline {} ({} match, {} edit distance)",
                config.pipeline(), config.matchMode(), config.algorithm());

        Dataset dataset = loadDataset(config);
        MDC.put(MDC_PIPELINE, config.pipeline().toString());
        try (PipelineScope ignored = PipelineContext.activate(config.pipeline())) {
            report(config, dataset, commandLine.getOut());
        } finally {
            MDC.remove(MDC_PIPELINE);
        }
        return 0;
    }

    private Dataset loadDataset(Config config) {
        Dataset dataset = new Dataset(registry, config.algorithm().create());
        if (config.input().isPresent()) {
            return datasetReader.read(config.input().get(), dataset);
        }
        Map<String, List<String>> keywords = config.keywords().isEmpty()
                ? Map.of()
                : Map.of(CLI_VOCABULARY, config.keywords());
        dataset.add(config.reference().orElseThrow(), config.hypothesis().orElseThrow(), keywords);
        return dataset;
    }

    private void report(Config config, Dataset dataset, PrintWriter out) {
        PipelineSelection selection = config.pipeline();
        int matches = 0;
        int substitutions = 0;
        int insertions = 0;
        int deletions = 0;
        for (Example example : dataset) {
            Alignment alignment = example.alignment(config.matchMode(), selection);
            matches += alignment.numMatches();
            substitutions += alignment.numSubstitutions();
            insertions += alignment.numInsertions();
            deletions += alignment.numDeletions();
            if (config.showAlignment()) {
                out.println(example);
                alignment.forEach(op -> out.println("  " + op));
            }
        }
        out.printf(Locale.ROOT, "examples: %d%n", dataset.size());
        out.printf(Locale.ROOT, "matches: %d substitutions: %d insertions: %d deletions: %d%n",
                matches, substitutions, insertions, deletions);
        out.println(formatRate("WER", new WordErrorRate(config.matchMode()).of(dataset, selection)));
        out.println(formatRate("CER", new CharacterErrorRate(config.matchMode()).of(dataset, selection)));
        for (String vocabulary : dataset.vocabularies()) {
            ErrorRate rate = new KeywordErrorRate(vocabulary, config.matchMode()).of(dataset, selection);
            out.println(formatRate("KWER[" + vocabulary + "]", rate));
        }
        out.flush();
    }

    private static String formatRate(String label, ErrorRate rate) {
        return String.format(Locale.ROOT, "%s: %.4f (%d/%d)", label, rate.value(), rate.errors(), rate.total());
    }
}
