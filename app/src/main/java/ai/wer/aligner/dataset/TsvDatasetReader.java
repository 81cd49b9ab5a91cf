package ai.wer.aligner.dataset;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads examples from a tab-separated file with a header row.
 *
 * <p>The header must name a {@code ref} and a {@code hyp} column. Every other column is a keyword vocabulary
 * whose cells hold terms separated by {@code ;}. Blank lines are skipped.
 */
public class TsvDatasetReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TsvDatasetReader.class);

    static final String REF_COLUMN = "ref";
    static final String HYP_COLUMN = "hyp";
    private static final String TERM_SEPARATOR = ";";

    public Dataset read(Path file, Dataset target) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(target, "target");
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read dataset: " + file, ex);
        }
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Dataset file is empty: " + file);
        }

        List<String> header = Arrays.stream(lines.get(0).split("\t", -1))
                .map(String::trim)
                .collect(Collectors.toList());
        int refColumn = requireColumn(header, REF_COLUMN, file);
        int hypColumn = requireColumn(header, HYP_COLUMN, file);

        int added = 0;
        for (int lineNumber = 2; lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1);
            if (line.isBlank()) {
                continue;
            }
            String[] cells = line.split("\t", -1);
            if (cells.length != header.size()) {
                throw new IllegalArgumentException(file + ":" + lineNumber + " has " + cells.length
                        + " columns but the header has " + header.size());
            }
            Map<String, List<String>> keywords = new LinkedHashMap<>();
            for (int column = 0; column < header.size(); column++) {
                if (column == refColumn || column == hypColumn) {
                    continue;
                }
                List<String> terms = Arrays.stream(cells[column].split(TERM_SEPARATOR))
                        .map(String::trim)
                        .filter(term -> !term.isEmpty())
                        .collect(Collectors.toList());
                if (!terms.isEmpty()) {
                    keywords.put(header.get(column), terms);
                }
            }
            target.add(cells[refColumn], cells[hypColumn], keywords);
            added++;
        }
        LOGGER.info("Loaded {} examples from {}", added, file);
        return target;
    }

    private static int requireColumn(List<String> header, String name, Path file) {
        int index = header.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Dataset " + file + " has no '" + name + "' column");
        }
        return index;
    }
}
