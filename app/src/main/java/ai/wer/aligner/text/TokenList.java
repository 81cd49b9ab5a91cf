package ai.wer.aligner.text;

import ai.wer.aligner.pipeline.Lazy;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.pipeline.PipelineStage;
import ai.wer.aligner.pipeline.StageCache;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable ordered sequence of tokens with position lookups.
 */
public final class TokenList implements Iterable<Token> {

    private static final TokenList EMPTY = new TokenList(List.of());

    private final List<Token> tokens;
    private final Lazy<Map<Integer, Integer>> startMapping = new Lazy<>(() -> offsetMapping(true));
    private final Lazy<Map<Integer, Integer>> endMapping = new Lazy<>(() -> offsetMapping(false));
    private final Lazy<Map<String, Set<Integer>>> rawPositions =
            new Lazy<>(() -> positions(MatchMode.RAW, PipelineSelection.defaults()));
    private final StageCache<Void, Map<String, Set<Integer>>> normalizedPositions =
            StageCache.keyedOn(PipelineStage.NORMALIZE);

    private TokenList(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static TokenList of(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            return EMPTY;
        }
        return new TokenList(List.copyOf(tokens));
    }

    public static TokenList of(Token... tokens) {
        return of(List.of(tokens));
    }

    public static TokenList empty() {
        return EMPTY;
    }

    /**
     * Builds tokens for {@code spans} cut out of {@code origin}.
     */
    static TokenList fromSpans(String origin, List<Span> spans, Text source) {
        List<Token> tokens = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            tokens.add(Token.slice(origin, spans.get(i), i, source));
        }
        return of(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public Token first() {
        return tokens.get(0);
    }

    public Token last() {
        return tokens.get(tokens.size() - 1);
    }

    public List<Token> asList() {
        return tokens;
    }

    public Stream<Token> stream() {
        return tokens.stream();
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    /**
     * Tokens in {@code [fromIndex, toIndex)}. Tokens keep their original {@link Token#index()}.
     */
    public TokenList slice(int fromIndex, int toIndex) {
        return of(tokens.subList(fromIndex, toIndex));
    }

    public List<String> raw() {
        return texts(MatchMode.RAW);
    }

    public List<String> normalized() {
        return normalized(PipelineContext.current());
    }

    public List<String> normalized(PipelineSelection selection) {
        return texts(MatchMode.NORMALIZED, selection);
    }

    public List<String> texts(MatchMode mode) {
        return texts(mode, PipelineContext.current());
    }

    public List<String> texts(MatchMode mode, PipelineSelection selection) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(selection, "selection");
        List<String> texts = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            texts.add(token.text(mode, selection));
        }
        return Collections.unmodifiableList(texts);
    }

    public Optional<Token> startIndexToToken(int charIndex) {
        return Optional.ofNullable(startMapping.get().get(charIndex)).map(tokens::get);
    }

    public Optional<Token> endIndexToToken(int charIndex) {
        return Optional.ofNullable(endMapping.get().get(charIndex)).map(tokens::get);
    }

    /**
     * Positions in this list whose token text equals {@code text} under {@code mode}. The normalized index is
     * built once per active pipeline.
     */
    public Set<Integer> indices(String text, MatchMode mode) {
        return indices(text, mode, PipelineContext.current());
    }

    public Set<Integer> indices(String text, MatchMode mode, PipelineSelection selection) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(selection, "selection");
        Map<String, Set<Integer>> mapping = mode == MatchMode.RAW
                ? rawPositions.get()
                : normalizedPositions.get(selection, () -> positions(MatchMode.NORMALIZED, selection));
        return mapping.getOrDefault(text, Set.of());
    }

    public List<String> ngrams(int n, MatchMode mode) {
        return ngrams(n, mode, PipelineContext.current());
    }

    public List<String> ngrams(int n, MatchMode mode, PipelineSelection selection) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be a positive integer");
        }
        if (n == 1) {
            return texts(mode, selection);
        }
        List<String> ngrams = new ArrayList<>();
        for (int i = 0; i + n <= tokens.size(); i++) {
            ngrams.add(slice(i, i + n).joined(mode, selection));
        }
        return ngrams;
    }

    /**
     * Joins token texts, inserting a single space wherever the source had a gap between tokens.
     */
    public String joined(MatchMode mode) {
        return joined(mode, PipelineContext.current());
    }

    public String joined(MatchMode mode, PipelineSelection selection) {
        StringBuilder builder = new StringBuilder();
        int previousEnd = -1;
        for (Token token : tokens) {
            if (previousEnd >= 0 && token.start() > previousEnd) {
                builder.append(' ');
            }
            builder.append(token.text(mode, selection));
            previousEnd = token.end();
        }
        return builder.toString().strip();
    }

    private Map<Integer, Integer> offsetMapping(boolean start) {
        Map<Integer, Integer> mapping = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            mapping.put(start ? token.start() : token.end(), i);
        }
        return Collections.unmodifiableMap(mapping);
    }

    private Map<String, Set<Integer>> positions(MatchMode mode, PipelineSelection selection) {
        Map<String, Set<Integer>> mapping = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            mapping.computeIfAbsent(tokens.get(i).text(mode, selection), key -> new TreeSet<>()).add(i);
        }
        mapping.replaceAll((key, value) -> Collections.unmodifiableSet(value));
        return Collections.unmodifiableMap(mapping);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof TokenList list && tokens.equals(list.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        String shown = tokens.stream().limit(60).map(Token::toString).collect(Collectors.joining(", "));
        return "TokenList([" + shown + (tokens.size() > 60 ? ", ..." : "") + "])";
    }
}
