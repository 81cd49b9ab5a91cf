package ai.wer.aligner.keyword;

import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import ai.wer.aligner.text.TokenList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds every contiguous occurrence of a multi-token keyword in a token sequence.
 *
 * <p>Candidates start as the positions of the first keyword token and are intersected with the shifted positions
 * of each following token, so the search costs one set operation per keyword token.
 */
public final class KeywordLocator {

    private KeywordLocator() {
    }

    /**
     * @return slices {@code [p, p + keywordTokens.size())} of {@code haystack}, ordered by {@code p}; empty when
     *         the keyword is empty or does not occur
     */
    public static List<TokenList> locate(List<String> keywordTokens, TokenList haystack, MatchMode mode) {
        return locate(keywordTokens, haystack, mode, PipelineContext.current());
    }

    /**
     * Same as {@link #locate(List, TokenList, MatchMode)}, comparing normalized haystack text under
     * {@code selection}.
     */
    public static List<TokenList> locate(List<String> keywordTokens, TokenList haystack, MatchMode mode,
                                         PipelineSelection selection) {
        Objects.requireNonNull(keywordTokens, "keywordTokens");
        Objects.requireNonNull(haystack, "haystack");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(selection, "selection");
        if (keywordTokens.isEmpty()) {
            return List.of();
        }

        TreeSet<Integer> candidates = new TreeSet<>(haystack.indices(keywordTokens.get(0), mode, selection));
        for (int offset = 1; offset < keywordTokens.size() && !candidates.isEmpty(); offset++) {
            Set<Integer> positions = haystack.indices(keywordTokens.get(offset), mode, selection);
            int shift = offset;
            candidates.removeIf(start -> !positions.contains(start + shift));
        }

        List<TokenList> matches = new ArrayList<>(candidates.size());
        for (int start : candidates) {
            matches.add(haystack.slice(start, start + keywordTokens.size()));
        }
        return List.copyOf(matches);
    }
}
