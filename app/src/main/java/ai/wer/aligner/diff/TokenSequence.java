package ai.wer.aligner.diff;

import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.Sequence;
import org.eclipse.jgit.diff.SequenceComparator;

/**
 * Token texts exposed to JGit's diff algorithms.
 */
final class TokenSequence extends Sequence {

    static final SequenceComparator<TokenSequence> COMPARATOR = new SequenceComparator<>() {
        @Override
        public boolean equals(TokenSequence a, int ai, TokenSequence b, int bi) {
            return a.get(ai).equals(b.get(bi));
        }

        @Override
        public int hash(TokenSequence seq, int ptr) {
            return seq.get(ptr).hashCode();
        }
    };

    private final List<String> tokens;

    TokenSequence(List<String> tokens) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
    }

    String get(int index) {
        return tokens.get(index);
    }

    @Override
    public int size() {
        return tokens.size();
    }
}
