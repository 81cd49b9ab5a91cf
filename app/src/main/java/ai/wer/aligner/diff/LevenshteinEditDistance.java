package ai.wer.aligner.diff;

import ai.wer.aligner.alignment.EditScript;
import ai.wer.aligner.alignment.EditStep;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Unit-cost Levenshtein distance over token texts with a minimal edit script recovered by backtracking.
 * Insertions carry the reference position they precede and deletions the hypothesis position they precede.
 */
public class LevenshteinEditDistance implements EditDistance {

    @Override
    public EditScript editScript(List<String> reference, List<String> hypothesis) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");
        int[][] costs = costMatrix(reference, hypothesis);

        List<EditStep> steps = new ArrayList<>(costs[reference.size()][hypothesis.size()]);
        int i = reference.size();
        int j = hypothesis.size();
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0 && reference.get(i - 1).equals(hypothesis.get(j - 1))
                    && costs[i - 1][j - 1] == costs[i][j]) {
                i--;
                j--;
            } else if (i > 0 && j > 0 && costs[i - 1][j - 1] + 1 == costs[i][j]) {
                steps.add(EditStep.substitute(i - 1, j - 1));
                i--;
                j--;
            } else if (i > 0 && costs[i - 1][j] + 1 == costs[i][j]) {
                steps.add(EditStep.delete(i - 1, j));
                i--;
            } else {
                steps.add(EditStep.insert(i, j - 1));
                j--;
            }
        }
        Collections.reverse(steps);
        return new EditScript(steps);
    }

    @Override
    public int distance(List<String> reference, List<String> hypothesis) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");
        return costMatrix(reference, hypothesis)[reference.size()][hypothesis.size()];
    }

    private int[][] costMatrix(List<String> reference, List<String> hypothesis) {
        int rows = reference.size() + 1;
        int cols = hypothesis.size() + 1;
        int[][] costs = new int[rows][cols];
        for (int i = 0; i < rows; i++) {
            costs[i][0] = i;
        }
        for (int j = 0; j < cols; j++) {
            costs[0][j] = j;
        }
        for (int i = 1; i < rows; i++) {
            for (int j = 1; j < cols; j++) {
                int cost = reference.get(i - 1).equals(hypothesis.get(j - 1)) ? 0 : 1;
                costs[i][j] = Math.min(Math.min(costs[i][j - 1] + 1, costs[i - 1][j] + 1), costs[i - 1][j - 1] + cost);
            }
        }
        return costs;
    }
}
