package ai.wer.aligner.alignment;

/**
 * The stop index of a reference range precedes its start index.
 */
public class InvalidRefRangeException extends AlignmentLookupException {

    public InvalidRefRangeException(int startRefIndex, int stopRefIndex) {
        super("Stop index must be greater than or equal to start index (start=" + startRefIndex
                + ", stop=" + stopRefIndex + ")");
    }
}
