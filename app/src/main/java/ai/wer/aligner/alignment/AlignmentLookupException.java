package ai.wer.aligner.alignment;

/**
 * Recoverable failure of a reference-index range query.
 */
public abstract class AlignmentLookupException extends RuntimeException {

    protected AlignmentLookupException(String message) {
        super(message);
    }
}
