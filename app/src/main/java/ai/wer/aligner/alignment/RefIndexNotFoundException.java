package ai.wer.aligner.alignment;

/**
 * The requested reference index does not belong to any reference-bearing operation of the alignment.
 */
public class RefIndexNotFoundException extends AlignmentLookupException {

    private final int refIndex;

    public RefIndexNotFoundException(String boundary, int refIndex) {
        super(boundary + " index " + refIndex + " not found in alignment");
        this.refIndex = refIndex;
    }

    public int refIndex() {
        return refIndex;
    }
}
