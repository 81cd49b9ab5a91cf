package ai.wer.aligner.text;

/**
 * Half-open character range {@code [start, end)} into an owning text.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span boundaries [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String slice(String text) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
