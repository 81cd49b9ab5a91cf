package ai.wer.aligner.metrics;

/**
 * Error count over a total. With a zero total the rate is the error count itself.
 */
public record ErrorRate(int errors, int total) {

    public ErrorRate {
        if (errors < 0 || total < 0) {
            throw new IllegalArgumentException("errors and total must be greater than or equal to zero");
        }
    }

    public static ErrorRate zero() {
        return new ErrorRate(0, 0);
    }

    public ErrorRate plus(ErrorRate other) {
        return new ErrorRate(errors + other.errors, total + other.total);
    }

    public double value() {
        return total == 0 ? errors : (double) errors / total;
    }
}
