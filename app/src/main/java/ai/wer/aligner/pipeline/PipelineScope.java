package ai.wer.aligner.pipeline;

/**
 * Handle returned by {@link PipelineContext#activate(PipelineSelection)}. Closing it puts back the selection that
 * was active before; use it with try-with-resources.
 *
 * <p>{@link #close()} must run on the thread that called {@code activate}. Closing on another thread restores the
 * previous selection on that thread instead.
 */
public final class PipelineScope implements AutoCloseable {

    private final PipelineSelection previous;
    private final PipelineSelection active;
    private boolean closed;

    PipelineScope(PipelineSelection previous, PipelineSelection active) {
        this.previous = previous;
        this.active = active;
    }

    public PipelineSelection active() {
        return active;
    }

    public PipelineSelection previous() {
        return previous;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        PipelineContext.restore(previous);
    }
}
