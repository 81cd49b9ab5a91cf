package ai.wer.aligner.pipeline;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Executor decorator that runs every task under the pipeline selection active when it was submitted.
 */
public class PipelineAwareExecutor implements Executor {

    private final Executor delegate;

    public PipelineAwareExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(PipelineContext.wrap(command));
    }
}
