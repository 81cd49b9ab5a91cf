package ai.wer.aligner.pipeline;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ambient pipeline selection for the calling thread.
 *
 * <p>Values are confined to the thread that activated them. Work handed to another thread must be wrapped with
 * {@link #wrap(Runnable)} or {@link #wrap(Callable)} (or submitted through {@link PipelineAwareExecutor}) so it
 * runs under the submitter's selection and leaves the worker thread as it found it. Work fanned out to pools the
 * caller does not control, such as parallel streams, should read {@link #current()} once and pass the selection
 * to the overloads that take a {@link PipelineSelection}.
 */
public final class PipelineContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineContext.class);

    private static final ThreadLocal<PipelineSelection> CURRENT = new ThreadLocal<>();

    private PipelineContext() {
    }

    public static PipelineSelection current() {
        PipelineSelection selection = CURRENT.get();
        return selection == null ? PipelineSelection.defaults() : selection;
    }

    public static PipelineScope activate(PipelineSelection selection) {
        Objects.requireNonNull(selection, "selection");
        PipelineSelection previous = current();
        CURRENT.set(selection);
        LOGGER.trace("Activated pipeline {} (previous {})", selection, previous);
        return new PipelineScope(previous, selection);
    }

    public static PipelineScope activate(String standardizer, String tokenizer, String normalizer) {
        return activate(new PipelineSelection(standardizer, tokenizer, normalizer));
    }

    public static <T> T callWith(PipelineSelection selection, Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        try (PipelineScope ignored = activate(selection)) {
            return action.get();
        }
    }

    public static void runWith(PipelineSelection selection, Runnable action) {
        Objects.requireNonNull(action, "action");
        try (PipelineScope ignored = activate(selection)) {
            action.run();
        }
    }

    /**
     * Binds {@code task} to the selection active on the calling thread at wrap time.
     */
    public static Runnable wrap(Runnable task) {
        Objects.requireNonNull(task, "task");
        PipelineSelection captured = current();
        return () -> runWith(captured, task);
    }

    /**
     * Binds {@code task} to the selection active on the calling thread at wrap time.
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        PipelineSelection captured = current();
        return () -> {
            try (PipelineScope ignored = activate(captured)) {
                return task.call();
            }
        };
    }

    static void restore(PipelineSelection previous) {
        if (previous == null || previous.equals(PipelineSelection.defaults())) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
