package ai.wer.aligner.pipeline;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Once-initialized value. The supplier runs at most once; later calls return the stored result.
 */
public final class Lazy<T> implements Supplier<T> {

    private final Object lock = new Object();
    private Supplier<? extends T> supplier;
    private volatile T value;

    public Lazy(Supplier<? extends T> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
    }

    @Override
    public T get() {
        T result = value;
        if (result != null) {
            return result;
        }
        synchronized (lock) {
            if (value == null) {
                T computed = Objects.requireNonNull(supplier.get(), "Lazy supplier returned null");
                value = computed;
                supplier = null;
            }
            return value;
        }
    }

    public boolean isInitialized() {
        return value != null;
    }
}
