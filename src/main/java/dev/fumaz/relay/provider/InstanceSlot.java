package dev.fumaz.relay.provider;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.function.Supplier;

/**
 * Holds a lazily created instance. The first caller constructs it under a lock, later callers read it without
 * locking.
 *
 * @param <T> the type of the instance
 */
public final class InstanceSlot<T> {

    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(InstanceSlot.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private Object instance;
    private final Object lock = new Object();

    /**
     * Returns the held instance, creating it with {@code supplier} if this is the first call. If the supplier throws
     * the slot stays empty and a later call tries again.
     */
    public @NotNull T getOrCreate(@NotNull Supplier<T> supplier) {
        T local = get();

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = get();

            if (local == null) {
                local = supplier.get();

                if (local == null) {
                    throw new IllegalStateException("Slot supplier produced null");
                }

                INSTANCE_HANDLE.setRelease(this, local);
            }

            return local;
        }
    }

    @SuppressWarnings("unchecked")
    public T get() {
        return (T) INSTANCE_HANDLE.getAcquire(this);
    }

    public boolean isFilled() {
        return get() != null;
    }
}
