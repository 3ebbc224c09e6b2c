package dev.fumaz.relay.scope;

import dev.fumaz.relay.exception.DisposalException;
import dev.fumaz.relay.provider.Disposer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records the releasable instances owned by a scope or by the container root and releases them, last created
 * first, exactly once.
 */
public final class DisposalLedger {

    private static final Logger LOGGER = Logger.getLogger(DisposalLedger.class.getName());

    private final @NotNull String owner;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private boolean released;

    public DisposalLedger(@NotNull String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /**
     * Records an instance for release. Instances without a disposer that do not implement {@link AutoCloseable}
     * need no release and are ignored.
     * <p>
     * An instance recorded after the ledger was released is released immediately and must not be used.
     *
     * @throws IllegalStateException if the ledger was already released; a failure to release the late instance is
     *                               attached as suppressed
     */
    public <T> void record(@NotNull T instance, @Nullable Disposer<? super T> disposer) {
        Entry entry = entryFor(instance, disposer);

        if (entry == null) {
            return;
        }

        synchronized (entries) {
            if (!released) {
                entries.push(entry);
                return;
            }
        }

        LOGGER.warning(entry.description + " was created after " + owner + " closed, releasing it immediately");
        List<Exception> failures = new ArrayList<>();
        release(entry, failures);

        IllegalStateException exception = new IllegalStateException(entry.description + " was created after "
                + owner + " closed and has been released");

        for (Exception failure : failures) {
            exception.addSuppressed(failure);
        }

        throw exception;
    }

    /**
     * Releases every recorded instance in reverse creation order. A failing release does not prevent the remaining
     * ones; all failures are reported together once every instance has been released.
     *
     * @throws DisposalException if at least one release failed
     */
    public void release() {
        List<Entry> drained;

        synchronized (entries) {
            if (released) {
                return;
            }

            released = true;
            drained = new ArrayList<>(entries);
            entries.clear();
        }

        List<Exception> failures = new ArrayList<>();

        for (Entry entry : drained) {
            release(entry, failures);
        }

        rethrow(failures);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public boolean isReleased() {
        synchronized (entries) {
            return released;
        }
    }

    private void release(Entry entry, List<Exception> failures) {
        try {
            entry.action.run();
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Failed to release " + entry.description + " owned by " + owner, e);
            failures.add(e);
        }
    }

    private void rethrow(List<Exception> failures) {
        if (failures.isEmpty()) {
            return;
        }

        DisposalException exception = new DisposalException(failures.size() + " instance(s) owned by " + owner
                + " failed to release", failures.get(0));

        for (int i = 1; i < failures.size(); i++) {
            exception.addSuppressed(failures.get(i));
        }

        throw exception;
    }

    private static <T> @Nullable Entry entryFor(@NotNull T instance, @Nullable Disposer<? super T> disposer) {
        String description = instance.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(instance));

        if (disposer != null) {
            return new Entry(description, () -> disposer.dispose(instance));
        }

        if (instance instanceof AutoCloseable) {
            AutoCloseable closeable = (AutoCloseable) instance;
            return new Entry(description, closeable::close);
        }

        return null;
    }

    @FunctionalInterface
    private interface ReleaseAction {
        void run() throws Exception;
    }

    private static final class Entry {
        private final String description;
        private final ReleaseAction action;

        private Entry(String description, ReleaseAction action) {
            this.description = description;
            this.action = action;
        }
    }
}
