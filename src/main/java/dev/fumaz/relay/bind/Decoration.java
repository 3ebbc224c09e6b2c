package dev.fumaz.relay.bind;

import dev.fumaz.relay.provider.Disposer;
import dev.fumaz.relay.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A decorator waiting to be applied to a registered capability. Its provider receives the decorated instance as
 * dependency {@code 0}, followed by {@link #getExtraDependencies()}.
 *
 * @param <T> the capability type
 */
public final class Decoration<T> {

    private final @NotNull ServiceKey<T> key;
    private final @NotNull Provider<T> provider;
    private final @NotNull List<ServiceKey<?>> extraDependencies;
    private final @Nullable Disposer<? super T> disposer;

    public Decoration(@NotNull ServiceKey<T> key,
                      @NotNull Provider<T> provider,
                      @NotNull List<ServiceKey<?>> extraDependencies,
                      @Nullable Disposer<? super T> disposer) {
        this.key = Objects.requireNonNull(key, "key");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.extraDependencies = Collections.unmodifiableList(new ArrayList<>(extraDependencies));
        this.disposer = disposer;
    }

    public @NotNull ServiceKey<T> getKey() {
        return key;
    }

    public @NotNull Provider<T> getProvider() {
        return provider;
    }

    public @NotNull List<ServiceKey<?>> getExtraDependencies() {
        return extraDependencies;
    }

    public @Nullable Disposer<? super T> getDisposer() {
        return disposer;
    }
}
