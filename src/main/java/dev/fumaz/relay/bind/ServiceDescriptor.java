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
 * A {@link ServiceDescriptor} links a {@link ServiceKey} to the {@link Provider} producing it, the
 * {@link Lifetime} governing reuse and the keys the provider depends on.
 *
 * @param <T> the capability type
 */
public final class ServiceDescriptor<T> {

    private final @NotNull ServiceKey<T> key;
    private final @NotNull Provider<T> provider;
    private final @NotNull Lifetime lifetime;
    private final @NotNull List<ServiceKey<?>> dependencies;
    private final @Nullable Disposer<? super T> disposer;
    private final boolean externallyOwned;

    public ServiceDescriptor(@NotNull ServiceKey<T> key,
                             @NotNull Provider<T> provider,
                             @NotNull Lifetime lifetime,
                             @NotNull List<ServiceKey<?>> dependencies,
                             @Nullable Disposer<? super T> disposer,
                             boolean externallyOwned) {
        this.key = Objects.requireNonNull(key, "key");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(dependencies, "dependencies")));
        this.disposer = disposer;
        this.externallyOwned = externallyOwned;

        if (externallyOwned && lifetime != Lifetime.SINGLETON) {
            throw new IllegalArgumentException("Externally owned instances must be singletons: " + key.describe());
        }
    }

    public static <T> @NotNull ServiceDescriptor<T> instance(@NotNull ServiceKey<T> key, @NotNull T instance) {
        Objects.requireNonNull(instance, "instance");

        return new ServiceDescriptor<>(key, dependencies -> instance, Lifetime.SINGLETON,
                Collections.emptyList(), null, true);
    }

    public @NotNull ServiceKey<T> getKey() {
        return key;
    }

    public @NotNull Provider<T> getProvider() {
        return provider;
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    public @NotNull List<ServiceKey<?>> getDependencies() {
        return dependencies;
    }

    public @Nullable Disposer<? super T> getDisposer() {
        return disposer;
    }

    /**
     * @return {@code true} when the instance was handed to the container and must never be released by it
     */
    public boolean isExternallyOwned() {
        return externallyOwned;
    }

    @NotNull ServiceDescriptor<T> rekey(@NotNull ServiceKey<T> newKey) {
        return new ServiceDescriptor<>(newKey, provider, lifetime, dependencies, disposer, externallyOwned);
    }

    @Override
    public String toString() {
        return "ServiceDescriptor{" + key.describe() + ", " + lifetime + ", dependencies=" + dependencies + '}';
    }
}
