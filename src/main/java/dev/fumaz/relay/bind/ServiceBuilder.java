package dev.fumaz.relay.bind;

import dev.fumaz.relay.provider.Disposer;
import dev.fumaz.relay.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link ServiceBuilder} is used to create a {@link ServiceDescriptor}. Unless told otherwise the capability is
 * {@link Lifetime#TRANSIENT transient}.
 *
 * @param <T> the capability type
 */
public class ServiceBuilder<T> {

    private final @NotNull Class<T> type;
    private final @NotNull Consumer<ServiceDescriptor<?>> sink;

    private @NotNull String name = "";
    private @NotNull Lifetime lifetime = Lifetime.TRANSIENT;
    private @Nullable Disposer<? super T> disposer;

    public ServiceBuilder(@NotNull Class<T> type, @NotNull Consumer<ServiceDescriptor<?>> sink) {
        this.type = Objects.requireNonNull(type, "type");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ServiceBuilder<T> named(@NotNull String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    public ServiceBuilder<T> in(@NotNull Lifetime lifetime) {
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        return this;
    }

    public ServiceBuilder<T> singleton() {
        return in(Lifetime.SINGLETON);
    }

    public ServiceBuilder<T> scoped() {
        return in(Lifetime.SCOPED);
    }

    /**
     * Releases instances with the given callback instead of {@link AutoCloseable#close()}.
     */
    public ServiceBuilder<T> disposeWith(@NotNull Disposer<? super T> disposer) {
        this.disposer = Objects.requireNonNull(disposer, "disposer");
        return this;
    }

    public ServiceDescriptor<T> to(@NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return toProvider(dependencies -> supplier.get());
    }

    public <A> ServiceDescriptor<T> to(@NotNull Class<A> first,
                                       @NotNull Function<? super A, ? extends T> factory) {
        Objects.requireNonNull(factory, "factory");

        return toProvider(dependencies -> factory.apply(dependencies.get(0, first)), ServiceKey.of(first));
    }

    public <A, B> ServiceDescriptor<T> to(@NotNull Class<A> first,
                                          @NotNull Class<B> second,
                                          @NotNull BiFunction<? super A, ? super B, ? extends T> factory) {
        Objects.requireNonNull(factory, "factory");

        return toProvider(dependencies -> factory.apply(dependencies.get(0, first), dependencies.get(1, second)),
                ServiceKey.of(first), ServiceKey.of(second));
    }

    public <A, B, C> ServiceDescriptor<T> to(@NotNull Class<A> first,
                                             @NotNull Class<B> second,
                                             @NotNull Class<C> third,
                                             @NotNull TriFunction<? super A, ? super B, ? super C, ? extends T> factory) {
        Objects.requireNonNull(factory, "factory");

        return toProvider(dependencies -> factory.apply(dependencies.get(0, first), dependencies.get(1, second),
                        dependencies.get(2, third)),
                ServiceKey.of(first), ServiceKey.of(second), ServiceKey.of(third));
    }

    /**
     * Binds to a provider receiving the given keys, resolved, in the same order.
     */
    public ServiceDescriptor<T> toProvider(@NotNull Provider<? extends T> provider,
                                           @NotNull ServiceKey<?>... dependencies) {
        Objects.requireNonNull(provider, "provider");

        return build(provider::provide, Arrays.asList(dependencies), false);
    }

    /**
     * Binds to an existing instance. The container hands it out as a singleton and never releases it.
     */
    public ServiceDescriptor<T> toInstance(@NotNull T instance) {
        Objects.requireNonNull(instance, "instance");
        this.lifetime = Lifetime.SINGLETON;

        return build(Provider.instance(instance), Collections.emptyList(), true);
    }

    private ServiceDescriptor<T> build(Provider<T> provider, List<ServiceKey<?>> dependencies, boolean external) {
        ServiceDescriptor<T> descriptor = new ServiceDescriptor<>(ServiceKey.named(type, name), provider, lifetime,
                dependencies, disposer, external);
        sink.accept(descriptor);

        return descriptor;
    }

    @FunctionalInterface
    public interface TriFunction<A, B, C, R> {
        R apply(A first, B second, C third);
    }
}
