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

/**
 * Builds a {@link Decoration} for an already registered capability. The decorator keeps the lifetime of the
 * capability it wraps.
 *
 * @param <T> the capability type
 */
public class DecoratorBuilder<T> {

    private final @NotNull ServiceKey<T> key;
    private final @NotNull Consumer<Decoration<?>> sink;
    private @Nullable Disposer<? super T> disposer;

    public DecoratorBuilder(@NotNull ServiceKey<T> key, @NotNull Consumer<Decoration<?>> sink) {
        this.key = Objects.requireNonNull(key, "key");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public DecoratorBuilder<T> disposeWith(@NotNull Disposer<? super T> disposer) {
        this.disposer = Objects.requireNonNull(disposer, "disposer");
        return this;
    }

    public Decoration<T> with(@NotNull Function<? super T, ? extends T> decorator) {
        Objects.requireNonNull(decorator, "decorator");
        Class<T> type = key.getType();

        return build(dependencies -> decorator.apply(dependencies.get(0, type)), Collections.emptyList());
    }

    public <A> Decoration<T> with(@NotNull Class<A> extra,
                                  @NotNull BiFunction<? super T, ? super A, ? extends T> decorator) {
        Objects.requireNonNull(decorator, "decorator");
        Class<T> type = key.getType();

        return build(dependencies -> decorator.apply(dependencies.get(0, type), dependencies.get(1, extra)),
                Collections.singletonList(ServiceKey.of(extra)));
    }

    /**
     * Decorates with a provider that receives the wrapped instance at index {@code 0}, followed by
     * {@code extraDependencies}.
     */
    public Decoration<T> withProvider(@NotNull Provider<? extends T> provider,
                                      @NotNull ServiceKey<?>... extraDependencies) {
        Objects.requireNonNull(provider, "provider");

        return build(provider::provide, Arrays.asList(extraDependencies));
    }

    private Decoration<T> build(Provider<T> provider, List<ServiceKey<?>> extraDependencies) {
        Decoration<T> decoration = new Decoration<>(key, provider, extraDependencies, disposer);
        sink.accept(decoration);

        return decoration;
    }
}
