package dev.fumaz.relay.bind;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Identity of a capability: its type plus an optional name.
 * <p>
 * Decorated capabilities additionally own hidden keys for the inner links of their chain, see
 * {@link ServiceRegistry#decorate(Decoration)}.
 *
 * @param <T> the capability type
 */
public final class ServiceKey<T> {

    private static final ClassValue<ServiceKey<?>> DEFAULT_KEYS = new ClassValue<>() {
        @Override
        protected ServiceKey<?> computeValue(Class<?> type) {
            return new ServiceKey<>(type, "", 0);
        }
    };

    private final @NotNull Class<T> type;
    private final @NotNull String name;
    private final int layer;

    private ServiceKey(@NotNull Class<T> type, @NotNull String name, int layer) {
        this.type = type;
        this.name = name;
        this.layer = layer;
    }

    @SuppressWarnings("unchecked")
    public static <T> @NotNull ServiceKey<T> of(@NotNull Class<T> type) {
        return (ServiceKey<T>) DEFAULT_KEYS.get(Objects.requireNonNull(type, "type"));
    }

    public static <T> @NotNull ServiceKey<T> named(@NotNull Class<T> type, @NotNull String name) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");

        if (name.isEmpty()) {
            return of(type);
        }

        return new ServiceKey<>(type, name, 0);
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    public @NotNull String getName() {
        return name;
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }

    /**
     * @return {@code true} for the hidden keys holding the inner producers of a decorated capability
     */
    public boolean isDecoratedLayer() {
        return layer > 0;
    }

    /**
     * @return the public key this key belongs to, which is this key itself unless it is a decorated layer
     */
    public @NotNull ServiceKey<T> getCapability() {
        if (layer == 0) {
            return this;
        }

        return named(type, name);
    }

    @NotNull ServiceKey<T> layer(int layer) {
        if (layer <= 0) {
            throw new IllegalArgumentException("Decoration layers start at 1");
        }

        return new ServiceKey<>(type, name, layer);
    }

    public @NotNull String describe() {
        return type.getName() + (name.isEmpty() ? "" : " named '" + name + "'")
                + (layer == 0 ? "" : " (decorated layer " + layer + ")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ServiceKey)) {
            return false;
        }

        ServiceKey<?> that = (ServiceKey<?>) o;
        return type == that.type && layer == that.layer && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + name.hashCode();
        result = 31 * result + layer;
        return result;
    }

    @Override
    public String toString() {
        return describe();
    }
}
