package dev.fumaz.relay.provider;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * The resolved dependencies handed to a {@link Provider}, in the order they were declared.
 */
public final class Dependencies {

    private static final Dependencies NONE = new Dependencies(List.of(), new Object[0]);

    private final @NotNull List<ServiceKey<?>> keys;
    private final @NotNull Object[] values;

    public Dependencies(@NotNull List<ServiceKey<?>> keys, @NotNull Object[] values) {
        if (keys.size() != values.length) {
            throw new IllegalArgumentException("Expected " + keys.size() + " values but got " + values.length);
        }

        this.keys = keys;
        this.values = values;
    }

    public static @NotNull Dependencies none() {
        return NONE;
    }

    public <D> @NotNull D get(int index, @NotNull Class<D> type) {
        Objects.checkIndex(index, values.length);
        return type.cast(values[index]);
    }

    public <D> @NotNull D get(@NotNull ServiceKey<D> key) {
        int index = keys.indexOf(key);

        if (index < 0) {
            throw new IllegalArgumentException(key.describe() + " is not a declared dependency");
        }

        return key.getType().cast(values[index]);
    }

    public int size() {
        return values.length;
    }
}
