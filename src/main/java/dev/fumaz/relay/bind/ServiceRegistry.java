package dev.fumaz.relay.bind;

import dev.fumaz.relay.exception.ConfigurationException;
import dev.fumaz.relay.exception.UnresolvedCapabilityException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Holds at most one {@link ServiceDescriptor} per {@link ServiceKey}.
 * <p>
 * The registry is written while the container is being built and {@link #seal() sealed} afterwards, from then on
 * it is read without locking.
 */
public final class ServiceRegistry {

    private static final Logger LOGGER = Logger.getLogger(ServiceRegistry.class.getName());

    private final boolean allowOverrides;
    private final Map<ServiceKey<?>, ServiceDescriptor<?>> descriptors = new LinkedHashMap<>();
    private final Map<ServiceKey<?>, Integer> layers = new HashMap<>();
    private volatile boolean sealed;

    public ServiceRegistry(boolean allowOverrides) {
        this.allowOverrides = allowOverrides;
    }

    /**
     * Registers a descriptor. A second registration for the same key replaces the first one together with its
     * decorations, unless the registry was created to reject overrides.
     *
     * @throws ConfigurationException if the key is already registered and overrides are rejected
     */
    public synchronized void register(@NotNull ServiceDescriptor<?> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        ensureOpen();

        ServiceKey<?> key = descriptor.getKey();

        if (descriptors.containsKey(key)) {
            if (!allowOverrides) {
                throw new ConfigurationException("Duplicate registration for " + key.describe()
                        + "; use decorate() to wrap it instead");
            }

            LOGGER.warning("Registration for " + key.describe() + " overrides an earlier one");
            dropLayers(key);
        }

        descriptors.put(key, descriptor);
    }

    /**
     * Wraps the current producer of a capability. The current descriptor moves to a hidden layer key and the
     * decorator takes its place, receiving the hidden key as its first dependency.
     *
     * @throws ConfigurationException if nothing is registered for the capability yet
     */
    public synchronized <T> void decorate(@NotNull Decoration<T> decoration) {
        Objects.requireNonNull(decoration, "decoration");
        ensureOpen();

        ServiceKey<T> key = decoration.getKey();
        ServiceDescriptor<T> current = lookup(key).orElseThrow(() ->
                new ConfigurationException("Cannot decorate " + key.describe() + " before it is registered"));

        int layer = layers.merge(key, 1, Integer::sum);
        ServiceKey<T> inner = key.layer(layer);
        descriptors.put(inner, current.rekey(inner));

        List<ServiceKey<?>> dependencies = new ArrayList<>(decoration.getExtraDependencies().size() + 1);
        dependencies.add(inner);
        dependencies.addAll(decoration.getExtraDependencies());

        descriptors.put(key, new ServiceDescriptor<>(key, decoration.getProvider(), current.getLifetime(),
                dependencies, decoration.getDisposer(), false));
    }

    @SuppressWarnings("unchecked")
    public <T> @NotNull Optional<ServiceDescriptor<T>> lookup(@NotNull ServiceKey<T> key) {
        return Optional.ofNullable((ServiceDescriptor<T>) descriptors.get(key));
    }

    public <T> @NotNull ServiceDescriptor<T> require(@NotNull ServiceKey<T> key) {
        return lookup(key).orElseThrow(() ->
                new UnresolvedCapabilityException(key, "No registration found for " + key.describe()));
    }

    public boolean contains(@NotNull ServiceKey<?> key) {
        return descriptors.containsKey(key);
    }

    /**
     * @return every descriptor in registration order, including the hidden layers of decorated capabilities
     */
    public synchronized @NotNull List<ServiceDescriptor<?>> all() {
        return new ArrayList<>(descriptors.values());
    }

    public boolean isAllowingOverrides() {
        return allowOverrides;
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void dropLayers(ServiceKey<?> key) {
        Integer count = layers.remove(key);

        if (count == null) {
            return;
        }

        Iterator<ServiceKey<?>> iterator = descriptors.keySet().iterator();

        while (iterator.hasNext()) {
            ServiceKey<?> candidate = iterator.next();

            if (candidate.isDecoratedLayer() && candidate.getCapability().equals(key)) {
                iterator.remove();
            }
        }
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("The registry is sealed once the container has been built");
        }
    }
}
