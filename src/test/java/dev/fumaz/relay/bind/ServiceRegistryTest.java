package dev.fumaz.relay.bind;

import dev.fumaz.relay.exception.ConfigurationException;
import dev.fumaz.relay.exception.UnresolvedCapabilityException;
import dev.fumaz.relay.provider.Provider;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceRegistryTest {

    private static final ServiceKey<Repository> REPOSITORY = ServiceKey.of(Repository.class);

    @Test
    void rejectsDuplicateRegistrationsWhenOverridesAreOff() {
        ServiceRegistry registry = new ServiceRegistry(false);
        registry.register(descriptor(REPOSITORY, Lifetime.SCOPED));

        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> registry.register(descriptor(REPOSITORY, Lifetime.SINGLETON)));

        assertTrue(exception.getMessage().contains(Repository.class.getName()),
                "message should name the duplicated capability");
        assertEquals(Lifetime.SCOPED, registry.require(REPOSITORY).getLifetime(), "first registration should stay");
    }

    @Test
    void namesKeepRegistrationsApart() {
        ServiceRegistry registry = new ServiceRegistry(false);
        registry.register(descriptor(REPOSITORY, Lifetime.SCOPED));
        registry.register(descriptor(ServiceKey.named(Repository.class, "audit"), Lifetime.SINGLETON));

        assertEquals(2, registry.all().size());
        assertEquals(Lifetime.SINGLETON, registry.require(ServiceKey.named(Repository.class, "audit")).getLifetime());
    }

    @Test
    void overridesReplaceEarlierRegistrations() {
        ServiceRegistry registry = new ServiceRegistry(true);
        ServiceDescriptor<Repository> first = descriptor(REPOSITORY, Lifetime.SCOPED);
        ServiceDescriptor<Repository> second = descriptor(REPOSITORY, Lifetime.SINGLETON);

        registry.register(first);
        registry.register(second);

        assertTrue(registry.isAllowingOverrides());
        assertSame(second, registry.require(REPOSITORY), "last registration should win");
        assertEquals(1, registry.all().size());
    }

    @Test
    void overridingDropsEarlierDecorations() {
        ServiceRegistry registry = new ServiceRegistry(true);
        registry.register(descriptor(REPOSITORY, Lifetime.SCOPED));
        registry.decorate(new Decoration<>(REPOSITORY, dependencies -> new Repository(), Collections.emptyList(), null));

        ServiceDescriptor<Repository> replacement = descriptor(REPOSITORY, Lifetime.TRANSIENT);
        registry.register(replacement);

        assertSame(replacement, registry.require(REPOSITORY));
        assertFalse(registry.contains(REPOSITORY.layer(1)), "the hidden layer of the old decoration should be gone");
    }

    @Test
    void decorationMovesTheCurrentProducerToAHiddenLayer() {
        ServiceRegistry registry = new ServiceRegistry(false);
        ServiceKey<Clock> clock = ServiceKey.of(Clock.class);

        registry.register(descriptor(clock, Lifetime.SINGLETON));
        registry.register(descriptor(REPOSITORY, Lifetime.SCOPED));
        registry.decorate(new Decoration<>(REPOSITORY, dependencies -> new Repository(),
                Collections.<ServiceKey<?>>singletonList(clock), null));
        registry.decorate(new Decoration<>(REPOSITORY, dependencies -> new Repository(), Collections.emptyList(), null));

        ServiceDescriptor<Repository> outer = registry.require(REPOSITORY);
        ServiceDescriptor<Repository> middle = registry.require(REPOSITORY.layer(2));
        ServiceDescriptor<Repository> original = registry.require(REPOSITORY.layer(1));

        assertEquals(Collections.singletonList(REPOSITORY.layer(2)), outer.getDependencies(),
                "outermost decorator should receive the previous decorator");
        assertEquals(Arrays.asList(REPOSITORY.layer(1), clock), middle.getDependencies(),
                "first decorator should keep its extra dependency after the wrapped instance");
        assertTrue(original.getDependencies().isEmpty());

        assertEquals(Lifetime.SCOPED, outer.getLifetime(), "decorators should inherit the lifetime");
        assertEquals(Lifetime.SCOPED, middle.getLifetime(), "decorators should inherit the lifetime");
        assertTrue(original.getKey().isDecoratedLayer());
        assertEquals(REPOSITORY, original.getKey().getCapability());
    }

    @Test
    void decoratingAnUnregisteredCapabilityFails() {
        ServiceRegistry registry = new ServiceRegistry(false);

        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> registry.decorate(new Decoration<>(REPOSITORY, dependencies -> new Repository(),
                        Collections.emptyList(), null)));

        assertTrue(exception.getMessage().contains("before it is registered"));
    }

    @Test
    void sealedRegistryRejectsChanges() {
        ServiceRegistry registry = new ServiceRegistry(false);
        registry.seal();

        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.register(descriptor(REPOSITORY, Lifetime.SCOPED)));
    }

    @Test
    void requireReportsTheMissingKey() {
        ServiceRegistry registry = new ServiceRegistry(false);

        UnresolvedCapabilityException exception = assertThrows(UnresolvedCapabilityException.class,
                () -> registry.require(REPOSITORY));

        assertEquals(REPOSITORY, exception.getKey());
        assertFalse(registry.lookup(REPOSITORY).isPresent());
    }

    @Test
    void instanceDescriptorsAreExternallyOwnedSingletons() {
        Repository repository = new Repository();
        ServiceDescriptor<Repository> descriptor = ServiceDescriptor.instance(REPOSITORY, repository);

        assertEquals(Lifetime.SINGLETON, descriptor.getLifetime());
        assertTrue(descriptor.isExternallyOwned());
        assertThrows(IllegalArgumentException.class, () -> new ServiceDescriptor<>(REPOSITORY,
                Provider.instance(repository), Lifetime.SCOPED, Collections.emptyList(), null, true));
    }

    private static <T> ServiceDescriptor<T> descriptor(ServiceKey<T> key, Lifetime lifetime) {
        Provider<T> provider = dependencies -> {
            throw new UnsupportedOperationException("not constructed in registry tests");
        };

        return new ServiceDescriptor<>(key, provider, lifetime, Collections.emptyList(), null, false);
    }

    static class Repository {
    }

    static class Clock {
    }
}
