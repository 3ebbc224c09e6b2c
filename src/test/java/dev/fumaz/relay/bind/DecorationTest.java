package dev.fumaz.relay.bind;

import dev.fumaz.relay.container.Container;
import dev.fumaz.relay.exception.ConfigurationException;
import dev.fumaz.relay.module.RelayModule;
import dev.fumaz.relay.scope.Scope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecorationTest {

    @Test
    void laterDecoratorsWrapEarlierOnes() {
        List<String> calls = new ArrayList<>();
        Container container = Container.create(new RelayModule() {
            @Override
            public void configure() {
                bind(Greeter.class).to(() -> name -> {
                    calls.add("original");
                    return "hello " + name;
                });
                decorate(Greeter.class).with(inner -> name -> {
                    calls.add("first");
                    return inner.greet(name) + "!";
                });
                decorate(Greeter.class).with(inner -> name -> {
                    calls.add("second");
                    return "[" + inner.greet(name) + "]";
                });
            }
        });

        String greeting = container.resolve(Greeter.class).greet("relay");

        assertEquals("[hello relay!]", greeting, "outermost decorator should see the result of the inner ones");
        assertEquals(Arrays.asList("second", "first", "original"), calls,
                "calls should enter the most recent decorator first");
    }

    @Test
    void decoratorsReceiveTheirExtraDependencies() {
        Container container = Container.create(new RelayModule() {
            @Override
            public void configure() {
                bind(Punctuation.class).singleton().to(() -> new Punctuation("?"));
                bind(Greeter.class).to(() -> name -> "hello " + name);
                decorate(Greeter.class).with(Punctuation.class,
                        (inner, punctuation) -> name -> inner.greet(name) + punctuation.mark);
            }
        });

        assertEquals("hello relay?", container.resolve(Greeter.class).greet("relay"));
    }

    @Test
    void decoratorsKeepTheLifetimeOfTheWrappedCapability() {
        Container container = Container.create(new RelayModule() {
            @Override
            public void configure() {
                bind(Greeter.class).scoped().to(() -> name -> "hello " + name);
                decorate(Greeter.class).with(inner -> name -> inner.greet(name).toUpperCase());
            }
        });

        Greeter first;
        Greeter second;

        try (Scope scope = container.openScope()) {
            first = scope.resolve(Greeter.class);
            assertSame(first, scope.resolve(Greeter.class), "decorated scoped capability should be reused in a scope");
        }

        try (Scope scope = container.openScope()) {
            second = scope.resolve(Greeter.class);
        }

        assertNotSame(first, second, "decorated scoped capability should not leak across scopes");
        assertEquals("HELLO RELAY", second.greet("relay"));
    }

    @Test
    void namedCapabilitiesAreDecoratedIndependently() {
        Container container = Container.create(new RelayModule() {
            @Override
            public void configure() {
                bind(Greeter.class).to(() -> name -> "hello " + name);
                bind(Greeter.class).named("formal").to(() -> name -> "good day " + name);
                decorate(ServiceKey.named(Greeter.class, "formal")).with(inner -> name -> inner.greet(name) + ".");
            }
        });

        assertEquals("hello relay", container.resolve(Greeter.class).greet("relay"));
        assertEquals("good day relay.", container.resolve(ServiceKey.named(Greeter.class, "formal")).greet("relay"));
    }

    @Test
    void decoratorsCanComeFromALaterModule() {
        RelayModule base = new RelayModule() {
            @Override
            public void configure() {
                bind(Greeter.class).to(() -> name -> "hello " + name);
            }
        };
        RelayModule extension = new RelayModule() {
            @Override
            public void configure() {
                decorate(Greeter.class).with(inner -> name -> inner.greet(name) + "!");
            }
        };

        Container container = Container.create(base, extension);

        assertEquals("hello relay!", container.resolve(Greeter.class).greet("relay"));
    }

    @Test
    void decoratingBeforeRegistrationFailsTheBuild() {
        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> Container.create(new RelayModule() {
                    @Override
                    public void configure() {
                        decorate(Greeter.class).with(inner -> inner);
                        bind(Greeter.class).to(() -> name -> "hello " + name);
                    }
                }));

        assertTrue(exception.getMessage().contains("before it is registered"),
                "message should explain that decorators apply to an existing registration");
    }

    interface Greeter {
        String greet(String name);
    }

    static class Punctuation {
        final String mark;

        Punctuation(String mark) {
            this.mark = mark;
        }
    }
}
