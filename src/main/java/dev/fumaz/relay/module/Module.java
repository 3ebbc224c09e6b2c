package dev.fumaz.relay.module;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A {@link Module} is a collection of registrations.
 */
public interface Module {

    void configure();

    @NotNull List<Registration> getRegistrations();

    /**
     * Forgets the registrations of a previous {@link #configure()} so the module can be configured again.
     */
    void reset();

}
