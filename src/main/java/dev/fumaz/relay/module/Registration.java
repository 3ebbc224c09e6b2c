package dev.fumaz.relay.module;

import dev.fumaz.relay.container.ContainerBlueprint;
import org.jetbrains.annotations.NotNull;

/**
 * One recorded registration, applied to the blueprint of a container while it is being built.
 */
@FunctionalInterface
public interface Registration {

    void apply(@NotNull ContainerBlueprint blueprint);

}
