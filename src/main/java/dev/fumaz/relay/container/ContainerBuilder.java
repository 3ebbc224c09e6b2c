package dev.fumaz.relay.container;

import dev.fumaz.relay.bind.ServiceDescriptor;
import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.mediator.Mediator;
import dev.fumaz.relay.mediator.RelayMediator;
import dev.fumaz.relay.module.Module;
import dev.fumaz.relay.module.Registration;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Collects modules and options, then builds a {@link Container}.
 */
public final class ContainerBuilder {

    private final List<Module> modules = new ArrayList<>();
    private boolean allowOverrides = true;
    private boolean strict = false;

    ContainerBuilder() {
    }

    public @NotNull ContainerBuilder install(@NotNull Module... modules) {
        return install(Arrays.asList(modules));
    }

    public @NotNull ContainerBuilder install(@NotNull List<Module> modules) {
        for (Module module : modules) {
            this.modules.add(Objects.requireNonNull(module, "module"));
        }

        return this;
    }

    /**
     * Fails the build when a key is registered twice. By default a later registration replaces an earlier one,
     * decorations included, and the replacement is logged.
     */
    public @NotNull ContainerBuilder rejectOverrides() {
        this.allowOverrides = false;
        return this;
    }

    /**
     * Checks the dependency graph of every registration while building: missing dependencies, cycles and singletons
     * reaching scoped capabilities then fail the build instead of the first resolution.
     */
    public @NotNull ContainerBuilder strict() {
        this.strict = true;
        return this;
    }

    /**
     * @throws dev.fumaz.relay.exception.ConfigurationException if the registrations are invalid
     */
    public @NotNull Container build() {
        ContainerBlueprint blueprint = new ContainerBlueprint(allowOverrides);
        Mediator mediator = new RelayMediator(blueprint.getHandlers(), blueprint.getPipeline(),
                blueprint.getNotifications());

        blueprint.getRegistry().register(ServiceDescriptor.instance(ServiceKey.of(Mediator.class), mediator));

        for (Module module : modules) {
            module.reset();
            module.configure();

            for (Registration registration : module.getRegistrations()) {
                registration.apply(blueprint);
            }
        }

        return new RelayContainer(modules, blueprint, strict);
    }
}
