package dev.fumaz.relay.exception;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when the declared dependencies of a capability lead back to the capability itself.
 */
public class CyclicDependencyException extends ResolutionException {

    private final @NotNull List<ServiceKey<?>> cycle;

    public CyclicDependencyException(@NotNull List<ServiceKey<?>> cycle) {
        super(describe(cycle));
        this.cycle = Collections.unmodifiableList(cycle);
    }

    /**
     * @return the keys forming the cycle, starting and ending with the same key
     */
    public @NotNull List<ServiceKey<?>> getCycle() {
        return cycle;
    }

    private static String describe(List<ServiceKey<?>> cycle) {
        String lineSeparator = System.lineSeparator();
        StringBuilder builder = new StringBuilder("Dependency cycle detected while resolving ")
                .append(cycle.get(0).describe())
                .append(lineSeparator)
                .append("Cycle path:");

        for (ServiceKey<?> step : cycle) {
            builder.append(lineSeparator).append(" - ").append(step.describe());
        }

        return builder.toString();
    }
}
