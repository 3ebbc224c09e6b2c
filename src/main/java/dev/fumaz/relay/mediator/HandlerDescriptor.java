package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Links a request type to the capability handling it and to the type of its result.
 */
public final class HandlerDescriptor {

    private final @NotNull Class<?> requestType;
    private final @NotNull ServiceKey<? extends RequestHandler<?, ?>> handlerKey;
    private final @NotNull Class<?> resultType;

    public HandlerDescriptor(@NotNull Class<?> requestType,
                             @NotNull ServiceKey<? extends RequestHandler<?, ?>> handlerKey,
                             @NotNull Class<?> resultType) {
        this.requestType = Objects.requireNonNull(requestType, "requestType");
        this.handlerKey = Objects.requireNonNull(handlerKey, "handlerKey");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
    }

    /**
     * Creates a descriptor whose result type is read from the {@code Request<R>} declaration of the request type.
     */
    public static @NotNull HandlerDescriptor of(@NotNull Class<?> requestType,
                                                @NotNull ServiceKey<? extends RequestHandler<?, ?>> handlerKey) {
        return new HandlerDescriptor(requestType, handlerKey, resultTypeOf(requestType));
    }

    public @NotNull Class<?> getRequestType() {
        return requestType;
    }

    public @NotNull ServiceKey<? extends RequestHandler<?, ?>> getHandlerKey() {
        return handlerKey;
    }

    public @NotNull Class<?> getResultType() {
        return resultType;
    }

    /**
     * @return the {@code R} of {@code Request<R>} when it is declared as a concrete class, {@code Object} otherwise
     */
    static @NotNull Class<?> resultTypeOf(@NotNull Class<?> requestType) {
        Class<?> current = requestType;

        while (current != null && current != Object.class) {
            for (Type candidate : current.getGenericInterfaces()) {
                Class<?> found = requestArgument(candidate);

                if (found != null) {
                    return found;
                }
            }

            current = current.getSuperclass();
        }

        return Object.class;
    }

    private static @Nullable Class<?> requestArgument(Type type) {
        if (!(type instanceof ParameterizedType)) {
            return null;
        }

        ParameterizedType parameterized = (ParameterizedType) type;

        if (parameterized.getRawType() != Request.class) {
            return null;
        }

        Type argument = parameterized.getActualTypeArguments()[0];

        if (argument instanceof Class) {
            return (Class<?>) argument;
        }

        if (argument instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) argument).getRawType();
        }

        return Object.class;
    }

    @Override
    public String toString() {
        return requestType.getName() + " -> " + handlerKey.describe() + " : " + resultType.getSimpleName();
    }
}
