package dev.fumaz.relay.mediator;

import dev.fumaz.relay.exception.HandlerException;
import dev.fumaz.relay.scope.Scope;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RelayMediator implements Mediator {

    private static final Logger LOGGER = Logger.getLogger(RelayMediator.class.getName());

    private final @NotNull HandlerCatalog handlers;
    private final @NotNull PipelineComposer pipeline;
    private final @NotNull NotificationCatalog notifications;

    public RelayMediator(@NotNull HandlerCatalog handlers,
                         @NotNull PipelineComposer pipeline,
                         @NotNull NotificationCatalog notifications) {
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
    }

    @Override
    public <R> R send(@NotNull Request<R> request, @NotNull Scope scope) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(scope, "scope");

        return dispatch(request, new DispatchContext(request, scope));
    }

    @Override
    public <R> @NotNull DispatchResult<R> trySend(@NotNull Request<R> request, @NotNull Scope scope) {
        try {
            return DispatchResult.success(send(request, scope));
        } catch (HandlerException e) {
            return DispatchResult.failure(e);
        }
    }

    @Override
    public <R> @NotNull CompletableFuture<R> sendAsync(@NotNull Request<R> request,
                                                       @NotNull Scope scope,
                                                       @NotNull Executor executor) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(executor, "executor");

        AsyncDispatch<R> dispatch = new AsyncDispatch<>(request, new DispatchContext(request, scope));

        try {
            executor.execute(dispatch);
        } catch (RejectedExecutionException e) {
            dispatch.future.completeExceptionally(e);
        }

        return dispatch.future;
    }

    @Override
    public void publish(@NotNull Notification notification, @NotNull Scope scope) {
        Objects.requireNonNull(notification, "notification");
        Objects.requireNonNull(scope, "scope");

        List<NotificationHandlerDescriptor> registered = notifications.lookup(notification.getClass());
        DispatchContext context = new DispatchContext(notification, scope);
        List<RuntimeException> failures = new ArrayList<>();

        LOGGER.fine(() -> "Publishing " + notification.getClass().getName() + " to " + registered.size()
                + " handler(s) in " + scope);

        for (NotificationHandlerDescriptor descriptor : registered) {
            try {
                context.throwIfCancelled();

                Object resolved = scope.resolve(descriptor.getHandlerKey());

                @SuppressWarnings("unchecked")
                NotificationHandler<Notification> handler = (NotificationHandler<Notification>) resolved;
                handler.handle(notification, context);
            } catch (RuntimeException e) {
                LOGGER.log(Level.FINE, "Notification handler " + descriptor.getHandlerKey().describe() + " failed", e);
                failures.add(e);
            }
        }

        if (failures.isEmpty()) {
            return;
        }

        RuntimeException first = failures.get(0);

        for (int i = 1; i < failures.size(); i++) {
            first.addSuppressed(failures.get(i));
        }

        throw first;
    }

    private <R> R dispatch(Request<R> request, DispatchContext context) {
        Class<?> requestType = request.getClass();
        Scope scope = context.getScope();

        try {
            HandlerDescriptor descriptor = handlers.require(requestType);

            Object resolved = scope.resolve(descriptor.getHandlerKey());

            @SuppressWarnings("unchecked")
            RequestHandler<Request<R>, R> handler = (RequestHandler<Request<R>, R>) resolved;

            List<BehaviorDescriptor> chain = pipeline.compose(requestType);
            List<PipelineBehavior> behaviors = new ArrayList<>(chain.size());

            for (BehaviorDescriptor behavior : chain) {
                behaviors.add(scope.resolve(behavior.getBehaviorKey()));
            }

            LOGGER.fine(() -> "Dispatching " + requestType.getName() + " in " + scope + " through " + chain);

            return pipeline.execute(behaviors, request, context, () -> handler.handle(request, context));
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Dispatch of " + requestType.getName() + " failed", e);
            throw e;
        }
    }

    private final class AsyncDispatch<R> implements Runnable {

        private final Request<R> request;
        private final DispatchContext context;
        private final CompletableFuture<R> future = new CompletableFuture<>();
        private final Object lock = new Object();
        private Thread worker;
        private boolean interruptedByAbort;

        private AsyncDispatch(Request<R> request, DispatchContext context) {
            this.request = request;
            this.context = context;

            future.whenComplete((result, failure) -> {
                if (failure != null) {
                    abort();
                }
            });
        }

        @Override
        public void run() {
            synchronized (lock) {
                if (future.isDone()) {
                    return;
                }

                worker = Thread.currentThread();
            }

            try {
                R result = dispatch(request, context);
                detach();
                future.complete(result);
            } catch (Throwable t) {
                detach();
                future.completeExceptionally(t);
            }
        }

        private void abort() {
            synchronized (lock) {
                context.cancel();

                if (worker != null) {
                    worker.interrupt();
                    interruptedByAbort = true;
                }
            }
        }

        private void detach() {
            synchronized (lock) {
                worker = null;

                // only clear an interrupt this dispatch caused; the executor may have its own
                if (interruptedByAbort) {
                    Thread.interrupted();
                }
            }
        }
    }
}
