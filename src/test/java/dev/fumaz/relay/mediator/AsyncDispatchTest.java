package dev.fumaz.relay.mediator;

import dev.fumaz.relay.container.Container;
import dev.fumaz.relay.exception.HandlerException;
import dev.fumaz.relay.mediator.OrderFixtures.PlaceOrder;
import dev.fumaz.relay.module.RelayModule;
import dev.fumaz.relay.scope.Scope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncDispatchTest {

    private ExecutorService executor;
    private Gate gate;
    private Container container;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        gate = new Gate();
        container = Container.create(new RelayModule() {
            @Override
            public void configure() {
                bind(Gate.class).toInstance(gate);
                bind(SlowHandler.class).scoped().to(Gate.class, SlowHandler::new);
                bind(QuickHandler.class).to(QuickHandler::new);
                handle(SlowQuery.class, SlowHandler.class);
                handle(PlaceOrder.class, QuickHandler.class);
                bind(InterruptingHandler.class).to(InterruptingHandler::new);
                handle(Acknowledge.class, InterruptingHandler.class);
            }
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        container.close();
    }

    @Test
    void completesWithTheHandlerResult() throws Exception {
        try (Scope scope = container.openScope()) {
            CompletableFuture<String> future = container.mediator().sendAsync(new PlaceOrder("lamp", 1), scope, executor);

            assertEquals("placed lamp", future.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void completesExceptionallyWithTheHandlerFailure() {
        try (Scope scope = container.openScope()) {
            CompletableFuture<String> future = container.mediator().sendAsync(new PlaceOrder("lamp", 0), scope, executor);

            ExecutionException exception = assertThrows(ExecutionException.class,
                    () -> future.get(5, TimeUnit.SECONDS));

            assertTrue(exception.getCause() instanceof HandlerException);
        }
    }

    @Test
    void cancellingTheFutureInterruptsTheHandler() throws Exception {
        try (Scope scope = container.openScope()) {
            CompletableFuture<String> future = container.mediator().sendAsync(new SlowQuery(), scope, executor);

            assertTrue(gate.started.await(5, TimeUnit.SECONDS), "handler should have started");
            future.cancel(true);

            assertTrue(gate.finished.await(5, TimeUnit.SECONDS), "handler should have stopped waiting");
            assertTrue(gate.interrupted.get(), "handler thread should have been interrupted");
            assertTrue(gate.cancelled.get(), "dispatch context should report the cancellation");
            assertTrue(future.isCancelled());
        }

        assertEquals(1, gate.closed.get(), "the scope should still release the handler");
    }

    @Test
    void timingOutCancelsTheDispatch() throws Exception {
        try (Scope scope = container.openScope()) {
            CompletableFuture<String> future = container.mediator()
                    .sendAsync(new SlowQuery(), scope, executor)
                    .orTimeout(200, TimeUnit.MILLISECONDS);

            ExecutionException exception = assertThrows(ExecutionException.class,
                    () -> future.get(5, TimeUnit.SECONDS));

            assertTrue(exception.getCause() instanceof TimeoutException);
            assertTrue(gate.finished.await(5, TimeUnit.SECONDS), "handler should have stopped waiting");
            assertTrue(gate.interrupted.get(), "handler thread should have been interrupted");
        }
    }

    @Test
    void workerIsReusableAfterACancelledDispatch() throws Exception {
        try (Scope scope = container.openScope()) {
            CompletableFuture<String> slow = container.mediator().sendAsync(new SlowQuery(), scope, executor);
            assertTrue(gate.started.await(5, TimeUnit.SECONDS));
            slow.cancel(true);
            assertTrue(gate.finished.await(5, TimeUnit.SECONDS));

            CompletableFuture<String> quick = container.mediator().sendAsync(new PlaceOrder("desk", 1), scope, executor);

            assertEquals("placed desk", quick.get(5, TimeUnit.SECONDS),
                    "the interrupt of the cancelled dispatch should not leak into the next one");
        }
    }

    @Test
    void interruptsNotCausedByTheDispatchAreKept() throws Exception {
        try (Scope scope = container.openScope()) {
            CompletableFuture<String> future = container.mediator().sendAsync(new Acknowledge(), scope, Runnable::run);

            assertEquals("acknowledged", future.get(5, TimeUnit.SECONDS));
            assertTrue(Thread.interrupted(), "the caller's own interrupt should survive the dispatch");
        }
    }

    static final class SlowQuery implements Request<String> {
    }

    static final class Acknowledge implements Request<String> {
    }

    static final class InterruptingHandler implements RequestHandler<Acknowledge, String> {
        @Override
        public String handle(Acknowledge request, DispatchContext context) {
            Thread.currentThread().interrupt();
            return "acknowledged";
        }
    }

    static final class Gate {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch finished = new CountDownLatch(1);
        final AtomicBoolean interrupted = new AtomicBoolean(false);
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final AtomicInteger closed = new AtomicInteger();
    }

    static final class SlowHandler implements RequestHandler<SlowQuery, String>, AutoCloseable {
        private final Gate gate;

        SlowHandler(Gate gate) {
            this.gate = gate;
        }

        @Override
        public String handle(SlowQuery request, DispatchContext context) {
            gate.started.countDown();

            try {
                new CountDownLatch(1).await();
                return "never";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                gate.interrupted.set(true);
                gate.cancelled.set(context.isCancelled());
                context.throwIfCancelled();
                return "interrupted";
            } finally {
                gate.finished.countDown();
            }
        }

        @Override
        public void close() {
            gate.closed.incrementAndGet();
        }
    }

    static final class QuickHandler implements RequestHandler<PlaceOrder, String> {
        @Override
        public String handle(PlaceOrder request, DispatchContext context) {
            if (request.quantity <= 0) {
                throw new HandlerException("invalid_quantity", "Quantity must be positive");
            }

            return "placed " + request.product;
        }
    }
}
