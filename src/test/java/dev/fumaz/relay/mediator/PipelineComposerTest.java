package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.bind.ServiceRegistry;
import dev.fumaz.relay.container.Resolver;
import dev.fumaz.relay.exception.DispatchCancelledException;
import dev.fumaz.relay.mediator.OrderFixtures.CountOrders;
import dev.fumaz.relay.mediator.OrderFixtures.OrderBook;
import dev.fumaz.relay.mediator.OrderFixtures.PlaceOrder;
import dev.fumaz.relay.mediator.OrderFixtures.ProceedTwice;
import dev.fumaz.relay.mediator.OrderFixtures.Tracing;
import dev.fumaz.relay.scope.DisposalLedger;
import dev.fumaz.relay.scope.Scope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineComposerTest {

    private Scope scope;

    @BeforeEach
    void openScope() {
        scope = new Scope(new Resolver(new ServiceRegistry(false), new DisposalLedger("root")));
    }

    @AfterEach
    void closeScope() {
        scope.close();
    }

    @Test
    void ordersByKeyThenRegistration() {
        PipelineComposer composer = new PipelineComposer();
        composer.register(BehaviorDescriptor.forAll(tracing("twenty"), 20, 0));
        composer.register(BehaviorDescriptor.forAll(tracing("ten-a"), 10, 1));
        composer.register(BehaviorDescriptor.forAll(tracing("ten-b"), 10, 2));

        assertEquals(Arrays.asList("ten-a", "ten-b", "twenty"), names(composer.compose(PlaceOrder.class)),
                "lower order should run first and equal orders should keep registration order");
    }

    @Test
    void compositionIsCachedPerRequestType() {
        PipelineComposer composer = new PipelineComposer();
        composer.register(BehaviorDescriptor.forAll(tracing("only"), 0, 0));

        List<BehaviorDescriptor> first = composer.compose(PlaceOrder.class);

        assertSame(first, composer.compose(PlaceOrder.class), "the chain should be composed once per request type");
        assertThrows(UnsupportedOperationException.class, () -> first.add(first.get(0)));
    }

    @Test
    void targetedBehaviorsApplyOnlyToTheirRequests() {
        PipelineComposer composer = new PipelineComposer();
        Set<Class<?>> targets = Collections.singleton(PlaceOrder.class);
        composer.register(BehaviorDescriptor.forAll(tracing("everywhere"), 5, 0));
        composer.register(BehaviorDescriptor.forRequests(tracing("orders"), 1, targets, 1));
        composer.register(BehaviorDescriptor.matching(tracing("counting"), 1,
                type -> type == CountOrders.class, 2));

        assertEquals(Arrays.asList("orders", "everywhere"), names(composer.compose(PlaceOrder.class)));
        assertEquals(Arrays.asList("counting", "everywhere"), names(composer.compose(CountOrders.class)));
        assertEquals(targets, composer.targetedRequests(), "predicates should not count as explicit targets");
    }

    @Test
    void targetedBehaviorNeedsAtLeastOneRequest() {
        assertThrows(IllegalArgumentException.class,
                () -> BehaviorDescriptor.forRequests(tracing("none"), 0, Collections.emptySet(), 0));
    }

    @Test
    void sealedComposerRejectsRegistrations() {
        PipelineComposer composer = new PipelineComposer();
        composer.seal();

        assertThrows(IllegalStateException.class,
                () -> composer.register(BehaviorDescriptor.forAll(tracing("late"), 0, 0)));
    }

    @Test
    void behaviorsWrapTheHandlerOutermostFirst() {
        OrderBook book = new OrderBook();
        PipelineComposer composer = new PipelineComposer();
        PlaceOrder request = new PlaceOrder("lamp", 1);
        List<PipelineBehavior> behaviors = Arrays.asList(new Tracing("outer", book), new Tracing("inner", book));

        String result = composer.execute(behaviors, request, new DispatchContext(request, scope), () -> {
            book.events.add("handler");
            return "done";
        });

        assertEquals("done", result);
        assertEquals(Arrays.asList("outer:before", "inner:before", "handler", "inner:after", "outer:after"),
                book.events, "post-processing should run after the inner steps have returned");
    }

    @Test
    void continuationCannotBeInvokedTwice() {
        PipelineComposer composer = new PipelineComposer();
        PlaceOrder request = new PlaceOrder("lamp", 1);
        List<String> calls = new ArrayList<>();
        List<PipelineBehavior> behaviors = Collections.singletonList(new ProceedTwice());

        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> composer.execute(behaviors, request, new DispatchContext(request, scope), () -> {
                    calls.add("handler");
                    return "done";
                }));

        assertTrue(exception.getMessage().contains("more than once"));
        assertEquals(1, calls.size(), "the handler should run only once");
    }

    @Test
    void cancelledContextStopsBeforeTheNextStep() {
        OrderBook book = new OrderBook();
        PipelineComposer composer = new PipelineComposer();
        PlaceOrder request = new PlaceOrder("lamp", 1);
        DispatchContext context = new DispatchContext(request, scope);
        List<PipelineBehavior> behaviors = Collections.singletonList(new Tracing("outer", book));
        context.cancel();

        assertThrows(DispatchCancelledException.class, () -> composer.execute(behaviors, request, context, () -> {
            book.events.add("handler");
            return "done";
        }));

        assertTrue(book.events.isEmpty(), "no step should run once the dispatch is cancelled");
    }

    private static ServiceKey<Tracing> tracing(String name) {
        return ServiceKey.named(Tracing.class, name);
    }

    private static List<String> names(List<BehaviorDescriptor> chain) {
        return chain.stream()
                .map(descriptor -> descriptor.getBehaviorKey().getName())
                .collect(Collectors.toList());
    }
}
