package com.github.salilvnair.portassist.dispatch;

import com.github.salilvnair.portassist.entity.EntityBag;
import com.github.salilvnair.portassist.intent.Intent;
import com.github.salilvnair.portassist.policy.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static com.github.salilvnair.portassist.support.TestConstants.BOOM;
import static com.github.salilvnair.portassist.support.TestConstants.HANDLER_BOOKING;
import static com.github.salilvnair.portassist.support.TestConstants.TRACE_ID;
import static com.github.salilvnair.portassist.support.TestConstants.USER_ID;
import static com.github.salilvnair.portassist.support.TestConstants.USER_TEXT_BOOKING_STATUS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchRouterTest {

    @Mock
    private CapabilityRegistry registry;

    @Mock
    private CapabilityHandler handler;

    private DispatchRouter router;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        router = new DispatchRouter(registry);
        context = new ExecutionContext(
                USER_TEXT_BOOKING_STATUS,
                Intent.BOOKING_STATUS,
                EntityBag.empty(),
                List.of(),
                Role.CARRIER,
                USER_ID,
                TRACE_ID,
                Map.of(),
                true
        );
    }

    @Test
    void unroutedIntentIsNotImplemented() {
        when(registry.handlerNameFor(Intent.PASSAGE_HISTORY)).thenReturn(Optional.empty());

        DispatchOutcome outcome = router.dispatch(Intent.PASSAGE_HISTORY, context);

        assertEquals(new DispatchOutcome.NotImplemented(Intent.PASSAGE_HISTORY), outcome);
    }

    @Test
    void routeToMissingHandlerIsAConfigurationFailure() {
        when(registry.handlerNameFor(Intent.BOOKING_STATUS)).thenReturn(Optional.of(HANDLER_BOOKING));
        when(registry.handler(HANDLER_BOOKING)).thenReturn(Optional.empty());

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, DispatchOutcome.CONFIGURATION_ERROR), outcome);
    }

    @Test
    void handlerResultIsPassedThrough() throws Exception {
        Map<String, Object> result = Map.of("message", "Booking REF123 is confirmed");
        stubHandler();
        when(handler.handle(any())).thenReturn(result);

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        DispatchOutcome.Routed routed = assertInstanceOf(DispatchOutcome.Routed.class, outcome);
        assertEquals(HANDLER_BOOKING, routed.handlerName());
        assertSame(result, routed.result());
        verify(handler).handle(context);
    }

    @Test
    void asynchronousResultIsAwaited() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenReturn(CompletableFuture.completedFuture("done"));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Routed(HANDLER_BOOKING, "done"), outcome);
    }

    @Test
    void handlerExceptionBecomesFailedOutcomeWithCoarseKind() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenThrow(new IllegalStateException(BOOM));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, "IllegalStateException"), outcome);
    }

    @Test
    void failedFutureIsUnwrappedToItsCause() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenReturn(CompletableFuture.failedFuture(new IllegalArgumentException(BOOM)));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, "IllegalArgumentException"), outcome);
    }

    @Test
    void errorShapedResultBecomesFailedOutcomeWithItsType() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenReturn(Map.of(
                "ok", false,
                "error", Map.of("type", "UpstreamError", "message", BOOM)
        ));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, "UpstreamError"), outcome);
    }

    @Test
    void errorShapeWithoutTypeFallsBackToTheGenericKind() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenReturn(Map.of("ok", false, "error", BOOM));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, DispatchOutcome.HANDLER_ERROR), outcome);
    }

    @Test
    void successfulEnvelopeIsRouted() throws Exception {
        Map<String, Object> result = Map.of("ok", true, "result", Map.of("score", 90));
        stubHandler();
        when(handler.handle(any())).thenReturn(result);

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Routed(HANDLER_BOOKING, result), outcome);
    }

    @Test
    void linkageErrorInHandlerIsContained() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenThrow(new NoClassDefFoundError(BOOM));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, "NoClassDefFoundError"), outcome);
    }

    @Test
    void stackOverflowInHandlerIsContained() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenThrow(new StackOverflowError(BOOM));

        DispatchOutcome outcome = router.dispatch(Intent.BOOKING_STATUS, context);

        assertEquals(new DispatchOutcome.Failed(HANDLER_BOOKING, "StackOverflowError"), outcome);
    }

    @Test
    void outOfMemoryErrorPropagates() throws Exception {
        stubHandler();
        when(handler.handle(any())).thenThrow(new OutOfMemoryError(BOOM));

        assertThrows(OutOfMemoryError.class, () -> router.dispatch(Intent.BOOKING_STATUS, context));
    }

    @Test
    void unwrapPeelsNestedWrappers() {
        IllegalStateException root = new IllegalStateException(BOOM);

        Throwable unwrapped = DispatchRouter.unwrap(new CompletionException(new ExecutionException(root)));

        assertSame(root, unwrapped);
    }

    private void stubHandler() {
        when(registry.handlerNameFor(Intent.BOOKING_STATUS)).thenReturn(Optional.of(HANDLER_BOOKING));
        when(registry.handler(HANDLER_BOOKING)).thenReturn(Optional.of(handler));
    }
}
