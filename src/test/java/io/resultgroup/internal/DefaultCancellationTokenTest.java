package io.resultgroup.internal;

import io.resultgroup.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultCancellationTokenTest {

    @Test
    void firedAndClosedRegistrationsLeaveNothingBehind() {
        DefaultCancellationToken token = new DefaultCancellationToken();
        final AtomicInteger calls = new AtomicInteger();
        Runnable count = new Runnable() {
            @Override
            public void run() {
                calls.incrementAndGet();
            }
        };

        CancellationToken.Registration closed = token.onCancel(count);
        token.onCancel(count);
        assertEquals(2, token.pendingCallbacks());

        closed.close();
        assertEquals(1, token.pendingCallbacks());

        assertTrue(token.cancel());
        assertEquals(0, token.pendingCallbacks());
        assertEquals(1, calls.get());

        token.onCancel(count);
        assertEquals(0, token.pendingCallbacks());
        assertEquals(2, calls.get());
    }

    @Test
    void onlyFirstCancelReportsTrue() {
        DefaultCancellationToken token = new DefaultCancellationToken();

        assertFalse(token.isCancelled());
        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
    }

    @Test
    void concurrentRegistrationAndCancelRunEachCallbackExactlyOnce() throws Exception {
        for (int round = 0; round < 50; round++) {
            final DefaultCancellationToken token = new DefaultCancellationToken();
            final AtomicInteger calls = new AtomicInteger();
            final Runnable count = new Runnable() {
                @Override
                public void run() {
                    calls.incrementAndGet();
                }
            };
            Thread registrar = new Thread(new Runnable() {
                @Override
                public void run() {
                    for (int i = 0; i < 100; i++) {
                        token.onCancel(count);
                    }
                }
            });

            registrar.start();
            token.cancel();
            registrar.join(5000L);

            assertEquals(100, calls.get());
            assertEquals(0, token.pendingCallbacks());
        }
    }
}
