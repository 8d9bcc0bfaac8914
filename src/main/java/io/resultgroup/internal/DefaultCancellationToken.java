package io.resultgroup.internal;

import io.resultgroup.CancellationToken;
import io.resultgroup.CancelledException;

import java.time.Duration;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

public final class DefaultCancellationToken implements CancellationToken {

    public static final CancellationToken NEVER = new NeverCancelled();

    private static final Registration NOOP_REGISTRATION = new Registration() {
        @Override
        public void close() {
        }
    };

    private final AtomicBoolean cancelled;
    private final CountDownLatch signal;
    private final Queue<CallbackRegistration> callbacks;

    public DefaultCancellationToken() {
        this.cancelled = new AtomicBoolean(false);
        this.signal = new CountDownLatch(1);
        this.callbacks = new ConcurrentLinkedQueue<CallbackRegistration>();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancelledException("Cancellation requested");
        }
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (cancelled.get()) {
            return true;
        }
        return signal.await(Math.max(0L, Durations.toNanosSaturated(timeout)), TimeUnit.NANOSECONDS);
    }

    @Override
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        CallbackRegistration registration = new CallbackRegistration(callbacks, callback);
        callbacks.add(registration);
        // cancel() may have drained the queue before our add landed
        if (cancelled.get()) {
            callbacks.remove(registration);
            registration.fire();
        }
        return registration;
    }

    /**
     * Flips the token to cancelled, wakes waiters and runs every registered callback.
     *
     * <p>All callbacks run even if some fail; the first failure is rethrown with the rest suppressed.
     *
     * @return true for the call that performed the cancellation, false when already cancelled.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        signal.countDown();

        Throwable primary = null;
        CallbackRegistration registration;
        while ((registration = callbacks.poll()) != null) {
            try {
                registration.fire();
            } catch (Throwable t) {
                if (primary == null) {
                    primary = t;
                } else {
                    primary.addSuppressed(t);
                }
            }
        }

        if (primary != null) {
            if (primary instanceof RuntimeException) {
                throw (RuntimeException) primary;
            }
            if (primary instanceof Error) {
                throw (Error) primary;
            }
            throw new RuntimeException(primary);
        }
        return true;
    }

    int pendingCallbacks() {
        return callbacks.size();
    }

    private static final class CallbackRegistration implements Registration {

        private final Queue<CallbackRegistration> owner;
        private final AtomicReference<Runnable> callback;

        private CallbackRegistration(Queue<CallbackRegistration> owner, Runnable callback) {
            this.owner = owner;
            this.callback = new AtomicReference<Runnable>(callback);
        }

        private void fire() {
            Runnable current = callback.getAndSet(null);
            if (current != null) {
                current.run();
            }
        }

        @Override
        public void close() {
            if (callback.getAndSet(null) != null) {
                owner.remove(this);
            }
        }
    }

    private static final class NeverCancelled implements CancellationToken {

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public void throwIfCancelled() {
        }

        @Override
        public boolean await(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout");
            long millis = Durations.toMillisSaturated(timeout);
            if (millis > 0L) {
                Thread.sleep(millis);
            }
            return false;
        }

        @Override
        public Registration onCancel(Runnable callback) {
            Objects.requireNonNull(callback, "callback");
            return NOOP_REGISTRATION;
        }
    }
}
