package io.resultgroup;

import io.resultgroup.internal.GroupMetrics;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreCoverageTest {

    @Test
    void aggregateJoinsMessagesAndKeepsOrder() {
        IllegalStateException first = new IllegalStateException("first");
        RuntimeException noMessage = new RuntimeException();
        IOException third = new IOException("third");

        AggregateException aggregate = new AggregateException(Arrays.<Throwable>asList(first, noMessage, third));

        assertEquals("first\njava.lang.RuntimeException\nthird", aggregate.getMessage());
        assertEquals(Arrays.<Throwable>asList(first, noMessage, third), aggregate.errors());
        assertEquals(3, aggregate.getSuppressed().length);
        assertThrows(UnsupportedOperationException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                aggregate.errors().add(new RuntimeException("cannot mutate"));
            }
        });
    }

    @Test
    void aggregateSearchesCauseChainsAndNestedAggregates() {
        IOException root = new IOException("root");
        RuntimeException wrapper = new RuntimeException("wrapper", root);
        IllegalArgumentException nested = new IllegalArgumentException("nested");
        AggregateException inner = new AggregateException(Collections.<Throwable>singletonList(nested));

        AggregateException outer = new AggregateException(Arrays.<Throwable>asList(wrapper, inner));

        assertTrue(outer.contains(root));
        assertTrue(outer.contains(wrapper));
        assertTrue(outer.contains(nested));
        assertFalse(outer.contains(new IOException("root")));
        assertSame(root, outer.find(IOException.class));
        assertSame(nested, outer.find(IllegalArgumentException.class));
        assertNull(outer.find(InterruptedException.class));
    }

    @Test
    void aggregateRejectsEmptyList() {
        assertThrows(IllegalArgumentException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                new AggregateException(Collections.<Throwable>emptyList());
            }
        });
        assertThrows(NullPointerException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                new AggregateException(null);
            }
        });
    }

    @Test
    void unitResultFactoriesCopyAndValidate() {
        List<Integer> source = new ArrayList<Integer>(Arrays.asList(1, 2));
        UnitResult<Integer> ok = UnitResult.of(source);
        source.add(3);
        assertEquals(Arrays.asList(1, 2), ok.values());
        assertFalse(ok.isFailed());
        assertNull(ok.error());

        UnitResult<String> empty = UnitResult.empty();
        assertTrue(empty.values().isEmpty());

        IllegalStateException boom = new IllegalStateException("boom");
        UnitResult<String> failed = UnitResult.failed(boom);
        assertTrue(failed.isFailed());
        assertSame(boom, failed.error());
        assertTrue(failed.values().isEmpty());

        UnitResult<String> partial = UnitResult.partial(Collections.singletonList("kept"), boom);
        assertEquals(Collections.singletonList("kept"), partial.values());
        assertSame(boom, partial.error());

        assertThrows(NullPointerException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                UnitResult.failed(null);
            }
        });
    }

    @Test
    void outcomeAndInfoAccessorsWork() {
        Instant now = Instant.now();
        UnitInfo info = new UnitInfo(11L, 22L, "worker", now, "cachedThreads");
        assertEquals(11L, info.groupId());
        assertEquals(22L, info.unitId());
        assertEquals("worker", info.name());
        assertEquals(now, info.launchedAt());
        assertEquals("cachedThreads", info.schedulerName());
        assertTrue(info.toString().contains("worker"));

        final Outcome<Integer> outcome = new Outcome<Integer>(3, Arrays.asList(1, 2), null);
        assertEquals(3, outcome.launched());
        assertFalse(outcome.hasErrors());
        assertThrows(UnsupportedOperationException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                outcome.results().add(3);
            }
        });
    }

    @Test
    void metricsRecordDurationsAndDroppedErrors() {
        GroupMetrics metrics = new GroupMetrics();
        metrics.recordStart();
        metrics.recordStart();
        metrics.recordSuccess(TimeUnit.MILLISECONDS.toNanos(10));
        metrics.recordFailure(TimeUnit.MILLISECONDS.toNanos(30));
        metrics.recordDroppedError();

        GroupMetricsSnapshot snapshot = metrics.snapshot();
        assertEquals(2L, snapshot.started());
        assertEquals(1L, snapshot.succeeded());
        assertEquals(1L, snapshot.failed());
        assertEquals(2L, snapshot.completed());
        assertEquals(1L, snapshot.droppedErrors());
        assertEquals(Duration.ofMillis(40), snapshot.totalDuration());
        assertEquals(Duration.ofMillis(20), snapshot.averageDuration());
        assertEquals(Duration.ofMillis(30), snapshot.maxDuration());
        assertTrue(snapshot.toString().contains("droppedErrors=1"));

        assertEquals(Duration.ZERO, new GroupMetrics().snapshot().averageDuration());
    }

    @Test
    void hooksObserveLifecycleAndFailingHookIsIsolated() {
        final List<String> events = Collections.synchronizedList(new ArrayList<String>());
        final AtomicInteger thresholdCalls = new AtomicInteger();

        UnitHook broken = new UnitHook() {
            @Override
            public void onStart(UnitInfo info) {
                throw new IllegalStateException("hook exploded");
            }

            @Override
            public void onFailure(UnitInfo info, Throwable error, Duration duration) {
                throw new IllegalStateException("hook exploded");
            }
        };
        UnitHook recording = new UnitHook() {
            @Override
            public void onStart(UnitInfo info) {
                events.add("start:" + info.name());
            }

            @Override
            public void onSuccess(UnitInfo info, Duration duration) {
                events.add("success:" + info.name());
            }

            @Override
            public void onFailure(UnitInfo info, Throwable error, Duration duration) {
                events.add("failure:" + info.name());
            }

            @Override
            public void onErrorDropped(UnitInfo info, Throwable error) {
                events.add("dropped:" + info.name());
            }

            @Override
            public void onThresholdReached(UnitInfo info, int threshold) {
                thresholdCalls.incrementAndGet();
                events.add("threshold:" + info.name() + ":" + threshold);
            }
        };

        final ResultGroup<Integer> group = ResultGroup.<Integer>withErrorsThreshold(CancellationToken.none(), 1)
            .withHook(broken)
            .withHook(recording);
        group.launch("fails", new Unit<Integer>() {
            @Override
            public UnitResult<Integer> call() {
                throw new IllegalStateException("unit failure");
            }
        });
        group.launch("late", new Unit<Integer>() {
            @Override
            public UnitResult<Integer> call() throws Exception {
                group.token().await(Duration.ofSeconds(5));
                return UnitResult.partial(Collections.singletonList(5), new IllegalStateException("late failure"));
            }
        });

        Outcome<Integer> outcome = group.await();

        assertEquals(Collections.singletonList(5), outcome.results());
        assertEquals("unit failure", outcome.error().getMessage());
        assertEquals(1, thresholdCalls.get());
        assertTrue(events.contains("start:fails"));
        assertTrue(events.contains("start:late"));
        assertTrue(events.contains("failure:fails"));
        assertTrue(events.contains("failure:late"));
        assertTrue(events.contains("threshold:fails:1"));
        assertTrue(events.contains("dropped:late"));
        assertFalse(events.contains("success:fails"));
    }

    @Test
    void unnamedUnitsGetSequentialNames() {
        final List<String> names = Collections.synchronizedList(new ArrayList<String>());
        ResultGroup<Integer> group = ResultGroup.<Integer>open().withHook(new UnitHook() {
            @Override
            public void onSuccess(UnitInfo info, Duration duration) {
                names.add(info.name());
            }
        });
        group.launch(() -> UnitResult.of(1));
        group.launch(() -> UnitResult.of(2));
        group.await();

        Collections.sort(names);
        assertEquals(Arrays.asList("unit-1", "unit-2"), names);
    }

    @Test
    void schedulerVirtualThreadFallbackIsPredictable() {
        Scheduler scheduler = Scheduler.virtualThreads();
        if (Scheduler.isVirtualThreadSupported()) {
            assertTrue(scheduler.isVirtualThreadMode());
        } else {
            assertFalse(scheduler.isVirtualThreadMode());
            assertSame(Scheduler.cachedThreads(), scheduler);
            assertEquals("cachedThreads", scheduler.name());
        }
        assertSame(Scheduler.detect(), Scheduler.detect());
    }

    @Test
    void defaultSchedulerDoesNotBoundConcurrency() throws Exception {
        final int units = 32;
        final CountDownLatch allRunning = new CountDownLatch(units);
        ResultGroup<Boolean> group = ResultGroup.open();

        for (int i = 0; i < units; i++) {
            group.launch(new Unit<Boolean>() {
                @Override
                public UnitResult<Boolean> call() throws Exception {
                    allRunning.countDown();
                    return UnitResult.of(allRunning.await(5L, TimeUnit.SECONDS));
                }
            });
        }

        Outcome<Boolean> outcome = group.await();
        assertEquals(units, outcome.results().size());
        assertFalse(outcome.results().contains(Boolean.FALSE));
    }

    @Test
    void schedulerFromExternalExecutorRunsUnits() {
        assertThrows(NullPointerException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                Scheduler.from(null);
            }
        });

        ExecutorService external = Executors.newFixedThreadPool(2);
        try {
            Scheduler scheduler = Scheduler.from(external);
            assertEquals("external", scheduler.name());
            ResultGroup<String> group = ResultGroup.<String>open().withScheduler(scheduler);
            assertSame(scheduler, group.scheduler());
            group.launch(() -> UnitResult.of(Thread.currentThread().getName()));
            Outcome<String> outcome = group.await();
            assertEquals(1, outcome.results().size());
            assertFalse(external.isShutdown());
        } finally {
            external.shutdownNow();
        }
    }

    @Test
    void delaySchedulerRunsAndCancelsActions() throws Exception {
        assertThrows(NullPointerException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                DelayScheduler.from(null);
            }
        });

        ScheduledExecutorService external = Executors.newSingleThreadScheduledExecutor();
        try {
            DelayScheduler.from(external).shutdownIfOwned();
            assertFalse(external.isShutdown());
        } finally {
            external.shutdownNow();
        }

        DelayScheduler scheduler = DelayScheduler.singleThread();
        try {
            final CountDownLatch ran = new CountDownLatch(1);
            ScheduledTask task = scheduler.schedule(Duration.ofMillis(10), new Runnable() {
                @Override
                public void run() {
                    ran.countDown();
                }
            });
            assertTrue(ran.await(1L, TimeUnit.SECONDS));

            final AtomicInteger neverRuns = new AtomicInteger();
            ScheduledTask cancelled = scheduler.schedule(Duration.ofSeconds(30), new Runnable() {
                @Override
                public void run() {
                    neverRuns.incrementAndGet();
                }
            });
            assertTrue(cancelled.cancel());
            assertTrue(cancelled.isCancelled());
            assertTrue(cancelled.isDone());
            assertEquals(0, neverRuns.get());
            assertFalse(task.isCancelled());
        } finally {
            scheduler.shutdownIfOwned();
        }
    }

    @Test
    void exceptionConstructorsRetainMessageAndCause() {
        CancelledException simple = new CancelledException("simple");
        assertEquals("simple", simple.getMessage());

        RuntimeException cause = new RuntimeException("root-cause");
        CancelledException withCause = new CancelledException("wrapped", cause);
        assertSame(cause, withCause.getCause());

        GroupTimeoutException timeout = new GroupTimeoutException("late");
        assertEquals("late", timeout.getMessage());
    }
}
