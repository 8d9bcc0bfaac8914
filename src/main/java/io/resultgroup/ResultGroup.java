package io.resultgroup;

import io.resultgroup.internal.Durations;
import io.resultgroup.internal.GroupMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 收集并发工作单元结果与错误的任务组。
 *
 * <p>一个 {@code ResultGroup} 并发执行任意数量互相独立的 {@link Unit}，
 * 每个单元返回部分结果列表和/或一个错误；{@link #await()} 是唯一的汇合点，
 * 返回全部结果的拼接以及由所有已记录错误组成的 {@link AggregateException}。
 *
 * <p>错误阈值：
 * 通过 {@link #withErrorsThreshold(CancellationToken, int)} 创建时，
 * 已记录错误数达到阈值的那一刻触发派生的取消信号（{@link #token()}），
 * 之后到达的错误被丢弃，不再记录。单元需自行观察 token 并尽早返回，group 不会强制中断。
 *
 * <p>线程安全约束：
 * 配置方法（{@code with*}）只能在第一次 {@code launch} 前调用；
 * {@code launch} 可在任意线程并发调用；{@code await} 每个实例只能成功调用一次。
 *
 * <p>顺序：结果与错误按单元完成的先后追加，不保证与提交顺序一致。
 *
 * <p>推荐用法示例：
 * <pre>{@code
 * try (ResultGroup<User> group = ResultGroup.withErrorsThreshold(CancellationToken.none(), 3)) {
 *     for (final String shard : shards) {
 *         group.launch("load-" + shard, () -> UnitResult.of(loadUsers(shard, group.token())));
 *     }
 *     Outcome<User> outcome = group.await();
 *     if (outcome.hasErrors()) {
 *         // inspect outcome.error().errors()
 *     }
 * }
 * }</pre>
 */
public final class ResultGroup<T> implements AutoCloseable {

    private static final AtomicLong GROUP_IDS = new AtomicLong(1L);
    private static final UnitHook NOOP_HOOK = new UnitHook() {
    };

    private final long groupId;
    private final int threshold;
    private final CancellationSource cancellation;
    private final AtomicLong unitIdGen;
    private final AtomicBoolean configLocked;
    private final AtomicBoolean closed;
    private final GroupMetrics metrics;

    private final ReentrantLock lock;
    private final Condition drained;
    private final List<T> results;
    private final List<Throwable> errors;
    private int outstanding;
    private int launched;
    private boolean awaiting;
    private boolean joined;

    private volatile Scheduler scheduler;
    private volatile UnitHook hook;

    private ResultGroup(int threshold, CancellationSource cancellation) {
        this.groupId = GROUP_IDS.getAndIncrement();
        this.threshold = threshold;
        this.cancellation = cancellation;
        this.unitIdGen = new AtomicLong(1L);
        this.configLocked = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
        this.metrics = new GroupMetrics();
        this.lock = new ReentrantLock();
        this.drained = lock.newCondition();
        this.results = new ArrayList<T>();
        this.errors = new ArrayList<Throwable>();
        this.scheduler = Scheduler.detect();
        this.hook = NOOP_HOOK;
    }

    /**
     * 创建不带取消信号、不限错误数量的 group。
     *
     * <p>所有单元的错误都会被记录，取消永远不会被自动触发。
     */
    public static <T> ResultGroup<T> open() {
        return new ResultGroup<T>(0, null);
    }

    /**
     * 创建带错误阈值的 group，并从 {@code parent} 派生取消信号。
     *
     * <p>派生的 token 通过 {@link #token()} 获取，交给各单元观察；
     * 父 token 取消时它同样取消，而它的取消不会影响父级。
     *
     * @throws IllegalArgumentException {@code threshold < 1}，属于调用方编程错误
     */
    public static <T> ResultGroup<T> withErrorsThreshold(CancellationToken parent, int threshold) {
        Objects.requireNonNull(parent, "parent");
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        return new ResultGroup<T>(threshold, CancellationSource.linkedTo(parent));
    }

    /**
     * 指定单元调度策略，默认 {@link Scheduler#detect()}。
     *
     * <p>必须在首次 {@code launch} 前调用，否则会抛 {@link IllegalStateException}。
     */
    public ResultGroup<T> withScheduler(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        ensureConfigurable();
        this.scheduler = scheduler;
        return this;
    }

    /**
     * 追加单元生命周期回调。
     *
     * <p>多次调用时按注册顺序依次回调，单个 hook 的异常不会影响其他 hook 与 group 本身。
     */
    public ResultGroup<T> withHook(UnitHook hook) {
        Objects.requireNonNull(hook, "hook");
        ensureConfigurable();
        UnitHook current = this.hook;
        this.hook = current == NOOP_HOOK ? hook : UnitHooks.compose(current, hook);
        return this;
    }

    /**
     * 派生的取消 token；普通 group 返回 {@link CancellationToken#none()}。
     */
    public CancellationToken token() {
        return cancellation == null ? CancellationToken.none() : cancellation.token();
    }

    /**
     * 错误阈值，0 表示不限。
     */
    public int threshold() {
        return threshold;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * 获取内置运行时指标快照，不会阻塞单元执行。
     */
    public GroupMetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /**
     * 提交匿名单元，名称自动生成为 {@code unit-<id>}。
     */
    public void launch(Unit<T> unit) {
        long id = unitIdGen.getAndIncrement();
        launch("unit-" + id, unit, id);
    }

    /**
     * 提交具名单元，立即返回，不等待单元执行。
     *
     * <p>示例：
     * <pre>{@code
     * group.launch("fetch-orders", () -> UnitResult.of(fetchOrders()));
     * }</pre>
     *
     * @throws IllegalStateException group 已完成 {@code await} 或已关闭
     */
    public void launch(String name, Unit<T> unit) {
        long id = unitIdGen.getAndIncrement();
        launch(name, unit, id);
    }

    /**
     * 阻塞直到所有已提交单元都回报结果，然后汇总返回。
     *
     * <p>返回前无条件触发派生的取消信号，以释放与父 token 的关联（幂等）。
     *
     * @throws CancelledException 等待期间线程被中断（中断标记会被恢复，group 仍可再次等待）
     * @throws IllegalStateException 重复调用，或另一线程正在等待
     */
    public Outcome<T> await() {
        Outcome<T> outcome;
        lock.lock();
        try {
            beginAwait();
            try {
                while (outstanding > 0) {
                    drained.await();
                }
            } catch (InterruptedException interruptedException) {
                awaiting = false;
                Thread.currentThread().interrupt();
                throw new CancelledException("Interrupted while waiting for units", interruptedException);
            }
            outcome = finishAwait();
        } finally {
            lock.unlock();
        }
        releaseCancellation();
        return outcome;
    }

    /**
     * {@link #await()} 的限时版本。
     *
     * <p>超时抛出 {@link GroupTimeoutException}，此时单元继续运行，group 仍可再次等待。
     */
    public Outcome<T> await(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Outcome<T> outcome;
        lock.lock();
        try {
            beginAwait();
            long remainingNanos = Durations.toNanosSaturated(timeout);
            try {
                while (outstanding > 0) {
                    if (remainingNanos <= 0L) {
                        awaiting = false;
                        throw new GroupTimeoutException(
                            "ResultGroup still has " + outstanding + " unit(s) running after " + Durations.toMillisSaturated(timeout) + " ms"
                        );
                    }
                    remainingNanos = drained.awaitNanos(remainingNanos);
                }
            } catch (InterruptedException interruptedException) {
                awaiting = false;
                Thread.currentThread().interrupt();
                throw new CancelledException("Interrupted while waiting for units", interruptedException);
            }
            outcome = finishAwait();
        } finally {
            lock.unlock();
        }
        releaseCancellation();
        return outcome;
    }

    /**
     * 关闭 group：触发派生取消信号，让仍在运行的单元尽早退出，并拒绝后续提交。
     *
     * <p>不等待单元结束；已提交单元的结果仍可通过 {@link #await()} 收集。该方法幂等。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        releaseCancellation();
    }

    private void launch(String name, final Unit<T> unit, long id) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(unit, "unit");
        ensureOpen();
        lockConfiguration();
        final Scheduler currentScheduler = scheduler;
        final UnitInfo info = new UnitInfo(groupId, id, name, Instant.now(), currentScheduler.name());

        // counted before handing off so await() can never see a premature zero
        lock.lock();
        try {
            if (joined) {
                throw new IllegalStateException("ResultGroup already awaited");
            }
            outstanding++;
            launched++;
        } finally {
            lock.unlock();
        }

        try {
            currentScheduler.executor().execute(new Runnable() {
                @Override
                public void run() {
                    runUnit(info, unit);
                }
            });
        } catch (RuntimeException submitFailure) {
            // the unit never ran; its submission failure is its error so the counter still drains
            metrics.recordStart();
            metrics.recordFailure(0L);
            safeHookFailure(info, submitFailure, 0L);
            report(info, Collections.<T>emptyList(), submitFailure);
        }
    }

    /**
     * 在工作线程内执行单元主体，并把结果回报给 group。
     */
    private void runUnit(UnitInfo info, Unit<T> unit) {
        long started = System.nanoTime();
        safeHookStart(info);

        List<T> values = Collections.emptyList();
        Throwable error = null;
        try {
            UnitResult<T> result = unit.call();
            if (result != null) {
                values = result.values();
                error = result.error();
            }
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            error = interruptedException;
        } catch (Throwable throwable) {
            error = throwable;
        }

        long elapsed = elapsedNanos(started);
        if (error == null) {
            metrics.recordSuccess(elapsed);
            safeHookSuccess(info, elapsed);
        } else {
            metrics.recordFailure(elapsed);
            safeHookFailure(info, error, elapsed);
        }
        report(info, values, error);
    }

    /**
     * 回报顺序：先记录错误（可能触发取消），再追加结果，最后减少未完成计数。
     * 取消回调抛出异常时结果与计数仍会落地。
     */
    private void report(UnitInfo info, List<T> values, Throwable error) {
        try {
            if (error != null) {
                recordError(info, error);
            }
        } finally {
            try {
                appendResults(values);
            } finally {
                unitDone();
            }
        }
    }

    private void recordError(UnitInfo info, Throwable error) {
        boolean reachedThreshold = false;
        boolean dropped = false;
        lock.lock();
        try {
            if (threshold == 0 || errors.size() < threshold) {
                errors.add(error);
                reachedThreshold = threshold > 0 && errors.size() == threshold;
            } else {
                dropped = true;
            }
        } finally {
            lock.unlock();
        }

        if (dropped) {
            metrics.recordDroppedError();
            safeHookErrorDropped(info, error);
        }
        if (reachedThreshold) {
            safeHookThresholdReached(info);
            safeCancel();
        }
    }

    private void appendResults(List<T> values) {
        if (values.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            results.addAll(values);
        } finally {
            lock.unlock();
        }
    }

    private void unitDone() {
        lock.lock();
        try {
            outstanding--;
            if (outstanding == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    private void beginAwait() {
        if (joined) {
            throw new IllegalStateException("ResultGroup already awaited");
        }
        if (awaiting) {
            throw new IllegalStateException("ResultGroup is already being awaited by another thread");
        }
        awaiting = true;
    }

    /**
     * 持锁构建结果快照，并标记 group 已完成等待。
     */
    private Outcome<T> finishAwait() {
        awaiting = false;
        joined = true;
        AggregateException error = errors.isEmpty() ? null : new AggregateException(errors);
        return new Outcome<T>(launched, results, error);
    }

    private void releaseCancellation() {
        if (cancellation != null) {
            safeCancel();
        }
    }

    /**
     * 触发派生取消信号；用户 {@code onCancel} 回调抛出的异常不会传播到 group 的调用方或工作线程。
     */
    private void safeCancel() {
        try {
            cancellation.cancel();
        } catch (Throwable callbackFailure) {
            // token is already cancelled; callback failures belong to whoever registered them
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("ResultGroup already closed");
        }
    }

    private void ensureConfigurable() {
        ensureOpen();
        if (configLocked.get()) {
            throw new IllegalStateException("ResultGroup configuration is locked after first launch");
        }
    }

    private void lockConfiguration() {
        configLocked.set(true);
    }

    private long elapsedNanos(long startedAtNanos) {
        return Math.max(0L, System.nanoTime() - startedAtNanos);
    }

    private void safeHookStart(final UnitInfo info) {
        metrics.recordStart();
        if (hook == NOOP_HOOK) {
            return;
        }
        UnitHooks.safely(hook, new UnitHooks.Call() {
            @Override
            public void on(UnitHook target) {
                target.onStart(info);
            }
        });
    }

    private void safeHookSuccess(final UnitInfo info, final long durationNanos) {
        if (hook == NOOP_HOOK) {
            return;
        }
        UnitHooks.safely(hook, new UnitHooks.Call() {
            @Override
            public void on(UnitHook target) {
                target.onSuccess(info, Duration.ofNanos(durationNanos));
            }
        });
    }

    private void safeHookFailure(final UnitInfo info, final Throwable error, final long durationNanos) {
        if (hook == NOOP_HOOK) {
            return;
        }
        UnitHooks.safely(hook, new UnitHooks.Call() {
            @Override
            public void on(UnitHook target) {
                target.onFailure(info, error, Duration.ofNanos(durationNanos));
            }
        });
    }

    private void safeHookErrorDropped(final UnitInfo info, final Throwable error) {
        if (hook == NOOP_HOOK) {
            return;
        }
        UnitHooks.safely(hook, new UnitHooks.Call() {
            @Override
            public void on(UnitHook target) {
                target.onErrorDropped(info, error);
            }
        });
    }

    private void safeHookThresholdReached(final UnitInfo info) {
        if (hook == NOOP_HOOK) {
            return;
        }
        UnitHooks.safely(hook, new UnitHooks.Call() {
            @Override
            public void on(UnitHook target) {
                target.onThresholdReached(info, threshold);
            }
        });
    }
}
