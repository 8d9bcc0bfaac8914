package io.resultgroup;

import io.resultgroup.internal.Durations;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 延迟动作调度器。
 *
 * <p>用于承载带截止时间的 {@link CancellationSource}：到期后触发取消。
 * 在多个 group 之间共享时是线程安全的。
 */
public final class DelayScheduler {

    private static final DelayScheduler SHARED = new DelayScheduler(createSharedExecutor(), false);

    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    private DelayScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * 创建单线程定时调度器。
     *
     * <p>该实例拥有底层执行器，需由调用方通过 {@link #shutdownIfOwned()} 回收。
     */
    public static DelayScheduler singleThread() {
        return new DelayScheduler(Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("resultgroup-delay-owned")), true);
    }

    /**
     * 获取进程级共享调度器实例（守护线程，无需关闭）。
     */
    public static DelayScheduler shared() {
        return SHARED;
    }

    /**
     * 基于外部 {@link ScheduledExecutorService} 构造包装。
     *
     * <p>外部执行器生命周期由调用方负责。
     */
    public static DelayScheduler from(ScheduledExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new DelayScheduler(executor, false);
    }

    /**
     * 提交一次性延迟动作。
     *
     * <p>示例：
     * <pre>{@code
     * ScheduledTask timer = DelayScheduler.shared().schedule(Duration.ofSeconds(1), source::cancel);
     * }</pre>
     */
    public ScheduledTask schedule(Duration delay, Runnable runnable) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(runnable, "runnable");
        ScheduledFuture<?> future = executor.schedule(runnable, Durations.toNanosSaturated(delay), TimeUnit.NANOSECONDS);
        return new DefaultScheduledTask(future);
    }

    /**
     * 当当前调度器拥有执行器所有权时，关闭执行器。
     */
    public void shutdownIfOwned() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ScheduledExecutorService createSharedExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
            1,
            new NamedThreadFactory("resultgroup-delay")
        );
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    private static final class DefaultScheduledTask implements ScheduledTask {

        private final ScheduledFuture<?> future;

        private DefaultScheduledTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }

    /**
     * 定时线程命名工厂，便于定位线程来源。
     */
    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger id;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
            this.id = new AtomicInteger(1);
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + id.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
