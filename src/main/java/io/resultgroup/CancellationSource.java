package io.resultgroup;

import io.resultgroup.internal.DefaultCancellationToken;

import java.time.Duration;
import java.util.Objects;

/**
 * 取消信号的触发端。
 *
 * <p>一个 source 持有一枚 {@link CancellationToken}，调用 {@link #cancel()} 后
 * 所有持有该 token 的一方都能观察到取消。通过 {@link #linkedTo(CancellationToken)}
 * 派生的子 source 会在父 token 取消时一并取消，反之不会影响父级。
 *
 * <p>{@link #cancel()} 幂等：首次调用翻转状态、唤醒等待方、执行回调并与父级解绑，
 * 之后的调用不再产生任何副作用。
 *
 * <p>示例：
 * <pre>{@code
 * CancellationSource request = CancellationSource.open();
 * CancellationSource child = CancellationSource.linkedTo(request.token(), Duration.ofSeconds(2));
 * child.token().throwIfCancelled();
 * }</pre>
 */
public final class CancellationSource {

    private final DefaultCancellationToken token;

    private volatile CancellationToken.Registration parentRegistration;
    private volatile ScheduledTask deadlineTask;

    private CancellationSource() {
        this.token = new DefaultCancellationToken();
    }

    /**
     * 创建不依赖任何父级的根 source。
     */
    public static CancellationSource open() {
        return new CancellationSource();
    }

    /**
     * 从父 token 派生子 source。
     *
     * <p>父 token 已取消时，返回的子 source 同样处于取消状态。
     */
    public static CancellationSource linkedTo(CancellationToken parent) {
        Objects.requireNonNull(parent, "parent");
        final CancellationSource source = new CancellationSource();
        CancellationToken.Registration registration = parent.onCancel(new Runnable() {
            @Override
            public void run() {
                source.cancel();
            }
        });
        source.parentRegistration = registration;
        if (source.isCancelled()) {
            registration.close();
        }
        return source;
    }

    /**
     * 从父 token 派生子 source，并在 {@code timeout} 到期后自动取消。
     */
    public static CancellationSource linkedTo(CancellationToken parent, Duration timeout) {
        CancellationSource source = linkedTo(parent);
        source.cancelAfter(timeout);
        return source;
    }

    /**
     * 在共享的 {@link DelayScheduler} 上注册到期取消。
     */
    public CancellationSource cancelAfter(Duration timeout) {
        return cancelAfter(timeout, DelayScheduler.shared());
    }

    /**
     * 在指定调度器上注册到期取消；重复调用会替换之前的截止时间。
     */
    public CancellationSource cancelAfter(Duration timeout, DelayScheduler delayScheduler) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(delayScheduler, "delayScheduler");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (isCancelled()) {
            return this;
        }
        ScheduledTask previous = deadlineTask;
        if (previous != null) {
            previous.cancel();
        }
        deadlineTask = delayScheduler.schedule(timeout, new Runnable() {
            @Override
            public void run() {
                cancel();
            }
        });
        if (isCancelled()) {
            deadlineTask.cancel();
        }
        return this;
    }

    /**
     * 该 source 对应的观察端。
     */
    public CancellationToken token() {
        return token;
    }

    /**
     * 是否已经触发取消。
     */
    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * 触发取消。
     *
     * <p>回调异常不会阻止其余回调执行，首个异常在全部回调结束后抛出。
     *
     * @return 本次调用真正执行了取消时返回 true，已取消时返回 false。
     */
    public boolean cancel() {
        try {
            return token.cancel();
        } finally {
            release();
        }
    }

    private void release() {
        CancellationToken.Registration registration = parentRegistration;
        if (registration != null) {
            registration.close();
        }
        ScheduledTask deadline = deadlineTask;
        if (deadline != null) {
            deadline.cancel();
        }
    }
}
