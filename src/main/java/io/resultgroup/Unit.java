package io.resultgroup;

/**
 * One independently runnable piece of work launched on a {@link ResultGroup}.
 *
 * <p>A unit reports partial results and an optional error through {@link UnitResult}.
 * Throwing is equivalent to returning {@link UnitResult#failed(Throwable)}; returning
 * {@code null} is equivalent to {@link UnitResult#empty()}.
 */
@FunctionalInterface
public interface Unit<T> {

    UnitResult<T> call() throws Exception;
}
