package io.resultgroup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a single unit reports back: its partial results and, optionally, its error.
 *
 * <p>Both may be present at once; the group keeps the results of a failed unit.
 */
public final class UnitResult<T> {

    private final List<T> values;
    private final Throwable error;

    private UnitResult(List<T> values, Throwable error) {
        this.values = values;
        this.error = error;
    }

    public static <T> UnitResult<T> empty() {
        return new UnitResult<T>(Collections.<T>emptyList(), null);
    }

    public static <T> UnitResult<T> of(Collection<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return new UnitResult<T>(copy(values), null);
    }

    @SafeVarargs
    public static <T> UnitResult<T> of(T... values) {
        Objects.requireNonNull(values, "values");
        return new UnitResult<T>(copy(Arrays.asList(values)), null);
    }

    public static <T> UnitResult<T> failed(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new UnitResult<T>(Collections.<T>emptyList(), error);
    }

    /**
     * Partial success: the values are kept and the error is recorded.
     */
    public static <T> UnitResult<T> partial(Collection<? extends T> values, Throwable error) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(error, "error");
        return new UnitResult<T>(copy(values), error);
    }

    public List<T> values() {
        return values;
    }

    /**
     * @return the reported error, or {@code null} when the unit succeeded.
     */
    public Throwable error() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }

    private static <T> List<T> copy(Collection<? extends T> values) {
        if (values.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<T>(values));
    }
}
