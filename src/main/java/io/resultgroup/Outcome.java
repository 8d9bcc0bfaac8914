package io.resultgroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What {@link ResultGroup#await()} hands back: every unit's results and the aggregate error, if any.
 *
 * <p>{@link #error()} being {@code null} is the only success signal; an empty aggregate is never produced.
 */
public final class Outcome<T> {

    private final int launched;
    private final List<T> results;
    private final AggregateException error;

    public Outcome(int launched, List<T> results, AggregateException error) {
        this.launched = launched;
        this.results = Collections.unmodifiableList(new ArrayList<T>(results));
        this.error = error;
    }

    /**
     * Number of units launched on the group.
     */
    public int launched() {
        return launched;
    }

    /**
     * Concatenated unit results, in the order units reported.
     */
    public List<T> results() {
        return results;
    }

    /**
     * @return the aggregate of recorded errors, or {@code null} when no unit reported one.
     */
    public AggregateException error() {
        return error;
    }

    public boolean hasErrors() {
        return error != null;
    }

    /**
     * Returns the results, or throws the aggregate error when one was recorded.
     */
    public List<T> resultsOrThrow() {
        if (error != null) {
            throw error;
        }
        return results;
    }
}
