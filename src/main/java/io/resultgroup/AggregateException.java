package io.resultgroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents every unit error recorded by a group, in the order the units reported them.
 *
 * <p>The message is each component's message joined with a newline.
 * Components are also attached as suppressed exceptions.
 */
public class AggregateException extends RuntimeException {

    private final List<Throwable> errors;

    public AggregateException(List<? extends Throwable> errors) {
        super(joinMessages(requireNonEmpty(errors)));
        this.errors = Collections.unmodifiableList(new ArrayList<Throwable>(errors));
        for (Throwable error : this.errors) {
            addSuppressed(error);
        }
    }

    /**
     * The recorded component errors.
     */
    public List<Throwable> errors() {
        return errors;
    }

    /**
     * Whether {@code target} is one of the components, or sits in the cause chain of one.
     * Nested aggregates are searched too. Comparison is by identity.
     */
    public boolean contains(Throwable target) {
        Objects.requireNonNull(target, "target");
        return search(target, null) != null;
    }

    /**
     * The first component, or cause of a component, that is an instance of {@code type}.
     *
     * @return the match, or {@code null} when there is none.
     */
    public <E extends Throwable> E find(Class<E> type) {
        Objects.requireNonNull(type, "type");
        Throwable match = search(null, type);
        return match == null ? null : type.cast(match);
    }

    private Throwable search(Throwable target, Class<?> type) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<Throwable, Boolean>();
        for (Throwable error : errors) {
            Throwable match = searchChain(error, target, type, seen);
            if (match != null) {
                return match;
            }
        }
        return null;
    }

    private static Throwable searchChain(Throwable error, Throwable target, Class<?> type, Map<Throwable, Boolean> seen) {
        Throwable current = error;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (current == target || (type != null && type.isInstance(current))) {
                return current;
            }
            if (current instanceof AggregateException) {
                for (Throwable nested : ((AggregateException) current).errors) {
                    Throwable match = searchChain(nested, target, type, seen);
                    if (match != null) {
                        return match;
                    }
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static List<? extends Throwable> requireNonEmpty(List<? extends Throwable> errors) {
        Objects.requireNonNull(errors, "errors");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        return errors;
    }

    private static String joinMessages(List<? extends Throwable> errors) {
        StringBuilder sb = new StringBuilder();
        for (Throwable error : errors) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            String message = error.getMessage();
            sb.append(message != null ? message : error.toString());
        }
        return sb.toString();
    }
}
