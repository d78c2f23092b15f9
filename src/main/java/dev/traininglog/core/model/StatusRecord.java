package dev.traininglog.core.model;

import dev.traininglog.core.MissingFieldException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Progress counters of the training loop. Always holds {@code iterations_done} and {@code epochs_done},
 * both kept as {@link Long}.
 * <p>
 * Excluded names are still readable and writable, they are only hidden from {@link #names()} and {@link #size()}.
 * The training loop is the only writer; methods are synchronized so request threads can read alongside it.
 */
public class StatusRecord {
    public static final String ITERATIONS_DONE = "iterations_done";
    public static final String EPOCHS_DONE = "epochs_done";
    public static final String EPOCH_ENDS = "epoch_ends";

    private static final Set<String> COUNTERS = Set.of(ITERATIONS_DONE, EPOCHS_DONE);

    private final Map<String, Object> values = new LinkedHashMap<>();

    private final Set<String> exclude;

    private BiConsumer<String, Object> writeThrough = (name, value) -> {
    };

    public StatusRecord() {
        this(Collections.emptySet());
    }

    public StatusRecord(final Collection<String> exclude) {
        this.exclude = exclude == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(exclude));
        values.put(ITERATIONS_DONE, 0L);
        values.put(EPOCHS_DONE, 0L);
    }

    /**
     * Every subsequent {@link #set} is forwarded to {@code sink}, used by backends that persist status.
     */
    public synchronized void bind(final BiConsumer<String, Object> sink) {
        this.writeThrough = sink == null ? (name, value) -> {
        } : sink;
    }

    public synchronized Object get(final String name) {
        if (!values.containsKey(name)) {
            throw new MissingFieldException(name);
        }
        return values.get(name);
    }

    public synchronized boolean contains(final String name) {
        return values.containsKey(name);
    }

    public synchronized void set(final String name, final Object value) {
        final Object stored = coerce(name, value);
        values.put(name, stored);
        writeThrough.accept(name, stored);
    }

    // counters stay Long whatever integral type the caller or the storage hands over
    private static Object coerce(final String name, final Object value) {
        if (COUNTERS.contains(name) && value instanceof Number n && !(value instanceof Double || value instanceof Float)) {
            return n.longValue();
        }
        return value;
    }

    public synchronized long getLong(final String name) {
        final Object v = get(name);
        if (v instanceof Number n) {
            return n.longValue();
        }
        throw new IllegalStateException("status " + name + " is not numeric: " + v);
    }

    public long iterationsDone() {
        return getLong(ITERATIONS_DONE);
    }

    public long epochsDone() {
        return getLong(EPOCHS_DONE);
    }

    public synchronized long increment(final String name) {
        final long next = getLong(name) + 1;
        set(name, next);
        return next;
    }

    public synchronized void append(final String name, final Object value) {
        final List<Object> list = new ArrayList<>();
        final Object current = values.get(name);
        if (current instanceof Collection<?> c) {
            list.addAll(c);
        } else if (current != null) {
            throw new IllegalStateException("status " + name + " is not a list: " + current);
        }
        list.add(value);
        set(name, list);
    }

    /**
     * Names visible for iteration, in insertion order. Restartable: every call gives a fresh view.
     */
    public Iterable<String> names() {
        return () -> {
            synchronized (this) {
                return values.keySet().stream().filter(name -> !exclude.contains(name)).toList().iterator();
            }
        };
    }

    public synchronized int size() {
        return (int) values.keySet().stream().filter(name -> !exclude.contains(name)).count();
    }

    public Set<String> exclude() {
        return exclude;
    }

    /**
     * Copy of all values, excluded names included. Used for snapshots.
     */
    public synchronized Map<String, Object> toMap() {
        return new LinkedHashMap<>(values);
    }

    /**
     * Replaces values without forwarding them to the bound sink (they already came from storage).
     */
    public synchronized void load(final Map<String, Object> stored) {
        if (stored != null) {
            stored.forEach((name, value) -> values.put(name, coerce(name, value)));
        }
    }
}
