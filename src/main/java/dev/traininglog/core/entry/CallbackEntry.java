package dev.traininglog.core.entry;

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link LazyEntry} assembled from callbacks, so backends compose it instead of subclassing.
 */
public final class CallbackEntry extends LazyEntry {
    private final Supplier<Map<String, Object>> reader;

    private final BiConsumer<String, Object> writer;

    private final Consumer<String> remover;

    public CallbackEntry(final Supplier<Map<String, Object>> reader,
                         final BiConsumer<String, Object> writer,
                         final Consumer<String> remover) {
        this.reader = reader;
        this.writer = writer;
        this.remover = remover;
    }

    @Override
    protected Map<String, Object> materialize() {
        return reader.get();
    }

    @Override
    protected void write(final String field, final Object value) {
        writer.accept(field, value);
    }

    @Override
    protected void unset(final String field) {
        remover.accept(field);
    }
}
