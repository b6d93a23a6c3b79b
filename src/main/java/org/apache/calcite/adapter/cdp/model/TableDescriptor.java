package org.apache.calcite.adapter.cdp.model;

import lombok.Getter;
import org.apache.calcite.adapter.cdp.tabular.exception.NotInitializedException;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A table of a dataset, before or after schema hydration.
 * <p>
 * Descriptors come out of a table listing uninitialized. The schema is attached exactly
 * once; afterwards the descriptor is read-only and safe to share between threads.
 * </p>
 */
@Getter
public class TableDescriptor {

    private final String datasetName;
    /** Wire name */
    private final String tableName;
    private final String displayName;
    /** Listing this descriptor came from, used to translate display names */
    private final List<RawTable> listing;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<TableSchema> schema = new AtomicReference<>();

    public TableDescriptor(String datasetName, String tableName, String displayName, List<RawTable> listing) {
        this.datasetName = datasetName;
        this.tableName = tableName;
        this.displayName = displayName;
        this.listing = listing == null ? List.of() : List.copyOf(listing);
    }

    public boolean isInitialized() {
        return schema.get() != null;
    }

    /**
     * @return the resolved schema
     * @throws NotInitializedException if the table was never initialized
     */
    public TableSchema getSchema() {
        TableSchema current = schema.get();
        if (current == null) {
            throw NotInitializedException.buildNotInitializedException(tableName);
        }
        return current;
    }

    /**
     * Attaches the resolved schema.
     * Concurrent initializations sharing one fetch attach the same instance and are accepted.
     *
     * @throws IllegalStateException if a different schema is already attached
     */
    public void initialize(TableSchema resolved) {
        if (!schema.compareAndSet(null, resolved) && schema.get() != resolved) {
            throw new IllegalStateException("Table '" + tableName + "' is already initialized");
        }
    }
}
