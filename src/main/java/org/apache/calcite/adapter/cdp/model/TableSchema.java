package org.apache.calcite.adapter.cdp.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved, immutable shape of one table: ordered columns, relationships keyed by the
 * referenced table, and table capabilities.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TableSchema {

    private final String tableName;
    private final String displayName;
    private final List<ColumnDescriptor> columns;
    /** Target table -> constraint pairs. Empty is a valid state. */
    private final Map<String, List<Relationship>> relationships;
    private final TableCapabilities capabilities;

    @Getter(lombok.AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Map<String, ColumnDescriptor> columnsByName;

    public TableSchema(String tableName, String displayName, List<ColumnDescriptor> columns,
                       Map<String, List<Relationship>> relationships, TableCapabilities capabilities) {
        this.tableName = tableName;
        this.displayName = displayName;
        this.columns = List.copyOf(columns);
        Map<String, List<Relationship>> byTarget = new LinkedHashMap<>();
        relationships.forEach((target, pairs) -> byTarget.put(target, List.copyOf(pairs)));
        this.relationships = Collections.unmodifiableMap(byTarget);
        this.capabilities = capabilities;

        Map<String, ColumnDescriptor> byName = new LinkedHashMap<>();
        for (ColumnDescriptor column : columns) {
            if (byName.put(column.getLogicalName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column '" + column.getLogicalName() + "' in table " + tableName);
            }
        }
        this.columnsByName = Collections.unmodifiableMap(byName);
    }

    public Optional<ColumnDescriptor> getColumn(String logicalName) {
        return Optional.ofNullable(columnsByName.get(logicalName));
    }

    /**
     * First column, in schema order, carrying the given display name.
     */
    public Optional<ColumnDescriptor> findColumnByDisplayName(String displayName) {
        return columns.stream().filter(c -> displayName.equals(c.getDisplayName())).findFirst();
    }

    public List<Relationship> getRelationships(String targetTable) {
        return relationships.getOrDefault(targetTable, Collections.emptyList());
    }
}
