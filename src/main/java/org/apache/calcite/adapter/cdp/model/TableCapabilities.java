package org.apache.calcite.adapter.cdp.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.calcite.adapter.cdp.tabular.delegation.DelegationFeature;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Table-level {@code x-ms-capabilities}: which query operations the backend honors.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TableCapabilities {

    /** Used when the table metadata carries no capabilities block. */
    public static final TableCapabilities DEFAULT = new TableCapabilities(false, false, true, Collections.emptySet(), false);

    private final boolean sortable;
    private final boolean filterable;
    private final boolean selectable;
    private final Set<String> nonFilterableColumns;
    private final boolean onlyServerPageable;

    public TableCapabilities(boolean sortable, boolean filterable, boolean selectable,
                             Set<String> nonFilterableColumns, boolean onlyServerPageable) {
        this.sortable = sortable;
        this.filterable = filterable;
        this.selectable = selectable;
        this.nonFilterableColumns = Collections.unmodifiableSet(new LinkedHashSet<>(nonFilterableColumns));
        this.onlyServerPageable = onlyServerPageable;
    }

    /**
     * Delegation features this table accepts, as a {@link DelegationFeature} bitmask.
     * {@code $top} is always honored; aggregation and count ride on filter support.
     */
    public long supportedFeatures() {
        long mask = DelegationFeature.TOP.getMask();
        if (selectable) {
            mask |= DelegationFeature.COLUMNS.getMask();
        }
        if (sortable) {
            mask |= DelegationFeature.SORT.getMask();
        }
        if (filterable) {
            mask |= DelegationFeature.FILTER.getMask()
                    | DelegationFeature.COUNT.getMask()
                    | DelegationFeature.APPLY_GROUP_BY.getMask()
                    | DelegationFeature.APPLY_TOP_LEVEL_AGGREGATION.getMask();
        }
        return mask;
    }

    public boolean isColumnFilterable(String logicalName) {
        return filterable && !nonFilterableColumns.contains(logicalName);
    }
}
