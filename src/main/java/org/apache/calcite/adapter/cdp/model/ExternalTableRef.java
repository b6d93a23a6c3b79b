package org.apache.calcite.adapter.cdp.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Declared link from a column to a column of another table of the same dataset.
 * Holds names only; the target table is hydrated separately.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ExternalTableRef {

    private final String targetTable;
    /** May be null when the backend only names the table */
    private final String targetColumn;
    /** May be null when the backend does not name the constraint */
    private final String foreignKeyName;
}
