package org.apache.calcite.adapter.cdp.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One referential constraint pair: {@code sourceColumn -> targetTable.targetColumn}. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Relationship {

    private final String foreignKeyName;
    private final String sourceColumn;
    private final String targetTable;
    private final String targetColumn;
}
