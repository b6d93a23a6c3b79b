package org.apache.calcite.adapter.cdp.tabular.delegation;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class OrderByColumn {

    private final String column;
    private final boolean ascending;

    public static OrderByColumn asc(String column) {
        return new OrderByColumn(column, true);
    }

    public static OrderByColumn desc(String column) {
        return new OrderByColumn(column, false);
    }
}
