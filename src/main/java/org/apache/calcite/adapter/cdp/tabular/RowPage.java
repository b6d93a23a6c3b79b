package org.apache.calcite.adapter.cdp.tabular;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * One page of records returned by a table's {@code items} endpoint.
 */
@Getter
@AllArgsConstructor
public class RowPage {

    /** Records keyed by logical column name, in response order */
    private final List<Map<String, Object>> rows;
    /** Relative path of the next page, null on the last page */
    private final String nextLink;
    /** {@code @odata.count}, null unless requested */
    private final Long totalCount;

    public boolean hasNext() {
        return nextLink != null;
    }
}
