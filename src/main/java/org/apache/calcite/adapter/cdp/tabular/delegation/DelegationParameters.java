package org.apache.calcite.adapter.cdp.tabular.delegation;

import org.apache.calcite.adapter.cdp.tabular.exception.UnsupportedCapabilityException;

import java.util.List;

/**
 * Operations a query wants the backend to perform instead of evaluating them locally.
 * <p>
 * Values are kept unencoded; {@link ODataQueryCompiler} escapes them.
 * </p>
 */
public abstract class DelegationParameters {

    /** Field carrying the value of a top level aggregation, e.g. a sum. */
    public static final String ODATA_AGGREGATION_RESULT_FIELD_NAME = "result";

    /** Field carrying the total row count when {@code $count=true} is sent. */
    public static final String ODATA_COUNT_FIELD_NAME = "@odata.count";

    /** Field carrying the records of a response. */
    public static final String ODATA_RESULT_FIELD_NAME = "value";

    /** Field carrying the link to the next page of records. */
    public static final String ODATA_NEXT_LINK_FIELD_NAME = "@odata.nextLink";

    /**
     * @return declared {@link DelegationFeature} bits, unknown bits included as given
     */
    public abstract long getFeatures();

    /** Logical column names; empty means all columns. */
    public List<String> getColumns() {
        return List.of();
    }

    /** OData filter expression, or null. */
    public abstract String getFilter();

    public abstract List<OrderByColumn> getOrderBy();

    /** OData $apply expression, or null. */
    public abstract String getApply();

    public abstract boolean isReturnTotalCount();

    /** Null when no row limit is requested. */
    public abstract Integer getTop();

    /**
     * @throws UnsupportedCapabilityException if declared features fall outside {@code allowedFeatures}
     */
    public void ensureOnlyFeatures(long allowedFeatures) {
        long flags = getFeatures();
        if ((~allowedFeatures & flags) != 0) {
            throw UnsupportedCapabilityException.buildUnsupportedCapabilityException(flags, allowedFeatures);
        }
    }
}
