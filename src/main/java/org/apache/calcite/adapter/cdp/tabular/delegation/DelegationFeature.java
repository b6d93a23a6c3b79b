package org.apache.calcite.adapter.cdp.tabular.delegation;

import lombok.Getter;

/**
 * Query operations a backend may honor, one bit each.
 * Bit positions are part of the contract with callers building raw masks.
 */
@Getter
public enum DelegationFeature {

    /** $filter */
    FILTER(1L << 0),
    /** $top */
    TOP(1L << 1),
    /** $select */
    COLUMNS(1L << 2),
    /** $orderby */
    SORT(1L << 3),
    /** $apply=join(...) */
    APPLY_JOIN(1L << 4),
    /** $apply=groupby(...) */
    APPLY_GROUP_BY(1L << 5),
    /** $count */
    COUNT(1L << 6),
    /** $apply=aggregate(...) */
    APPLY_TOP_LEVEL_AGGREGATION(1L << 7);

    private final long mask;

    DelegationFeature(long mask) {
        this.mask = mask;
    }

    public boolean isSet(long features) {
        return (features & mask) != 0;
    }

    public static long maskOf(DelegationFeature... features) {
        long result = 0;
        for (DelegationFeature feature : features) {
            result |= feature.mask;
        }
        return result;
    }

    /** Union of every defined bit. */
    public static long knownMask() {
        return maskOf(values());
    }
}
