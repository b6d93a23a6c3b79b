package org.apache.calcite.adapter.cdp.tabular.delegation;

import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import org.apache.calcite.adapter.cdp.tabular.exception.UnsupportedCapabilityException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compiles {@link DelegationParameters} into an OData query string.
 *
 * <p>The result has no leading {@code ?} and is empty when no clause applies.
 * Clauses are emitted in a fixed order and joined with {@code &}:</p>
 * <pre>
 * $select  only for a non-empty column list, items escaped and comma joined
 * $filter  escaped, spaces become '+'
 * $apply   escaped
 * $orderby escaped column names, " desc" appended verbatim for descending columns
 * $top
 * $count   "true" when a total count is requested
 * </pre>
 *
 * <p>Before anything is built, the features the request <em>uses</em> (declared bits plus
 * bits implied by the values present) must be a subset of the supported set, otherwise
 * {@link UnsupportedCapabilityException} is thrown. Undefined bits are never supported.</p>
 */
public class ODataQueryCompiler {

    /** What a CDP tabular connector accepts when the table declares nothing narrower. */
    public static final long DEFAULT_SUPPORTED_FEATURES = DelegationFeature.maskOf(
            DelegationFeature.FILTER,
            DelegationFeature.TOP,
            DelegationFeature.COLUMNS,
            DelegationFeature.SORT,
            DelegationFeature.APPLY_GROUP_BY,
            DelegationFeature.APPLY_TOP_LEVEL_AGGREGATION,
            DelegationFeature.COUNT);

    private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();

    private final long supportedFeatures;

    public ODataQueryCompiler() {
        this(DEFAULT_SUPPORTED_FEATURES);
    }

    public ODataQueryCompiler(long supportedFeatures) {
        // undefined bits can never be honored
        this.supportedFeatures = supportedFeatures & DelegationFeature.knownMask();
    }

    public long getSupportedFeatures() {
        return supportedFeatures;
    }

    /**
     * @param parameters request to compile
     * @return OData query string, possibly empty
     * @throws UnsupportedCapabilityException if the request uses an unsupported feature
     */
    public String compile(DelegationParameters parameters) {
        long used = usedFeatures(parameters);
        if ((used & ~supportedFeatures) != 0) {
            throw UnsupportedCapabilityException.buildUnsupportedCapabilityException(used, supportedFeatures);
        }

        List<String> clauses = new ArrayList<>();

        List<String> columns = parameters.getColumns();
        if (columns != null && !columns.isEmpty()) {
            clauses.add("$select=" + columns.stream().map(ESCAPER::escape).collect(Collectors.joining(",")));
        }
        if (hasText(parameters.getFilter())) {
            clauses.add("$filter=" + ESCAPER.escape(parameters.getFilter()));
        }
        if (hasText(parameters.getApply())) {
            clauses.add("$apply=" + ESCAPER.escape(parameters.getApply()));
        }
        List<OrderByColumn> orderBy = parameters.getOrderBy();
        if (orderBy != null && !orderBy.isEmpty()) {
            clauses.add("$orderby=" + orderBy.stream()
                    .map(o -> ESCAPER.escape(o.getColumn()) + (o.isAscending() ? "" : " desc"))
                    .collect(Collectors.joining(",")));
        }
        if (parameters.getTop() != null) {
            clauses.add("$top=" + parameters.getTop());
        }
        if (parameters.isReturnTotalCount()) {
            clauses.add("$count=true");
        }
        return Joiner.on('&').join(clauses);
    }

    /**
     * Declared features plus the ones implied by the values present.
     * An $apply without a declared apply bit counts as a top level aggregation.
     */
    public static long usedFeatures(DelegationParameters parameters) {
        long used = parameters.getFeatures();
        if (hasText(parameters.getFilter())) {
            used |= DelegationFeature.FILTER.getMask();
        }
        if (parameters.getColumns() != null && !parameters.getColumns().isEmpty()) {
            used |= DelegationFeature.COLUMNS.getMask();
        }
        if (parameters.getOrderBy() != null && !parameters.getOrderBy().isEmpty()) {
            used |= DelegationFeature.SORT.getMask();
        }
        if (parameters.getTop() != null) {
            used |= DelegationFeature.TOP.getMask();
        }
        if (parameters.isReturnTotalCount()) {
            used |= DelegationFeature.COUNT.getMask();
        }
        long applyBits = DelegationFeature.maskOf(DelegationFeature.APPLY_JOIN,
                DelegationFeature.APPLY_GROUP_BY, DelegationFeature.APPLY_TOP_LEVEL_AGGREGATION);
        if (hasText(parameters.getApply()) && (used & applyBits) == 0) {
            used |= DelegationFeature.APPLY_TOP_LEVEL_AGGREGATION.getMask();
        }
        return used;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
