package org.apache.calcite.adapter.cdp.tabular.delegation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Immutable {@link DelegationParameters} built fresh for each query evaluation.
 */
@Getter
@Builder
@ToString
public class DelegationRequest extends DelegationParameters {

    @Builder.Default
    private final long features = 0L;
    @Builder.Default
    private final List<String> columns = List.of();
    private final String filter;
    @Builder.Default
    private final List<OrderByColumn> orderBy = List.of();
    private final String apply;
    private final boolean returnTotalCount;
    private final Integer top;

    public static DelegationRequest empty() {
        return builder().build();
    }
}
