package org.apache.calcite.adapter.cdp.tests;

import org.apache.calcite.adapter.cdp.tabular.delegation.DelegationFeature;
import org.apache.calcite.adapter.cdp.tabular.delegation.DelegationRequest;
import org.apache.calcite.adapter.cdp.tabular.delegation.ODataQueryCompiler;
import org.apache.calcite.adapter.cdp.tabular.delegation.OrderByColumn;
import org.apache.calcite.adapter.cdp.tabular.exception.UnsupportedCapabilityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OData query strings produced from delegation requests.
 */
public class ODataQueryCompilerTest {

    private final ODataQueryCompiler compiler = new ODataQueryCompiler();

    private static long features(DelegationFeature... features) {
        return DelegationFeature.maskOf(features);
    }

    @Test
    @DisplayName("Feature flags are unique single bits")
    public void testFeatureFlagsArePowersOfTwo() {
        Set<Long> seen = new HashSet<>();
        for (DelegationFeature feature : DelegationFeature.values()) {
            long value = feature.getMask();
            assertNotEquals(0, value, feature.name());
            assertEquals(0, value & (value - 1), feature.name() + " must be a single bit");
            assertTrue(seen.add(value), feature.name() + " shares its bit");
        }
        assertEquals(5L, features(DelegationFeature.FILTER, DelegationFeature.COLUMNS));
    }

    @Test
    @DisplayName("Empty request compiles to an empty string")
    public void testEmptyRequest() {
        assertEquals("", compiler.compile(DelegationRequest.empty()));
    }

    @Test
    @DisplayName("Filter and top")
    public void testFilterAndTop() {
        DelegationRequest request = DelegationRequest.builder()
            .features(features(DelegationFeature.FILTER, DelegationFeature.TOP))
            .filter("score gt 5")
            .top(10)
            .build();

        assertEquals("$filter=score+gt+5&$top=10", compiler.compile(request));
    }

    @Test
    @DisplayName("Sort ascending and descending")
    public void testOrderBy() {
        DelegationRequest ascending = DelegationRequest.builder()
            .features(features(DelegationFeature.FILTER, DelegationFeature.TOP, DelegationFeature.SORT))
            .filter("score gt 5")
            .top(10)
            .orderBy(List.of(OrderByColumn.asc("score")))
            .build();
        DelegationRequest descending = DelegationRequest.builder()
            .features(features(DelegationFeature.FILTER, DelegationFeature.TOP, DelegationFeature.SORT))
            .filter("score gt 5")
            .top(10)
            .orderBy(List.of(OrderByColumn.desc("score")))
            .build();

        assertEquals("$filter=score+gt+5&$orderby=score&$top=10", compiler.compile(ascending));
        assertEquals("$filter=score+gt+5&$orderby=score desc&$top=10", compiler.compile(descending));
    }

    @Test
    @DisplayName("Several sort columns are comma joined")
    public void testMultipleOrderByColumns() {
        DelegationRequest request = DelegationRequest.builder()
            .orderBy(List.of(OrderByColumn.desc("score"), OrderByColumn.asc("name")))
            .build();

        assertEquals("$orderby=score desc,name", compiler.compile(request));
    }

    @Test
    @DisplayName("Columns: listed columns become $select, an empty list adds nothing")
    public void testColumns() {
        DelegationRequest columns = DelegationRequest.builder()
            .features(features(DelegationFeature.COLUMNS))
            .columns(List.of("c1", "c2"))
            .build();
        DelegationRequest noColumns = DelegationRequest.builder()
            .features(features(DelegationFeature.COLUMNS))
            .columns(List.of())
            .build();

        assertEquals("$select=c1,c2", compiler.compile(columns));
        assertEquals("", compiler.compile(noColumns));
    }

    @Test
    @DisplayName("Full clause order: select, filter, apply, orderby, top, count")
    public void testClauseOrder() {
        DelegationRequest request = DelegationRequest.builder()
            .columns(List.of("Name"))
            .filter("Name eq 'O''Brien'")
            .apply("aggregate(Amount with sum as result)")
            .orderBy(List.of(OrderByColumn.asc("Name")))
            .top(3)
            .returnTotalCount(true)
            .build();

        assertEquals("$select=Name"
                + "&$filter=Name+eq+%27O%27%27Brien%27"
                + "&$apply=aggregate%28Amount+with+sum+as+result%29"
                + "&$orderby=Name"
                + "&$top=3"
                + "&$count=true",
            compiler.compile(request));
    }

    @Test
    @DisplayName("Declared feature subsets succeed, undefined bits are rejected")
    public void testCapabilityCheck() {
        assertEquals("", compiler.compile(DelegationRequest.builder().features(0).build()));
        assertEquals("", compiler.compile(DelegationRequest.builder().features(5).build()));

        UnsupportedCapabilityException future = assertThrows(UnsupportedCapabilityException.class,
            () -> compiler.compile(DelegationRequest.builder().features(0x1000000).build()));
        assertEquals(0x1000000, future.getRequested());
        assertThrows(UnsupportedCapabilityException.class,
            () -> compiler.compile(DelegationRequest.builder().features(0x1000005).build()));
        assertThrows(IllegalStateException.class,
            () -> new ODataQueryCompiler(-1L).compile(DelegationRequest.builder().features(1L << 40).build()));
    }

    @Test
    @DisplayName("Usage implied by values is checked, not only the declared bits")
    public void testImpliedUsageIsChecked() {
        ODataQueryCompiler topOnly = new ODataQueryCompiler(features(DelegationFeature.TOP));

        assertEquals("$top=7", topOnly.compile(DelegationRequest.builder().top(7).build()));
        assertThrows(UnsupportedCapabilityException.class,
            () -> topOnly.compile(DelegationRequest.builder().filter("a eq 1").build()));
        assertThrows(UnsupportedCapabilityException.class,
            () -> topOnly.compile(DelegationRequest.builder().returnTotalCount(true).build()));
        assertThrows(UnsupportedCapabilityException.class,
            () -> topOnly.compile(DelegationRequest.builder().apply("aggregate($count as result)").build()));
    }

    @Test
    @DisplayName("An apply without apply bits counts as a top level aggregation")
    public void testApplyFeatures() {
        DelegationRequest aggregation = DelegationRequest.builder().apply("aggregate($count as result)").build();
        assertEquals(features(DelegationFeature.APPLY_TOP_LEVEL_AGGREGATION), ODataQueryCompiler.usedFeatures(aggregation));

        DelegationRequest join = DelegationRequest.builder()
            .features(features(DelegationFeature.APPLY_JOIN))
            .apply("join(Orders as o)")
            .build();
        assertEquals(features(DelegationFeature.APPLY_JOIN), ODataQueryCompiler.usedFeatures(join));
        assertThrows(UnsupportedCapabilityException.class, () -> compiler.compile(join));
    }

    @Test
    @DisplayName("ensureOnlyFeatures checks declared bits")
    public void testEnsureOnlyFeatures() {
        DelegationRequest request = DelegationRequest.builder()
            .features(features(DelegationFeature.FILTER, DelegationFeature.SORT))
            .build();

        request.ensureOnlyFeatures(ODataQueryCompiler.DEFAULT_SUPPORTED_FEATURES);
        assertThrows(UnsupportedCapabilityException.class,
            () -> request.ensureOnlyFeatures(features(DelegationFeature.FILTER)));
    }
}
