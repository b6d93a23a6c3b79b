package org.apache.calcite.adapter.cdp.tests;

import org.apache.calcite.adapter.cdp.model.ConnectorSettings;
import org.apache.calcite.adapter.cdp.model.TableDescriptor;
import org.apache.calcite.adapter.cdp.model.TableSchema;
import org.apache.calcite.adapter.cdp.tabular.CdpDataSource;
import org.apache.calcite.adapter.cdp.tabular.exception.CdpException;
import org.apache.calcite.adapter.cdp.tabular.exception.TransportException;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpResponse;
import org.apache.calcite.adapter.cdp.tests.base.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Table metadata cache of a data source, driven through an in-memory transport.
 *
 * Responses can be held back, so fetches stay in flight while the test
 * adds waiters, cancels them or clears the cache.
 */
public class TableMetadataCacheTest {

    private static final String PREFIX = "/apim/sql/c1";
    private static final String DATASETS_METADATA = PREFIX + "/v2/$metadata.json/datasets";
    private static final String TABLES = PREFIX + "/v2/datasets/default%252Cdefault/tables";
    private static final String ORDERS_METADATA =
        PREFIX + "/v2/$metadata.json/datasets/default%252Cdefault/tables/%255Bdbo%255D.%255BOrders%255D?api-version=2015-09-01";
    private static final String PRODUCTS_METADATA =
        PREFIX + "/v2/$metadata.json/datasets/default%252Cdefault/tables/%255Bdbo%255D.%255BProducts%255D?api-version=2015-09-01";

    private static final String DATASETS_RESPONSE =
        "{\"tabular\": {\"source\": \"mru\", \"displayName\": \"dataset\", \"urlEncoding\": \"double\","
            + " \"tableDisplayName\": \"Table name\", \"tablePluralName\": \"Tables\"}, \"blob\": null}";
    private static final String TABLES_RESPONSE =
        "{\"value\": [{\"Name\": \"[dbo].[Orders]\", \"DisplayName\": \"Orders\"},"
            + " {\"Name\": \"[dbo].[Products]\", \"DisplayName\": \"Products\"}]}";
    private static final String ORDERS_RESPONSE =
        "{\"name\": \"[dbo].[Orders]\", \"title\": \"Orders\", \"schema\": {\"items\": {\"properties\": {"
            + "\"Id\": {\"type\": \"integer\"}, \"Total\": {\"type\": \"number\"}}}}}";
    private static final String PRODUCTS_RESPONSE =
        "{\"name\": \"[dbo].[Products]\", \"title\": \"Products\", \"schema\": {\"items\": {\"properties\": {"
            + "\"Sku\": {\"type\": \"string\"}}}}}";

    private RecordingTransport transport;
    private CdpDataSource dataSource;
    private List<TableDescriptor> listing;

    @BeforeEach
    public void setup() {
        transport = new RecordingTransport()
            .respond(DATASETS_METADATA, DATASETS_RESPONSE)
            .respond(TABLES, TABLES_RESPONSE)
            .respond(ORDERS_METADATA, ORDERS_RESPONSE)
            .respond(PRODUCTS_METADATA, PRODUCTS_RESPONSE);
        dataSource = new CdpDataSource("default,default", PREFIX, transport, new ConnectorSettings());
        listing = dataSource.listTables();
    }

    @AfterEach
    public void tearDown() {
        transport.releaseResponses();
        dataSource.close();
    }

    private TableDescriptor orders() {
        return new TableDescriptor("default,default", "[dbo].[Orders]", "Orders", listing.get(0).getListing());
    }

    private TableDescriptor products() {
        return new TableDescriptor("default,default", "[dbo].[Products]", "Products", listing.get(0).getListing());
    }

    @Test
    @DisplayName("Double encoded dataset and table names in the metadata URI")
    public void testMetadataUri() {
        dataSource.initTable(orders());

        assertEquals(List.of(DATASETS_METADATA, TABLES, ORDERS_METADATA), transport.getPaths());
        assertTrue(dataSource.getTableMetadataCache().contains(ORDERS_METADATA));
    }

    @Test
    @DisplayName("Cache hit: the second initialization sends nothing and shares the schema")
    public void testCacheHit() {
        TableDescriptor first = dataSource.initTable(orders());
        long requests = transport.getRequests().size();

        TableDescriptor second = dataSource.initTable(orders());

        assertEquals(requests, transport.getRequests().size());
        assertEquals(1, dataSource.getTableMetadataCache().size());
        assertSame(first.getSchema(), second.getSchema());
    }

    @Test
    @DisplayName("Cache miss per key: two tables, two entries, two requests in call order")
    public void testCacheMissPerTable() {
        dataSource.initTable(orders());
        dataSource.initTable(products());

        assertEquals(2, dataSource.getTableMetadataCache().size());
        List<String> paths = transport.getPaths();
        assertEquals(List.of(ORDERS_METADATA, PRODUCTS_METADATA), paths.subList(2, paths.size()));
    }

    @Test
    @DisplayName("At most one fetch: waiters joining an in-flight fetch share its result")
    public void testConcurrentWaiters() {
        transport.holdResponses();
        List<CompletableFuture<TableDescriptor>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(dataSource.initTableAsync(orders()));
        }
        assertTrue(futures.stream().noneMatch(CompletableFuture::isDone));

        transport.releaseResponses();

        TableSchema schema = futures.get(0).join().getSchema();
        for (CompletableFuture<TableDescriptor> future : futures) {
            assertSame(schema, future.join().getSchema());
        }
        assertEquals(1, transport.count(ORDERS_METADATA));
    }

    @Test
    @DisplayName("Failed fetch: every waiter sees the error, the entry is evicted, the next call retries")
    public void testFailureThenRetry() {
        AtomicInteger calls = new AtomicInteger();
        transport.respond(ORDERS_METADATA, request -> {
            if (calls.getAndIncrement() == 0) {
                throw TransportException.buildStatusException("GET", request.getPath(), 503, "busy");
            }
            return new CdpResponse(200, ORDERS_RESPONSE);
        });

        transport.holdResponses();
        List<CompletableFuture<TableDescriptor>> futures = List.of(
            dataSource.initTableAsync(orders()),
            dataSource.initTableAsync(orders()),
            dataSource.initTableAsync(orders()));
        transport.releaseResponses();

        for (CompletableFuture<TableDescriptor> future : futures) {
            CompletionException error = assertThrows(CompletionException.class, future::join);
            assertTrue(error.getCause() instanceof TransportException);
            assertEquals(503, ((TransportException) error.getCause()).getStatusCode());
        }
        assertFalse(dataSource.getTableMetadataCache().contains(ORDERS_METADATA));

        TableDescriptor retried = dataSource.initTable(orders());
        assertTrue(retried.isInitialized());
        assertEquals(2, transport.count(ORDERS_METADATA));
    }

    @Test
    @DisplayName("Empty response: typed error, nothing cached")
    public void testEmptyResponse() {
        transport.respond(ORDERS_METADATA, " ");

        CdpException error = assertThrows(CdpException.class, () -> dataSource.initTable(orders()));
        assertEquals("resolveTable didn't receive any response for [dbo].[Orders]", error.getMessage());
        assertTrue(dataSource.getTableMetadataCache().isEmpty());
    }

    @Test
    @DisplayName("Cancellation: one waiter leaving does not disturb the others")
    public void testCancelOneWaiter() {
        transport.holdResponses();
        CompletableFuture<TableDescriptor> cancelled = dataSource.initTableAsync(orders());
        CompletableFuture<TableDescriptor> other = dataSource.initTableAsync(orders());

        assertTrue(cancelled.cancel(true));
        transport.releaseResponses();

        assertTrue(other.join().isInitialized());
        assertTrue(cancelled.isCancelled());
        assertEquals(1, transport.count(ORDERS_METADATA));
    }

    @Test
    @DisplayName("Cancellation: when the last waiter leaves, the fetch still completes and stays cached")
    public void testCancelLastWaiter() throws Exception {
        transport.holdResponses();
        TableDescriptor descriptor = orders();
        CompletableFuture<TableDescriptor> only = dataSource.initTableAsync(descriptor);
        assertTrue(only.cancel(true));
        transport.releaseResponses();

        TableSchema cached = dataSource.getTableMetadataCache().getIfPresent(ORDERS_METADATA)
            .toCompletableFuture().get(10, TimeUnit.SECONDS);
        assertNotNull(cached);
        assertFalse(descriptor.isInitialized(), "A cancelled caller's descriptor is not initialized");

        TableDescriptor again = dataSource.initTable(orders());
        assertSame(cached, again.getSchema());
        assertEquals(1, transport.count(ORDERS_METADATA));
    }

    @Test
    @DisplayName("Clear: no requests, the cache is empty afterwards")
    public void testClearIsNetworkFree() {
        dataSource.initTable(orders());
        dataSource.initTable(products());
        int requests = transport.getRequests().size();

        dataSource.clearTableMetadataCache();

        assertEquals(0, dataSource.getTableMetadataCache().size());
        assertEquals(requests, transport.getRequests().size());
    }

    @Test
    @DisplayName("Clear during a fetch: waiters still get the result, which is not stored back")
    public void testClearDuringFetch() {
        transport.holdResponses();
        CompletableFuture<TableDescriptor> inFlight = dataSource.initTableAsync(orders());
        dataSource.clearTableMetadataCache();
        transport.releaseResponses();

        assertTrue(inFlight.join().isInitialized());
        assertTrue(dataSource.getTableMetadataCache().isEmpty());

        dataSource.initTable(orders());
        assertEquals(2, transport.count(ORDERS_METADATA));
    }

    @Test
    @DisplayName("Idempotence: re-resolving after clear yields an equal schema")
    public void testResolveAfterClearIsIdentical() {
        TableSchema first = dataSource.initTable(orders()).getSchema();
        dataSource.clearTableMetadataCache();
        TableSchema second = dataSource.initTable(orders()).getSchema();

        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }

    @Test
    @DisplayName("Dataset metadata is requested once per data source")
    public void testDatasetMetadataMemoized() {
        dataSource.initTable(orders());
        dataSource.initTable(products());
        dataSource.listTables();

        assertEquals(1, transport.count(DATASETS_METADATA));
    }

    @Test
    @DisplayName("Cancellation racing the fetch: a cancelled caller never gets an initialized descriptor")
    public void testCancelRacingCompletion() throws Exception {
        ExecutorService fetchExecutor = Executors.newSingleThreadExecutor();
        try (CdpDataSource racing = new CdpDataSource("default,default", PREFIX, transport, new ConnectorSettings(), fetchExecutor)) {
            int cancelled = 0;
            for (int i = 0; i < 200; i++) {
                racing.clearTableMetadataCache();
                TableDescriptor descriptor = orders();

                CompletableFuture<TableDescriptor> future = racing.initTableAsync(descriptor);
                if (future.cancel(true)) {
                    cancelled++;
                }
                // the fetch and its callbacks run on the single fetch thread
                fetchExecutor.submit(() -> { }).get(10, TimeUnit.SECONDS);

                assertNotEquals(future.isCancelled(), descriptor.isInitialized(),
                    "iteration " + i + ": cancelled=" + future.isCancelled() + " initialized=" + descriptor.isInitialized());
            }
            System.out.println("Cancelled " + cancelled + " of 200 initializations");
        } finally {
            fetchExecutor.shutdownNow();
        }
    }
}
