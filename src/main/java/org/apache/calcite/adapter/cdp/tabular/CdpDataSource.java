package org.apache.calcite.adapter.cdp.tabular;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.calcite.adapter.cdp.model.ColumnDescriptor;
import org.apache.calcite.adapter.cdp.model.ConnectorSettings;
import org.apache.calcite.adapter.cdp.model.DatasetMetadata;
import org.apache.calcite.adapter.cdp.model.ExternalTableRef;
import org.apache.calcite.adapter.cdp.model.RawTable;
import org.apache.calcite.adapter.cdp.model.TableDescriptor;
import org.apache.calcite.adapter.cdp.model.TableSchema;
import org.apache.calcite.adapter.cdp.tabular.cache.MetadataCache;
import org.apache.calcite.adapter.cdp.tabular.exception.CdpException;
import org.apache.calcite.adapter.cdp.tabular.service.CdpEncoding;
import org.apache.calcite.adapter.cdp.tabular.service.CdpTableResolver;
import org.apache.calcite.adapter.cdp.tabular.service.DatasetMetadataParser;
import org.apache.calcite.adapter.cdp.tabular.service.TableListParser;
import org.apache.calcite.adapter.cdp.tabular.service.TableSchemaParser;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpRequest;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpResponse;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@code CdpDataSource} is one dataset of a tabular connector.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Fetches and memoizes the dataset metadata.</li>
 *   <li>Lists tables as uninitialized {@link TableDescriptor}s.</li>
 *   <li>Initializes descriptors through its own {@link MetadataCache}, so concurrent and
 *       repeated initializations of one table cost a single metadata request.</li>
 *   <li>Hands out {@link CdpRowSource}s for initialized tables.</li>
 * </ul>
 *
 * The cache and the fetch executor live and die with the data source; {@link #close()}
 * releases the executor when it was created here.
 */
public class CdpDataSource implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CdpDataSource.class);

    /** How {@link #getTable(String, NameMatch)} compares names. */
    public enum NameMatch {
        LOGICAL, DISPLAY, ANY
    }

    private final String datasetName;
    private final String uriPrefix;
    private final CdpTransport transport;
    private final ConnectorSettings settings;
    private final MetadataCache<TableSchema> tableMetadataCache;
    private final CdpTableResolver tableResolver;
    private final DatasetMetadataParser datasetMetadataParser = new DatasetMetadataParser();
    private final TableListParser tableListParser = new TableListParser();

    /** Null when the executor was supplied by the caller */
    private final ExecutorService ownedExecutor;

    private volatile DatasetMetadata datasetMetadata;

    public CdpDataSource(String datasetName, String uriPrefix, CdpTransport transport, ConnectorSettings settings) {
        this(datasetName, uriPrefix, transport, settings, null);
    }

    /**
     * @param executor runs metadata fetches; when null a daemon pool owned by this data source is used
     */
    public CdpDataSource(String datasetName, String uriPrefix, CdpTransport transport, ConnectorSettings settings, Executor executor) {
        this.datasetName = datasetName;
        this.uriPrefix = uriPrefix == null ? "" : uriPrefix;
        this.transport = transport;
        this.settings = settings;

        Executor fetchExecutor = executor;
        if (fetchExecutor == null) {
            this.ownedExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                    .setNameFormat("cdp-metadata-%d")
                    .setDaemon(true)
                    .build());
            fetchExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }

        this.tableMetadataCache = new MetadataCache<>(settings.getMaxCacheSize(), fetchExecutor);
        this.tableResolver = new CdpTableResolver(transport, this.uriPrefix, settings, tableMetadataCache, new TableSchemaParser());
    }

    public String getDatasetName() {
        return datasetName;
    }

    public String getUriPrefix() {
        return uriPrefix;
    }

    public ConnectorSettings getSettings() {
        return settings;
    }

    /**
     * Dataset metadata, fetched once per data source.
     */
    public DatasetMetadata getDatasetMetadata() {
        DatasetMetadata current = datasetMetadata;
        if (current == null) {
            synchronized (this) {
                current = datasetMetadata;
                if (current == null) {
                    String uri = uriPrefix + (CdpTableResolver.useV2(uriPrefix) ? "/v2" : "") + "/$metadata.json/datasets";
                    current = datasetMetadataParser.parse(send(uri, "dataset metadata"));
                    datasetMetadata = current;
                }
            }
        }
        return current;
    }

    /**
     * Lists the tables of the dataset. Every call returns fresh, uninitialized descriptors.
     */
    public List<TableDescriptor> listTables() {
        DatasetMetadata metadata = getDatasetMetadata();
        String uri = uriPrefix + (CdpTableResolver.useV2(uriPrefix) ? "/v2" : "")
                + "/datasets/" + CdpEncoding.encodeDataset(datasetName, metadata.isDoubleEncoding())
                + (CdpTableResolver.isSharePoint(uriPrefix) ? "/alltables" : "/tables");

        List<RawTable> rawTables = tableListParser.parse(send(uri, "table list"));
        logger.debug("Dataset {} lists {} tables", datasetName, rawTables.size());

        List<TableDescriptor> descriptors = new ArrayList<>(rawTables.size());
        for (RawTable rawTable : rawTables) {
            descriptors.add(new TableDescriptor(datasetName, rawTable.getName(), rawTable.getDisplayName(), rawTables));
        }
        return descriptors;
    }

    /**
     * First listed table whose name matches, in listing order.
     *
     * @throws CdpException if no table matches
     */
    public TableDescriptor getTable(String name, NameMatch match) {
        for (TableDescriptor table : listTables()) {
            boolean logical = name.equals(table.getTableName());
            boolean display = name.equals(table.getDisplayName());
            if ((match == NameMatch.LOGICAL && logical)
                    || (match == NameMatch.DISPLAY && display)
                    || (match == NameMatch.ANY && (logical || display))) {
                return table;
            }
        }
        throw CdpException.buildCdpException("Cannot find any table with the specified name: " + name);
    }

    /**
     * Resolves the schema of {@code descriptor} and attaches it.
     * <p>
     * The returned future belongs to this caller only. Cancelling it stops this caller's wait
     * and leaves the shared fetch, its cache entry and other waiters untouched. A cancellation
     * that succeeds means the schema is not attached to {@code descriptor}.
     * </p>
     *
     * @throws IllegalStateException if the descriptor is already initialized
     */
    public CompletableFuture<TableDescriptor> initTableAsync(TableDescriptor descriptor) {
        if (descriptor.isInitialized()) {
            throw new IllegalStateException("Table '" + descriptor.getTableName() + "' is already initialized");
        }

        DatasetMetadata metadata;
        try {
            metadata = getDatasetMetadata();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        InitFuture result = new InitFuture(descriptor);
        tableResolver.resolveTable(descriptor, metadata).whenComplete((schema, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            try {
                if (!result.attach(schema)) {
                    logger.debug("Initialization of {} was cancelled, schema not attached", descriptor.getTableName());
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Caller future of one initialization. Attaching the schema and completing are one step
     * under the future's lock, and so is cancellation: a cancelled caller never ends up with
     * an initialized descriptor.
     */
    private static final class InitFuture extends CompletableFuture<TableDescriptor> {

        private final TableDescriptor descriptor;

        InitFuture(TableDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        /**
         * @return false if the caller already cancelled or completed this future
         */
        synchronized boolean attach(TableSchema schema) {
            if (isDone()) {
                return false;
            }
            descriptor.initialize(schema);
            return complete(descriptor);
        }

        @Override
        public synchronized boolean cancel(boolean mayInterruptIfRunning) {
            return super.cancel(mayInterruptIfRunning);
        }

        @Override
        public synchronized boolean complete(TableDescriptor value) {
            return super.complete(value);
        }

        @Override
        public synchronized boolean completeExceptionally(Throwable ex) {
            return super.completeExceptionally(ex);
        }
    }

    /**
     * Blocking form of {@link #initTableAsync(TableDescriptor)}; rethrows the fetch failure itself.
     */
    public TableDescriptor initTable(TableDescriptor descriptor) {
        try {
            return initTableAsync(descriptor).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * @throws org.apache.calcite.adapter.cdp.tabular.exception.NotInitializedException if the table is not initialized
     */
    public CdpRowSource getRowSource(TableDescriptor descriptor) {
        return new CdpRowSource(this, descriptor, descriptor.getSchema());
    }

    /**
     * Looks up the table a column points to, from the already resolved schema only.
     */
    public Optional<ExternalTableRef> resolveExternalTable(TableDescriptor descriptor, String columnLogicalName) {
        return descriptor.getSchema().getColumn(columnLogicalName).map(ColumnDescriptor::getExternalTableRef);
    }

    /**
     * Uninitialized descriptor for the target of {@code ref}; pass it to {@link #initTable} to hydrate it.
     */
    public TableDescriptor newExternalTableDescriptor(TableDescriptor source, ExternalTableRef ref) {
        String displayName = ref.getTargetTable();
        for (RawTable table : source.getListing()) {
            if (table.getName().equals(ref.getTargetTable())) {
                displayName = table.getDisplayName();
                break;
            }
        }
        return new TableDescriptor(datasetName, ref.getTargetTable(), displayName, source.getListing());
    }

    public MetadataCache<TableSchema> getTableMetadataCache() {
        return tableMetadataCache;
    }

    /** Drops every cached table schema, without any request. */
    public void clearTableMetadataCache() {
        tableMetadataCache.clear();
    }

    String encodedDatasetName() {
        return CdpEncoding.encodeDataset(datasetName, getDatasetMetadata().isDoubleEncoding());
    }

    CdpTransport getTransport() {
        return transport;
    }

    private String send(String uri, String what) {
        CdpResponse response = transport.send(CdpRequest.get(uri));
        if (response.isEmpty()) {
            throw CdpException.buildCdpException("Get " + what + " didn't receive any response");
        }
        return response.getBody();
    }

    static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return CdpException.buildCdpException(String.valueOf(cause == null ? e.getMessage() : cause.getMessage()), cause);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}
