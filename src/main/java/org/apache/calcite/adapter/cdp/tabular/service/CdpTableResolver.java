package org.apache.calcite.adapter.cdp.tabular.service;

import org.apache.calcite.adapter.cdp.model.ConnectorSettings;
import org.apache.calcite.adapter.cdp.model.DatasetMetadata;
import org.apache.calcite.adapter.cdp.model.RawTable;
import org.apache.calcite.adapter.cdp.model.Relationship;
import org.apache.calcite.adapter.cdp.model.TableDescriptor;
import org.apache.calcite.adapter.cdp.model.TableSchema;
import org.apache.calcite.adapter.cdp.tabular.cache.MetadataCache;
import org.apache.calcite.adapter.cdp.tabular.exception.CdpException;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpRequest;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpResponse;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Hydrates table schemas through the transport, one cached fetch per metadata URI.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Translate a display name into the logical name of the first listed table carrying it</li>
 *   <li>Build the table metadata URI, which is also the cache key</li>
 *   <li>Fetch the metadata document and, for SQL connectors when enabled, the foreign key
 *       catalog, inside one cached operation</li>
 * </ul>
 *
 * <p>Relationship targets are never resolved here. Following a foreign key needs a separate,
 * caller driven initialization of the target table.</p>
 */
public class CdpTableResolver {

    private static final Logger logger = LoggerFactory.getLogger(CdpTableResolver.class);

    public static final String API_VERSION = "api-version=2015-09-01";

    private static final String FOREIGN_KEY_QUERY =
            "SELECT fk.name AS FK_Name, '[' + sp.name + '].[' + tp.name + ']' AS Parent_Table, cp.name AS Parent_Column,"
            + " '[' + sr.name + '].[' + tr.name + ']' AS Referenced_Table, cr.name AS Referenced_Column"
            + " FROM sys.foreign_keys fk"
            + " INNER JOIN sys.tables tp ON fk.parent_object_id = tp.object_id"
            + " INNER JOIN sys.tables tr ON fk.referenced_object_id = tr.object_id"
            + " INNER JOIN sys.schemas sp ON tp.schema_id = sp.schema_id"
            + " INNER JOIN sys.schemas sr ON tr.schema_id = sr.schema_id"
            + " INNER JOIN sys.foreign_key_columns fkc ON fkc.constraint_object_id = fk.object_id"
            + " INNER JOIN sys.columns cp ON fkc.parent_column_id = cp.column_id AND fkc.parent_object_id = cp.object_id"
            + " INNER JOIN sys.columns cr ON fkc.referenced_column_id = cr.column_id AND fkc.referenced_object_id = cr.object_id"
            + " WHERE '[' + sp.name + '].[' + tp.name + ']' = '%s'";

    private final CdpTransport transport;
    private final String uriPrefix;
    private final ConnectorSettings settings;
    private final MetadataCache<TableSchema> cache;
    private final TableSchemaParser parser;

    public CdpTableResolver(CdpTransport transport, String uriPrefix, ConnectorSettings settings,
                            MetadataCache<TableSchema> cache, TableSchemaParser parser) {
        this.transport = transport;
        this.uriPrefix = uriPrefix == null ? "" : uriPrefix;
        this.settings = settings;
        this.cache = cache;
        this.parser = parser;
    }

    /**
     * Returns the shared stage resolving the schema of {@code descriptor}.
     * Nothing is attached to the descriptor here.
     */
    public CompletionStage<TableSchema> resolveTable(TableDescriptor descriptor, DatasetMetadata datasetMetadata) {
        String logicalName = toLogicalName(descriptor.getListing(), descriptor.getTableName());
        String dataset = CdpEncoding.encodeDataset(descriptor.getDatasetName(), datasetMetadata.isDoubleEncoding());
        String uri = buildTableMetadataUri(dataset, logicalName);

        return cache.getOrFetch(uri, () -> fetchTableSchema(uri, dataset, logicalName));
    }

    /**
     * Logical name of the first listed table whose display name is {@code name};
     * {@code name} itself when no display name matches.
     */
    public static String toLogicalName(List<RawTable> listing, String name) {
        for (RawTable table : listing) {
            if (name.equals(table.getDisplayName())) {
                return table.getName();
            }
        }
        return name;
    }

    public String buildTableMetadataUri(String encodedDataset, String logicalName) {
        StringBuilder uri = new StringBuilder(uriPrefix)
                .append(useV2(uriPrefix) ? "/v2" : "")
                .append("/$metadata.json/datasets/").append(encodedDataset)
                .append("/tables/").append(CdpEncoding.doubleEncode(logicalName))
                .append('?').append(API_VERSION);

        if (settings.isExtractSensitivityLabel()) {
            uri.append("&extractSensitivityLabel=True");
            if (settings.getPurviewAccountName() != null && !settings.getPurviewAccountName().isEmpty()) {
                uri.append("&purviewAccountName=").append(settings.getPurviewAccountName());
            }
        }
        return uri.toString();
    }

    private TableSchema fetchTableSchema(String uri, String encodedDataset, String logicalName) {
        logger.debug("Fetching table metadata {}", uri);
        CdpResponse response = transport.send(CdpRequest.get(uri));
        if (response.isEmpty()) {
            throw CdpException.buildCdpException("resolveTable didn't receive any response for " + logicalName);
        }

        List<Relationship> sqlRelationships = List.of();
        if (settings.isFetchRelationships() && isSql(uriPrefix)) {
            sqlRelationships = fetchSqlRelationships(encodedDataset, logicalName);
        }

        TableSchema schema = parser.parse(logicalName, response.getBody(), sqlRelationships);
        logger.debug("Resolved table {} with {} columns and {} related tables",
                logicalName, schema.getColumns().size(), schema.getRelationships().size());
        return schema;
    }

    private List<Relationship> fetchSqlRelationships(String encodedDataset, String logicalName) {
        String path = uriPrefix + "/v2/datasets/" + encodedDataset + "/query/sql";
        String query = String.format(FOREIGN_KEY_QUERY, logicalName.replace("'", "''"));
        String body = "{\"query\":\"" + query.replace("\\", "\\\\").replace("\"", "\\\"") + "\"}";
        CdpResponse response = transport.send(CdpRequest.post(path, body));
        return parser.parseSqlRelationships(response.getBody());
    }

    public static boolean isSql(String uriPrefix) {
        return uriPrefix.contains("/sql/");
    }

    public static boolean useV2(String uriPrefix) {
        return uriPrefix.contains("/sql/") || uriPrefix.contains("/zendesk/");
    }

    public static boolean isSharePoint(String uriPrefix) {
        return uriPrefix.contains("/sharepointonline/");
    }
}
