package org.apache.calcite.adapter.cdp.tabular;

import org.apache.calcite.adapter.cdp.model.ConnectorSettings;
import org.apache.calcite.adapter.cdp.model.TableDescriptor;
import org.apache.calcite.adapter.cdp.tabular.config.AdapterConfiguration;
import org.apache.calcite.adapter.cdp.tabular.config.SystemPropertyConfiguration;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpTransport;
import org.apache.calcite.adapter.cdp.tabular.transport.HttpClientTransport;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code CdpSchema} exposes the tables of one CDP dataset to Calcite.
 *
 * <p>Operands (model JSON or the map handed to the constructor), each falling back to the
 * {@code calcite.cdp.<operand>} configuration key:</p>
 * <ul>
 *   <li>address - connector base address(es), comma separated</li>
 *   <li>uriPrefix - connector path, e.g. {@code /apim/sql/{connectionId}}</li>
 *   <li>dataset - dataset name</li>
 *   <li>maxRows, connectionTimeout, responseTimeout</li>
 *   <li>fetchRelationships, extractSensitivityLabel, purviewAccountName</li>
 * </ul>
 *
 * <p>A {@link CdpTransport} under the "transport" key replaces the HTTP transport, and an
 * {@link AdapterConfiguration} under "configuration" replaces system properties.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>
 * {
 *   "name": "sales",
 *   "type": "custom",
 *   "factory": "org.apache.calcite.adapter.cdp.tabular.CdpSchemaFactory",
 *   "operand": {"address": "https://connector.example", "uriPrefix": "/apim/sql/c1", "dataset": "default,default"}
 * }
 *
 * SQL: SELECT * FROM sales."Orders"
 * </pre>
 *
 * Tables are named by display name; when several tables share one, the first listed wins.
 */
public class CdpSchema extends AbstractSchema {

    private static final Logger logger = LoggerFactory.getLogger(CdpSchema.class);

    private final CdpDataSource dataSource;
    /** Lazily initialized */
    private Map<String, Table> tableMap;

    public CdpSchema(Map<String, Object> map) {
        Map<String, Object> operand = map != null ? map : Map.of();

        Object configObject = operand.get("configuration");
        AdapterConfiguration configuration = configObject instanceof AdapterConfiguration
                ? (AdapterConfiguration) configObject
                : new SystemPropertyConfiguration();

        ConnectorSettings settings = new ConnectorSettings();
        settings.setAddresses(value(operand, configuration, "address", null));
        settings.setMaxRows(Integer.parseInt(value(operand, configuration, "maxRows", String.valueOf(settings.getMaxRows()))));
        settings.setConnectionTimeout(Integer.parseInt(value(operand, configuration, "connectionTimeout", String.valueOf(settings.getConnectionTimeout()))));
        settings.setResponseTimeout(Integer.parseInt(value(operand, configuration, "responseTimeout", String.valueOf(settings.getResponseTimeout()))));
        settings.setFetchRelationships(Boolean.parseBoolean(value(operand, configuration, "fetchRelationships", "false")));
        settings.setExtractSensitivityLabel(Boolean.parseBoolean(value(operand, configuration, "extractSensitivityLabel", "false")));
        settings.setPurviewAccountName(value(operand, configuration, "purviewAccountName", null));

        String dataset = value(operand, configuration, "dataset", null);
        if (dataset == null) {
            throw new IllegalArgumentException("No dataset configured, set the 'dataset' operand or "
                    + AdapterConfiguration.PREFIX + "dataset");
        }

        Object transportObject = operand.get("transport");
        CdpTransport transport = transportObject instanceof CdpTransport
                ? (CdpTransport) transportObject
                : new HttpClientTransport(settings);

        this.dataSource = new CdpDataSource(dataset, value(operand, configuration, "uriPrefix", ""), transport, settings);
    }

    public CdpSchema(CdpDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public CdpDataSource getDataSource() {
        return dataSource;
    }

    @Override
    protected synchronized Map<String, Table> getTableMap() {
        if (tableMap != null) {
            return tableMap;
        }
        Map<String, Table> tables = new LinkedHashMap<>();
        for (TableDescriptor descriptor : dataSource.listTables()) {
            if (tables.containsKey(descriptor.getDisplayName())) {
                logger.warn("Table '{}' ({}) hides a previously listed table with the same display name",
                        descriptor.getDisplayName(), descriptor.getTableName());
                continue;
            }
            tables.put(descriptor.getDisplayName(), new CdpTable(dataSource, descriptor));
        }
        logger.info("Created CDP schema for dataset '{}' with {} tables", dataSource.getDatasetName(), tables.size());
        tableMap = tables;
        return tableMap;
    }

    private static String value(Map<String, Object> operand, AdapterConfiguration configuration, String key, String defaultValue) {
        Object value = operand.get(key);
        if (value != null) {
            return value.toString();
        }
        return configuration.get(AdapterConfiguration.PREFIX + key, defaultValue);
    }
}
