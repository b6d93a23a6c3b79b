package org.apache.calcite.adapter.cdp.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per data source settings: where the connector lives and how metadata and rows are fetched.
 */
@Data
public class ConnectorSettings {

    /** Comma separated base addresses, tried in order */
    private String addresses;
    /** Seconds */
    private int connectionTimeout = 30;
    /** Seconds */
    private int responseTimeout = 60;
    /** Upper bound of rows read from one table scan */
    private int maxRows = 1000;
    /** Upper bound of cached table metadata entries */
    private int maxCacheSize = 1000;
    /** Query the SQL foreign key catalog while hydrating SQL tables */
    private boolean fetchRelationships;
    private boolean extractSensitivityLabel;
    private String purviewAccountName;
    /** Static headers added to every request (authorization, session id) */
    private Map<String, String> headers = new LinkedHashMap<>();
}
