package org.apache.calcite.adapter.cdp.tabular.transport;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Request to the connector, addressed by a path relative to the connector base address.
 */
@Getter
@AllArgsConstructor
@ToString
public class CdpRequest {

    private final String method;
    /** Relative path including the query string */
    private final String path;
    private final Map<String, String> headers;
    /** Null for GET */
    private final String body;

    public static CdpRequest get(String path) {
        return new CdpRequest("GET", path, Map.of(), null);
    }

    public static CdpRequest post(String path, String jsonBody) {
        return new CdpRequest("POST", path, Map.of("Content-Type", "application/json"), jsonBody);
    }
}
