package org.apache.calcite.adapter.cdp.tabular.transport;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CdpResponse {

    private final int statusCode;
    /** Never null, empty when the backend sent no entity */
    private final String body;

    public boolean isEmpty() {
        return body.isBlank();
    }
}
