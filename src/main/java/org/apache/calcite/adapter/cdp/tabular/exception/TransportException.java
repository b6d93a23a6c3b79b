package org.apache.calcite.adapter.cdp.tabular.exception;

import lombok.Getter;

/**
 * Network or backend failure while talking to the connector.
 * <p>
 * Carries the HTTP status code when the backend answered, or {@code -1} when no
 * response was received at all (connection refused, timeout, I/O error).
 * </p>
 */
@Getter
public class TransportException extends CdpException {

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String uri;

    TransportException(String message, String uri, int statusCode, Throwable cause) {
        super(message, cause);
        this.uri = uri;
        this.statusCode = statusCode;
    }

    /**
     * Backend answered with a non-success status.
     */
    public static TransportException buildStatusException(String method, String uri, int statusCode, String body) {
        String message = method + " " + uri + " failed, status code (" + statusCode + ")";
        if (body != null && !body.isBlank()) {
            message += ": " + body;
        }
        return new TransportException(message, uri, statusCode, null);
    }

    /**
     * Request could not be completed.
     */
    public static TransportException buildIoException(String method, String uri, Throwable cause) {
        return new TransportException(method + " " + uri + " failed: " + cause.getMessage(), uri, NO_STATUS, cause);
    }
}
