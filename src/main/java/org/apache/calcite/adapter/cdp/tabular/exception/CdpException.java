package org.apache.calcite.adapter.cdp.tabular.exception;

/**
 * Root of the adapter's unchecked exceptions.
 * <p>
 * Raised for failures while resolving dataset and table metadata or reading rows:
 * empty responses, unknown tables, unparseable payloads. Transport failures use the
 * {@link TransportException} subclass so callers can read the backend status code.
 * </p>
 */
public class CdpException extends RuntimeException {

    protected CdpException(String message) {
        super(message);
    }

    protected CdpException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Factory method for a failure described by a message.
     *
     * @param message Human-readable error message.
     * @return A new CdpException.
     */
    public static CdpException buildCdpException(String message) {
        return new CdpException(message);
    }

    /**
     * Factory method wrapping a lower level failure.
     *
     * @param message Human-readable error message.
     * @param cause   The original throwable.
     * @return A new CdpException.
     */
    public static CdpException buildCdpException(String message, Throwable cause) {
        return new CdpException(message, cause);
    }
}
