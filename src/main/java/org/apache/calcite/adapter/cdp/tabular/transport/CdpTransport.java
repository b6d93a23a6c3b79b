package org.apache.calcite.adapter.cdp.tabular.transport;

import org.apache.calcite.adapter.cdp.tabular.exception.TransportException;

/**
 * Sends requests to a connector backend.
 *
 * <p>Implementations must not cache: two calls with the same path are two round trips.
 * Deduplication is the job of the metadata cache above this layer.</p>
 *
 * <p>Calls block the calling thread. Asynchrony and cancellation of waiters are provided
 * by the callers, which run fetches on their own executor.</p>
 */
public interface CdpTransport {

    /**
     * Sends a request and returns the successful response.
     *
     * @param request request to send
     * @return response with a 2xx status
     * @throws TransportException on a non-success status or when no response was received
     */
    CdpResponse send(CdpRequest request);
}
