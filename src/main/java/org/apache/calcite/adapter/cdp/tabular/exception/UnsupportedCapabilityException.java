package org.apache.calcite.adapter.cdp.tabular.exception;

import lombok.Getter;

/**
 * A query asked the backend for a delegation feature it never declared.
 * Raised before any part of the query string is built.
 */
@Getter
public class UnsupportedCapabilityException extends IllegalStateException {

    private final long requested;
    private final long supported;

    UnsupportedCapabilityException(String message, long requested, long supported) {
        super(message);
        this.requested = requested;
        this.supported = supported;
    }

    public static UnsupportedCapabilityException buildUnsupportedCapabilityException(long requested, long supported) {
        return new UnsupportedCapabilityException(String.format(
                "Unsupported capability requested: features 0x%x, supported 0x%x, offending bits 0x%x",
                requested, supported, requested & ~supported), requested, supported);
    }
}
