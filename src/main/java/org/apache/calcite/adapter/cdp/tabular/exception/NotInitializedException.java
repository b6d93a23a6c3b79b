package org.apache.calcite.adapter.cdp.tabular.exception;

/**
 * A table was used before its schema was resolved.
 */
public class NotInitializedException extends CdpException {

    NotInitializedException(String message) {
        super(message);
    }

    public static NotInitializedException buildNotInitializedException(String tableName) {
        return new NotInitializedException("Table '" + tableName + "' is not initialized");
    }
}
