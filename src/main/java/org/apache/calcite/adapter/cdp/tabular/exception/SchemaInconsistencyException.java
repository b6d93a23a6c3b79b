package org.apache.calcite.adapter.cdp.tabular.exception;

/**
 * Malformed backend metadata that can be recovered from locally.
 * <p>
 * Parsers build and log it, then fall back to the reduced metadata; it only reaches
 * callers through the log.
 * </p>
 */
public class SchemaInconsistencyException extends CdpException {

    SchemaInconsistencyException(String message) {
        super(message);
    }

    public static SchemaInconsistencyException buildEnumMismatch(String tableName, String column, int values, int displayNames) {
        return new SchemaInconsistencyException(String.format(
                "Column '%s' of table '%s' declares %d enum values but %d display names, enum metadata ignored",
                column, tableName, values, displayNames));
    }
}
