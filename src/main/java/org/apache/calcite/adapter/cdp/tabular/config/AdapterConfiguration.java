package org.apache.calcite.adapter.cdp.tabular.config;

/**
 * Source of fallback settings for schemas whose model operands leave a value out.
 *
 * <p><b>Configuration keys</b> are {@code calcite.cdp.<operand>}, for example:</p>
 * <ul>
 *   <li>calcite.cdp.address - connector base address(es), comma separated</li>
 *   <li>calcite.cdp.maxRows - row limit of a table scan</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * AdapterConfiguration config = new SystemPropertyConfiguration();
 * String address = config.get(AdapterConfiguration.PREFIX + "address");
 * }</pre>
 */
public interface AdapterConfiguration {

    String PREFIX = "calcite.cdp.";

    /**
     * @return value or null if not found
     */
    String get(String key);

    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    default boolean has(String key) {
        return get(key) != null;
    }
}
