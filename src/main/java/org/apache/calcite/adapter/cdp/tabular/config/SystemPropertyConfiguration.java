package org.apache.calcite.adapter.cdp.tabular.config;

/**
 * Reads settings from Java system properties.
 */
public class SystemPropertyConfiguration implements AdapterConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
