package org.apache.calcite.adapter.cdp.tabular.typemapper;

/**
 * Fallback: arrays, objects and unknown types are exposed as strings.
 */
public class DefaultTypeMapper implements CdpTypeMapper {

    @Override
    public boolean canHandle(String type, String format) {
        return true;
    }

    @Override
    public String mapType(String type, String format) {
        return "string";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public String getName() {
        return "DefaultTypeMapper";
    }
}
