package org.apache.calcite.adapter.cdp.tabular.typemapper;

public class BooleanTypeMapper implements CdpTypeMapper {

    @Override
    public boolean canHandle(String type, String format) {
        return "boolean".equals(type);
    }

    @Override
    public String mapType(String type, String format) {
        return "boolean";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "BooleanTypeMapper";
    }
}
