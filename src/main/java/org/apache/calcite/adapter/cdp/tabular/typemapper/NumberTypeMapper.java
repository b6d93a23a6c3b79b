package org.apache.calcite.adapter.cdp.tabular.typemapper;

/**
 * number + float → "float"; double, decimal and unformatted numbers → "double".
 */
public class NumberTypeMapper implements CdpTypeMapper {

    @Override
    public boolean canHandle(String type, String format) {
        return "number".equals(type);
    }

    @Override
    public String mapType(String type, String format) {
        return "float".equals(format) ? "float" : "double";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "NumberTypeMapper";
    }
}
