package org.apache.calcite.adapter.cdp.tabular.typemapper;

/**
 * integer + int64 → "long", integer + int16 → "short", any other integer → "int".
 */
public class IntegerTypeMapper implements CdpTypeMapper {

    @Override
    public boolean canHandle(String type, String format) {
        return "integer".equals(type);
    }

    @Override
    public String mapType(String type, String format) {
        if ("int64".equals(format)) {
            return "long";
        }
        if ("int16".equals(format)) {
            return "short";
        }
        return "int";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "IntegerTypeMapper";
    }
}
