package org.apache.calcite.adapter.cdp.tabular.typemapper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the type mapper for a column, first match in priority order.
 *
 * <p><b>Priority guidelines:</b></p>
 * <ul>
 *   <li>0-19: Specific types (integer, number, boolean, string)</li>
 *   <li>100+: Fallback</li>
 * </ul>
 */
public class CdpTypeMapperChain {

    private final List<CdpTypeMapper> mappers = new ArrayList<>();

    /** Chain with every built-in mapper registered. */
    public static CdpTypeMapperChain defaultChain() {
        return new CdpTypeMapperChain()
                .addMapper(new IntegerTypeMapper())
                .addMapper(new NumberTypeMapper())
                .addMapper(new BooleanTypeMapper())
                .addMapper(new StringTypeMapper())
                .addMapper(new DefaultTypeMapper());
    }

    public CdpTypeMapperChain addMapper(CdpTypeMapper mapper) {
        mappers.add(mapper);
        mappers.sort(Comparator.comparingInt(CdpTypeMapper::getPriority));
        return this;
    }

    /**
     * @return type name, "string" when no mapper handles the pair
     */
    public String mapType(String type, String format) {
        for (CdpTypeMapper mapper : mappers) {
            if (mapper.canHandle(type, format)) {
                return mapper.mapType(type, format);
            }
        }
        return "string";
    }
}
