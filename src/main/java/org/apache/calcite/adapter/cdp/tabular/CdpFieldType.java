package org.apache.calcite.adapter.cdp.tabular;

import org.apache.calcite.adapter.java.JavaTypeFactory;
import org.apache.calcite.linq4j.tree.Primitive;
import org.apache.calcite.rel.type.RelDataType;

import java.util.HashMap;
import java.util.Map;

/**
 * Column types of a resolved table, with their Calcite SQL counterparts.
 * <p>
 * Names match what the type mapper chain produces from the connector's
 * {@code type}/{@code format} pairs.
 * </p>
 */
public enum CdpFieldType {

    STRING(String.class, "string"),
    BOOLEAN(Primitive.BOOLEAN),
    SHORT(Primitive.SHORT),
    INT(Primitive.INT),
    LONG(Primitive.LONG),
    FLOAT(Primitive.FLOAT),
    DOUBLE(Primitive.DOUBLE),
    DATE(java.sql.Date.class, "date"),
    TIME(java.sql.Time.class, "time"),
    TIMESTAMP(java.sql.Timestamp.class, "timestamp");

    private final Class<?> clazz;
    private final String simpleName;

    private static final Map<String, CdpFieldType> MAP = new HashMap<>();

    static {
        for (CdpFieldType value : values()) {
            MAP.put(value.simpleName, value);
        }
    }

    CdpFieldType(Primitive primitive) {
        this(primitive.boxClass, primitive.primitiveName);
    }

    CdpFieldType(Class<?> clazz, String simpleName) {
        this.clazz = clazz;
        this.simpleName = simpleName;
    }

    public String getSimpleName() {
        return simpleName;
    }

    /**
     * @return nullable SQL type for this column type
     */
    public RelDataType toType(JavaTypeFactory typeFactory) {
        RelDataType javaType = typeFactory.createJavaType(clazz);
        RelDataType sqlType = typeFactory.createSqlType(javaType.getSqlTypeName());
        return typeFactory.createTypeWithNullability(sqlType, true);
    }

    /**
     * @param typeString mapper output, e.g. "int", "timestamp"
     * @return the matching type, {@link #STRING} when unknown
     */
    public static CdpFieldType of(String typeString) {
        return MAP.getOrDefault(typeString, STRING);
    }
}
