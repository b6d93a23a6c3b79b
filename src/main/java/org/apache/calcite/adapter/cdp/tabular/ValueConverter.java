package org.apache.calcite.adapter.cdp.tabular;

import org.apache.calcite.adapter.cdp.tabular.exception.CdpException;
import org.apache.calcite.avatica.util.DateTimeUtils;
import org.apache.commons.lang3.time.FastDateFormat;

import java.text.ParseException;
import java.util.TimeZone;

/**
 * Converts JSON record values to the internal representation Calcite expects for a column type.
 *
 * <p>JSON numbers and booleans arrive already typed and are narrowed directly; everything
 * else is parsed from its string form. Dates become days since epoch, times milliseconds
 * of day, timestamps milliseconds since epoch (all GMT).</p>
 */
public class ValueConverter {

    private static final TimeZone GMT = TimeZone.getTimeZone("GMT");
    private static final FastDateFormat DATE_FORMAT = FastDateFormat.getInstance("yyyy-MM-dd", GMT);
    private static final FastDateFormat TIME_FORMAT = FastDateFormat.getInstance("HH:mm:ss", GMT);
    private static final FastDateFormat TIMESTAMP_FORMAT = FastDateFormat.getInstance("yyyy-MM-dd'T'HH:mm:ss", GMT);

    private ValueConverter() {
    }

    /**
     * @param object    value from a record, may be null
     * @param fieldType target column type
     * @return converted value, null for null or, on non-string columns, empty input
     * @throws CdpException if the value cannot be parsed as the column type
     */
    public static Object convert(Object object, CdpFieldType fieldType) {
        if (object == null) {
            return null;
        }
        if (fieldType != CdpFieldType.STRING && object.toString().isEmpty()) {
            return null;
        }

        try {
            switch (fieldType) {
                case BOOLEAN:
                    if (object instanceof Boolean) {
                        return object;
                    }
                    return Boolean.parseBoolean(object.toString());

                case SHORT:
                    return object instanceof Number ? ((Number) object).shortValue() : Short.parseShort(object.toString());

                case INT:
                    return object instanceof Number ? ((Number) object).intValue() : Integer.parseInt(object.toString());

                case LONG:
                    return object instanceof Number ? ((Number) object).longValue() : Long.parseLong(object.toString());

                case FLOAT:
                    return object instanceof Number ? ((Number) object).floatValue() : Float.parseFloat(object.toString());

                case DOUBLE:
                    return object instanceof Number ? ((Number) object).doubleValue() : Double.parseDouble(object.toString());

                case DATE:
                    return (int) (DATE_FORMAT.parse(object.toString()).getTime() / DateTimeUtils.MILLIS_PER_DAY);

                case TIME:
                    return (int) TIME_FORMAT.parse(object.toString()).getTime();

                case TIMESTAMP:
                    return TIMESTAMP_FORMAT.parse(object.toString()).getTime();

                case STRING:
                default:
                    return object.toString();
            }
        } catch (ParseException | NumberFormatException e) {
            throw CdpException.buildCdpException("Failed to parse value: " + object + " as " + fieldType, e);
        }
    }
}
