package org.apache.calcite.adapter.cdp.tabular.typemapper;

/**
 * Maps connector string columns to string and date/time types.
 *
 * <p><b>Supported mappings:</b></p>
 * <ul>
 *   <li>string + date-time, date-no-tz → "timestamp"</li>
 *   <li>string + date → "date"</li>
 *   <li>string + time → "time"</li>
 *   <li>string + anything else (uuid, uri, byte, ...) → "string"</li>
 * </ul>
 */
public class StringTypeMapper implements CdpTypeMapper {

    @Override
    public boolean canHandle(String type, String format) {
        return "string".equals(type);
    }

    @Override
    public String mapType(String type, String format) {
        if (format != null) {
            switch (format) {
                case "date-time":
                case "date-no-tz":
                    return "timestamp";
                case "date":
                    return "date";
                case "time":
                    return "time";
                default:
                    break;
            }
        }
        return "string";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "StringTypeMapper";
    }
}
