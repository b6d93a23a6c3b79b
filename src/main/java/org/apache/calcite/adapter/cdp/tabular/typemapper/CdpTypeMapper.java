package org.apache.calcite.adapter.cdp.tabular.typemapper;

/**
 * Maps a connector column {@code type}/{@code format} pair to a
 * {@link org.apache.calcite.adapter.cdp.tabular.CdpFieldType} name.
 *
 * <p><b>Example mappings:</b></p>
 * <ul>
 *   <li>integer + int64 → "long"</li>
 *   <li>string + date-time → "timestamp"</li>
 *   <li>boolean → "boolean"</li>
 * </ul>
 */
public interface CdpTypeMapper {

    boolean canHandle(String type, String format);

    String mapType(String type, String format);

    /**
     * Lower values are checked first (specific mappers before generic).
     */
    default int getPriority() {
        return 50;
    }

    String getName();
}
