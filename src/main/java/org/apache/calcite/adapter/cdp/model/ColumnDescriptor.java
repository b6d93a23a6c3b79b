package org.apache.calcite.adapter.cdp.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.calcite.adapter.cdp.tabular.CdpFieldType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolved column of a {@link TableSchema}.
 * <p>
 * Enum columns keep the raw value list and, when the backend provides one of the same
 * length, the positionally aligned display list. {@code enumDisplayNames} is empty when
 * the backend sent no display names.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class ColumnDescriptor {

    /** Wire name, unique within the schema */
    private final String logicalName;
    /** Human name, may collide with other columns */
    private final String displayName;
    private final CdpFieldType type;
    private final boolean required;
    private final List<String> enumValues;
    private final List<String> enumDisplayNames;
    /** Null when the column references no other table */
    private final ExternalTableRef externalTableRef;

    public ColumnDescriptor(String logicalName, String displayName, CdpFieldType type, boolean required,
                            List<String> enumValues, List<String> enumDisplayNames, ExternalTableRef externalTableRef) {
        this.logicalName = logicalName;
        this.displayName = displayName;
        this.type = type;
        this.required = required;
        // entries may be null
        this.enumValues = Collections.unmodifiableList(new ArrayList<>(enumValues));
        this.enumDisplayNames = Collections.unmodifiableList(new ArrayList<>(enumDisplayNames));
        this.externalTableRef = externalTableRef;
    }

    public boolean isEnum() {
        return !enumValues.isEmpty();
    }

    public boolean hasExternalTable() {
        return externalTableRef != null;
    }

    /**
     * Display name of an enum value, or the value itself when no display list is known.
     */
    public String enumDisplayName(String value) {
        int index = enumValues.indexOf(value);
        if (index < 0 || enumDisplayNames.isEmpty()) {
            return value;
        }
        return enumDisplayNames.get(index);
    }
}
