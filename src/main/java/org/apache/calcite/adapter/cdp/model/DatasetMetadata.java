package org.apache.calcite.adapter.cdp.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Dataset-level description returned by {@code $metadata.json/datasets}.
 */
@Getter
@AllArgsConstructor
public class DatasetMetadata {

    private final DatasetKind kind;
    /** Composite dataset name pattern, e.g. "{server},{database}" */
    private final String datasetFormat;
    private final List<MetadataParameter> parameters;

    /**
     * Dataset names are double encoded only for tabular datasets declaring it.
     */
    public boolean isDoubleEncoding() {
        return kind instanceof DatasetKind.Tabular && kind.isDoubleEncoding();
    }
}
