package org.apache.calcite.adapter.cdp.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One parameter needed to address a dataset (e.g. {@code server}, {@code database}).
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class MetadataParameter {

    private final String name;
    private final String type;
    private final String description;
    private final boolean required;
    /** "single" or "double" */
    private final String urlEncoding;
    /** {@code x-ms-summary} */
    private final String summary;
    /** {@code x-ms-dynamic-values}, null when the parameter has no value source */
    private final DynamicValues dynamicValues;
}
