package org.apache.calcite.adapter.cdp.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * {@code x-ms-dynamic-values} block of a dataset parameter: where the connector can
 * enumerate candidate values for the parameter (for example the databases of a server).
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class DynamicValues {

    /** Relative operation path, may contain {@code {parameter}} placeholders */
    private final String path;
    /** Property of the response holding the value array */
    private final String valueCollection;
    /** Property of each item used as the parameter value */
    private final String valuePath;
    /** Property of each item used as the human readable title */
    private final String valueTitle;
}
