package org.apache.calcite.adapter.cdp.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One entry of a table listing: wire name plus display name. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class RawTable {

    private final String name;
    private final String displayName;
}
