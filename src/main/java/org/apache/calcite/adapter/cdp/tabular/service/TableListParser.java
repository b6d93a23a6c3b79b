package org.apache.calcite.adapter.cdp.tabular.service;

import com.jayway.jsonpath.DocumentContext;
import org.apache.calcite.adapter.cdp.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses table listings: {@code {"value": [{"Name": "...", "DisplayName": "..."}]}}.
 * A missing or empty {@code value} array is an empty listing. Entries without a
 * {@code Name} cannot be addressed and are skipped.
 */
public class TableListParser {

    private static final Logger logger = LoggerFactory.getLogger(TableListParser.class);

    public List<RawTable> parse(String json) {
        DocumentContext document = JsonDocuments.parse(json, "table list");
        List<RawTable> tables = new ArrayList<>();
        for (Object item : JsonDocuments.list(JsonDocuments.read(document, "$.value"))) {
            Map<String, Object> table = JsonDocuments.map(item);
            String name = JsonDocuments.string(table, "Name");
            String displayName = JsonDocuments.string(table, "DisplayName");
            if (name == null || name.isEmpty()) {
                logger.warn("Ignoring listed table without a name (display name '{}')", displayName);
                continue;
            }
            tables.add(new RawTable(name, displayName != null ? displayName : name));
        }
        return tables;
    }
}
