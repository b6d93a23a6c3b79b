package org.apache.calcite.adapter.cdp.tabular.service;

import com.jayway.jsonpath.DocumentContext;
import org.apache.calcite.adapter.cdp.model.DatasetKind;
import org.apache.calcite.adapter.cdp.model.DatasetMetadata;
import org.apache.calcite.adapter.cdp.model.DynamicValues;
import org.apache.calcite.adapter.cdp.model.MetadataParameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.bool;
import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.map;
import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.string;

/**
 * Parses {@code $metadata.json/datasets} responses.
 *
 * <p><b>Response shape:</b></p>
 * <pre>
 * {
 *   "tabular": {"source": "mru", "displayName": "dataset", "urlEncoding": "single",
 *               "tableDisplayName": "Table", "tablePluralName": "Tables"},
 *   "blob": null,
 *   "datasetFormat": "{server},{database}",
 *   "parameters": [{"name": "server", "type": "string", "urlEncoding": "double",
 *                   "description": "...", "required": true, "x-ms-summary": "...",
 *                   "x-ms-dynamic-values": {"path": "...", "value-collection": "value",
 *                                           "value-path": "Name", "value-title": "DisplayName"}}]
 * }
 * </pre>
 * The dataset kind is decided here: a {@code tabular} block wins over a {@code blob} block.
 */
public class DatasetMetadataParser {

    public DatasetMetadata parse(String json) {
        DocumentContext document = JsonDocuments.parse(json, "dataset metadata");

        return new DatasetMetadata(
                parseKind(map(JsonDocuments.read(document, "$.tabular")), map(JsonDocuments.read(document, "$.blob"))),
                JsonDocuments.read(document, "$.datasetFormat"),
                parseParameters(JsonDocuments.list(JsonDocuments.read(document, "$.parameters"))));
    }

    private DatasetKind parseKind(Map<String, Object> tabular, Map<String, Object> blob) {
        if (!tabular.isEmpty()) {
            return new DatasetKind.Tabular(
                    string(tabular, "source"),
                    string(tabular, "displayName"),
                    string(tabular, "urlEncoding"),
                    string(tabular, "tableDisplayName"),
                    string(tabular, "tablePluralName"));
        }
        if (!blob.isEmpty()) {
            return new DatasetKind.Blob(string(blob, "source"), string(blob, "displayName"), string(blob, "urlEncoding"));
        }
        return DatasetKind.Unknown.INSTANCE;
    }

    private List<MetadataParameter> parseParameters(List<Object> items) {
        List<MetadataParameter> parameters = new ArrayList<>(items.size());
        for (Object item : items) {
            Map<String, Object> parameter = map(item);
            parameters.add(new MetadataParameter(
                    string(parameter, "name"),
                    string(parameter, "type"),
                    string(parameter, "description"),
                    bool(parameter, "required", false),
                    string(parameter, "urlEncoding"),
                    string(parameter, "x-ms-summary"),
                    parseDynamicValues(map(parameter.get("x-ms-dynamic-values")))));
        }
        return parameters;
    }

    private DynamicValues parseDynamicValues(Map<String, Object> dynamicValues) {
        if (dynamicValues.isEmpty()) {
            return null;
        }
        return new DynamicValues(
                string(dynamicValues, "path"),
                string(dynamicValues, "value-collection"),
                string(dynamicValues, "value-path"),
                string(dynamicValues, "value-title"));
    }
}
