package org.apache.calcite.adapter.cdp.tabular.service;

import com.jayway.jsonpath.DocumentContext;
import org.apache.calcite.adapter.cdp.model.ColumnDescriptor;
import org.apache.calcite.adapter.cdp.model.ExternalTableRef;
import org.apache.calcite.adapter.cdp.model.Relationship;
import org.apache.calcite.adapter.cdp.model.TableCapabilities;
import org.apache.calcite.adapter.cdp.model.TableSchema;
import org.apache.calcite.adapter.cdp.tabular.CdpFieldType;
import org.apache.calcite.adapter.cdp.tabular.exception.SchemaInconsistencyException;
import org.apache.calcite.adapter.cdp.tabular.typemapper.CdpTypeMapperChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.bool;
import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.list;
import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.map;
import static org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments.string;

/**
 * Builds a {@link TableSchema} from a table metadata document and, optionally, the rows
 * of the SQL foreign key catalog.
 *
 * <p><b>Table metadata shape:</b></p>
 * <pre>
 * {
 *   "name": "Orders", "title": "Orders",
 *   "x-ms-capabilities": {"sortRestrictions": {"sortable": true},
 *                         "filterRestrictions": {"filterable": true, "nonFilterableProperties": ["Notes"]},
 *                         "selectRestrictions": {"selectable": true},
 *                         "isOnlyServerPagable": false},
 *   "schema": {"items": {"properties": {"Id": {"type": "integer", "title": "Id"}, ...},
 *                        "required": ["Id"]}},
 *   "referencedEntities": {"FK_Orders_Customers": {"referencedEntity": "Customers",
 *                                                  "referencingAttribute": "CustomerId",
 *                                                  "referencedAttribute": "Id"}}
 * }
 * </pre>
 *
 * <p>Enum columns whose {@code enum} and {@code x-ms-enum-display-name} lists differ in length
 * lose their enum metadata; the inconsistency is logged and the column is kept.</p>
 */
public class TableSchemaParser {

    private static final Logger logger = LoggerFactory.getLogger(TableSchemaParser.class);

    private final CdpTypeMapperChain typeMapperChain;

    public TableSchemaParser() {
        this(CdpTypeMapperChain.defaultChain());
    }

    public TableSchemaParser(CdpTypeMapperChain typeMapperChain) {
        this.typeMapperChain = typeMapperChain;
    }

    /**
     * @param tableName        logical name the metadata was requested for
     * @param json             table metadata document
     * @param sqlRelationships foreign keys from the SQL catalog, empty when not queried
     */
    public TableSchema parse(String tableName, String json, List<Relationship> sqlRelationships) {
        DocumentContext document = JsonDocuments.parse(json, "table metadata");

        String name = JsonDocuments.read(document, "$.name");
        if (name == null) {
            name = tableName;
        }
        String title = JsonDocuments.read(document, "$.title");

        List<Relationship> relationships = new ArrayList<>(parseReferencedEntities(map(JsonDocuments.read(document, "$.referencedEntities"))));
        relationships.addAll(sqlRelationships);

        Map<String, Object> properties = map(JsonDocuments.read(document, "$.schema.items.properties"));
        Set<String> required = new HashSet<>();
        for (Object item : list(JsonDocuments.read(document, "$.schema.items.required"))) {
            required.add(item.toString());
        }

        List<ColumnDescriptor> columns = new ArrayList<>(properties.size());
        for (Map.Entry<String, Object> property : properties.entrySet()) {
            columns.add(parseColumn(name, property.getKey(), map(property.getValue()),
                    required.contains(property.getKey()), relationships));
        }

        Map<String, List<Relationship>> byTarget = new LinkedHashMap<>();
        for (Relationship relationship : relationships) {
            byTarget.computeIfAbsent(relationship.getTargetTable(), k -> new ArrayList<>()).add(relationship);
        }

        return new TableSchema(name, title != null ? title : name, columns, byTarget,
                parseCapabilities(map(JsonDocuments.read(document, "$['x-ms-capabilities']"))));
    }

    private ColumnDescriptor parseColumn(String tableName, String logicalName, Map<String, Object> property,
                                         boolean required, List<Relationship> relationships) {
        String displayName = string(property, "title");
        if (displayName == null) {
            displayName = string(property, "x-ms-summary");
        }
        if (displayName == null) {
            displayName = logicalName;
        }

        CdpFieldType type = CdpFieldType.of(typeMapperChain.mapType(string(property, "type"), string(property, "format")));

        List<String> enumValues = strings(property.get("enum"));
        List<String> enumDisplayNames = strings(property.get("x-ms-enum-display-name"));
        if (!enumDisplayNames.isEmpty() && enumDisplayNames.size() != enumValues.size()) {
            SchemaInconsistencyException inconsistency = SchemaInconsistencyException.buildEnumMismatch(
                    tableName, logicalName, enumValues.size(), enumDisplayNames.size());
            logger.warn(inconsistency.getMessage());
            enumValues = List.of();
            enumDisplayNames = List.of();
        }

        ExternalTableRef externalTableRef = null;
        for (Relationship relationship : relationships) {
            if (logicalName.equals(relationship.getSourceColumn())) {
                externalTableRef = new ExternalTableRef(relationship.getTargetTable(),
                        relationship.getTargetColumn(), relationship.getForeignKeyName());
                break;
            }
        }

        return new ColumnDescriptor(logicalName, displayName, type, required, enumValues, enumDisplayNames, externalTableRef);
    }

    private List<Relationship> parseReferencedEntities(Map<String, Object> referencedEntities) {
        List<Relationship> relationships = new ArrayList<>();
        for (Map.Entry<String, Object> entry : referencedEntities.entrySet()) {
            Map<String, Object> reference = map(entry.getValue());
            String target = string(reference, "referencedEntity");
            String source = string(reference, "referencingAttribute");
            if (target == null || source == null) {
                logger.warn("Ignoring incomplete referenced entity '{}'", entry.getKey());
                continue;
            }
            relationships.add(new Relationship(entry.getKey(), source, target, string(reference, "referencedAttribute")));
        }
        return relationships;
    }

    /**
     * Rows of the foreign key catalog:
     * {@code {"ResultSets": {"Table1": [{"FK_Name", "Parent_Table", "Parent_Column", "Referenced_Table", "Referenced_Column"}]}}}.
     * A missing result set means no relationships.
     */
    public List<Relationship> parseSqlRelationships(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        DocumentContext document = JsonDocuments.parse(json, "SQL relationships");
        List<Relationship> relationships = new ArrayList<>();
        for (Object item : list(JsonDocuments.read(document, "$.ResultSets.Table1"))) {
            Map<String, Object> row = map(item);
            relationships.add(new Relationship(
                    string(row, "FK_Name"),
                    string(row, "Parent_Column"),
                    string(row, "Referenced_Table"),
                    string(row, "Referenced_Column")));
        }
        return relationships;
    }

    private TableCapabilities parseCapabilities(Map<String, Object> capabilities) {
        if (capabilities.isEmpty()) {
            return TableCapabilities.DEFAULT;
        }
        Map<String, Object> sort = map(capabilities.get("sortRestrictions"));
        Map<String, Object> filter = map(capabilities.get("filterRestrictions"));
        Map<String, Object> select = map(capabilities.get("selectRestrictions"));

        Set<String> nonFilterable = new LinkedHashSet<>(strings(filter.get("nonFilterableProperties")));
        return new TableCapabilities(
                bool(sort, "sortable", false),
                bool(filter, "filterable", false),
                bool(select, "selectable", true),
                nonFilterable,
                bool(capabilities, "isOnlyServerPagable", false));
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        for (Object item : list(value)) {
            result.add(item == null ? null : item.toString());
        }
        return result;
    }
}
