package org.apache.calcite.adapter.cdp.tabular;

import com.jayway.jsonpath.DocumentContext;
import org.apache.calcite.adapter.cdp.model.TableDescriptor;
import org.apache.calcite.adapter.cdp.model.TableSchema;
import org.apache.calcite.adapter.cdp.tabular.delegation.DelegationParameters;
import org.apache.calcite.adapter.cdp.tabular.delegation.ODataQueryCompiler;
import org.apache.calcite.adapter.cdp.tabular.service.CdpEncoding;
import org.apache.calcite.adapter.cdp.tabular.service.CdpTableResolver;
import org.apache.calcite.adapter.cdp.tabular.service.JsonDocuments;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpRequest;
import org.apache.calcite.adapter.cdp.tabular.transport.CdpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Queryable handle on an initialized table.
 * <p>
 * Compiles {@link DelegationParameters} against the table's declared capabilities and reads
 * records from the {@code items} endpoint, following {@code @odata.nextLink} pages.
 * </p>
 */
public class CdpRowSource {

    private static final Logger logger = LoggerFactory.getLogger(CdpRowSource.class);

    private final CdpDataSource dataSource;
    private final TableDescriptor descriptor;
    private final TableSchema schema;
    private final ODataQueryCompiler compiler;

    CdpRowSource(CdpDataSource dataSource, TableDescriptor descriptor, TableSchema schema) {
        this.dataSource = dataSource;
        this.descriptor = descriptor;
        this.schema = schema;
        this.compiler = new ODataQueryCompiler(schema.getCapabilities().supportedFeatures()
                & ODataQueryCompiler.DEFAULT_SUPPORTED_FEATURES);
    }

    public TableSchema getSchema() {
        return schema;
    }

    public TableDescriptor getDescriptor() {
        return descriptor;
    }

    /** {@link org.apache.calcite.adapter.cdp.tabular.delegation.DelegationFeature} bits this table accepts. */
    public long getSupportedFeatures() {
        return compiler.getSupportedFeatures();
    }

    /**
     * @throws org.apache.calcite.adapter.cdp.tabular.exception.UnsupportedCapabilityException
     *         if the parameters use a feature the table does not support
     */
    public String buildItemsPath(DelegationParameters parameters) {
        String odata = compiler.compile(parameters);
        String prefix = dataSource.getUriPrefix();
        return prefix + (CdpTableResolver.useV2(prefix) ? "/v2" : "")
                + "/datasets/" + dataSource.encodedDatasetName()
                + "/tables/" + CdpEncoding.escapePathSegment(schema.getTableName())
                + "/items?" + CdpTableResolver.API_VERSION
                + (odata.isEmpty() ? "" : "&" + odata);
    }

    /** First page of the query. */
    public RowPage query(DelegationParameters parameters) {
        return fetch(buildItemsPath(parameters));
    }

    /**
     * @return the page after {@code page}, or an empty last page
     */
    public RowPage nextPage(RowPage page) {
        if (!page.hasNext()) {
            return new RowPage(List.of(), null, page.getTotalCount());
        }
        return fetch(page.getNextLink());
    }

    /**
     * Reads every record of the query, at most {@code maxRows} of the connector settings.
     */
    public List<Map<String, Object>> readAll(DelegationParameters parameters) {
        int maxRows = dataSource.getSettings().getMaxRows();
        List<Map<String, Object>> rows = new ArrayList<>();
        RowPage page = query(parameters);
        while (true) {
            for (Map<String, Object> row : page.getRows()) {
                if (rows.size() >= maxRows) {
                    return rows;
                }
                rows.add(row);
            }
            if (!page.hasNext() || rows.size() >= maxRows) {
                return rows;
            }
            page = nextPage(page);
        }
    }

    private RowPage fetch(String path) {
        logger.debug("Reading rows of {} from {}", schema.getTableName(), path);
        CdpResponse response = dataSource.getTransport().send(CdpRequest.get(path));
        if (response.isEmpty()) {
            return new RowPage(List.of(), null, null);
        }

        DocumentContext document = JsonDocuments.parse(response.getBody(), "items");
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object item : JsonDocuments.list(JsonDocuments.read(document,
                "$['" + DelegationParameters.ODATA_RESULT_FIELD_NAME + "']"))) {
            rows.add(JsonDocuments.map(item));
        }
        Object count = JsonDocuments.read(document, "$['" + DelegationParameters.ODATA_COUNT_FIELD_NAME + "']");
        String nextLink = JsonDocuments.read(document, "$['" + DelegationParameters.ODATA_NEXT_LINK_FIELD_NAME + "']");

        return new RowPage(rows, toRelative(nextLink),
                count instanceof Number ? ((Number) count).longValue() : null);
    }

    /** Next links may be absolute; the transport expects paths relative to the connector address. */
    private static String toRelative(String link) {
        if (link == null || link.isEmpty()) {
            return null;
        }
        if (!link.startsWith("http://") && !link.startsWith("https://")) {
            return link;
        }
        URI uri = URI.create(link);
        return uri.getRawPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");
    }
}
