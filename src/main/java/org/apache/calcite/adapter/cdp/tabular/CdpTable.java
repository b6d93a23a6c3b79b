package org.apache.calcite.adapter.cdp.tabular;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.cdp.model.ColumnDescriptor;
import org.apache.calcite.adapter.cdp.model.TableDescriptor;
import org.apache.calcite.adapter.cdp.model.TableSchema;
import org.apache.calcite.adapter.cdp.tabular.delegation.DelegationFeature;
import org.apache.calcite.adapter.cdp.tabular.delegation.DelegationRequest;
import org.apache.calcite.adapter.cdp.tabular.delegation.ODataFilterConverter;
import org.apache.calcite.adapter.java.JavaTypeFactory;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.schema.ProjectableFilterableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@code CdpTable} represents a Calcite table mapped to one table of a CDP dataset.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Hydrates the table schema on first use, through the data source's metadata cache.</li>
 *   <li>Pushes projections ($select), convertible filters ($filter) and the row limit ($top)
 *       down to the connector, within the table's declared capabilities.</li>
 *   <li>Reads the result page by page, following next links.</li>
 * </ul>
 *
 * Filters are left in the list handed to {@link #scan}, so Calcite evaluates every one of
 * them again on the returned rows.
 */
public class CdpTable extends AbstractTable implements ProjectableFilterableTable {

    private static final Logger logger = LoggerFactory.getLogger(CdpTable.class);

    private final CdpDataSource dataSource;
    private final TableDescriptor descriptor;

    public CdpTable(CdpDataSource dataSource, TableDescriptor descriptor) {
        this.dataSource = dataSource;
        this.descriptor = descriptor;
    }

    public TableDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Builds the row type from the resolved schema; columns are named by their logical names.
     */
    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        TableSchema schema = ensureInitialized();
        List<RelDataType> types = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (ColumnDescriptor column : schema.getColumns()) {
            names.add(column.getLogicalName());
            types.add(column.getType().toType((JavaTypeFactory) typeFactory));
        }
        return typeFactory.createStructType(types, names);
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root, List<RexNode> filters, int[] projects) {
        TableSchema schema = ensureInitialized();
        CdpRowSource rowSource = dataSource.getRowSource(descriptor);
        DelegationRequest request = buildRequest(rowSource, schema, filters, projects);
        int maxRows = dataSource.getSettings().getMaxRows();
        logger.debug("Scanning {} with {}", schema.getTableName(), request);

        return new AbstractEnumerable<>() {
            public Enumerator<Object[]> enumerator() {
                AtomicReference<RowPage> page = new AtomicReference<>(rowSource.query(request));
                return new CdpDataEnumerator(page.get(), schema.getColumns(), projects, maxRows, () -> {
                    RowPage next = rowSource.nextPage(page.get());
                    page.set(next);
                    return next;
                });
            }
        };
    }

    private DelegationRequest buildRequest(CdpRowSource rowSource, TableSchema schema, List<RexNode> filters, int[] projects) {
        long supported = rowSource.getSupportedFeatures();
        long features = DelegationFeature.TOP.getMask();
        DelegationRequest.DelegationRequestBuilder builder = DelegationRequest.builder()
                .top(dataSource.getSettings().getMaxRows());

        if (projects != null && DelegationFeature.COLUMNS.isSet(supported)) {
            List<String> columns = new ArrayList<>(projects.length);
            for (int project : projects) {
                columns.add(schema.getColumns().get(project).getLogicalName());
            }
            if (!columns.isEmpty()) {
                builder.columns(columns);
                features |= DelegationFeature.COLUMNS.getMask();
            }
        }

        if (!filters.isEmpty() && DelegationFeature.FILTER.isSet(supported)) {
            String filter = new ODataFilterConverter(schema.getColumns(), schema.getCapabilities()).convertConjunction(filters);
            if (filter != null) {
                builder.filter(filter);
                features |= DelegationFeature.FILTER.getMask();
            }
        }
        return builder.features(features).build();
    }

    private synchronized TableSchema ensureInitialized() {
        if (!descriptor.isInitialized()) {
            dataSource.initTable(descriptor);
        }
        return descriptor.getSchema();
    }
}
