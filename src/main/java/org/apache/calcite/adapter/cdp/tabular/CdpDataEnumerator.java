package org.apache.calcite.adapter.cdp.tabular;

import org.apache.calcite.adapter.cdp.model.ColumnDescriptor;
import org.apache.calcite.linq4j.Enumerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Enumerator over the records of a table scan.
 * <p>
 * Walks one page at a time and asks the {@link RowPageIterator} for more when the page
 * is exhausted. Record values are read by logical column name and converted to the
 * column's SQL representation.
 * </p>
 */
public class CdpDataEnumerator implements Enumerator<Object[]> {

    /** Current page of records */
    private List<Map<String, Object>> rows;
    /** Whether the current page links to another one */
    private boolean hasMorePages;
    /** Current index in the page */
    private int index = -1;
    private Map<String, Object> current;
    /** Projected columns, in output order */
    private final List<ColumnDescriptor> columns;
    /** Records handed out so far */
    private int count;
    /** Stop after this many records */
    private final int limit;

    private final RowPageIterator pageIterator;

    /**
     * @param firstPage    first page
     * @param columns      all table columns in row type order
     * @param projects     indices of the projected columns, null for all
     * @param limit        maximum number of records returned
     * @param pageIterator source of the following pages
     */
    public CdpDataEnumerator(RowPage firstPage, List<ColumnDescriptor> columns, int[] projects,
                             int limit, RowPageIterator pageIterator) {
        this.rows = firstPage.getRows();
        this.hasMorePages = firstPage.hasNext();
        this.columns = getProjectColumns(projects, columns);
        this.limit = limit;
        this.pageIterator = pageIterator;
    }

    @Override
    public Object[] current() {
        Object[] objects = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            ColumnDescriptor column = columns.get(i);
            objects[i] = ValueConverter.convert(current.get(column.getLogicalName()), column.getType());
        }
        return objects;
    }

    @Override
    public boolean moveNext() {
        if (count >= limit) {
            return false;
        }
        while (index + 1 >= rows.size()) {
            if (!hasMorePages) {
                return false;
            }
            RowPage page = pageIterator.getMore();
            rows = page.getRows();
            hasMorePages = page.hasNext();
            index = -1;
        }
        current = rows.get(++index);
        count++;
        return true;
    }

    @Override
    public void reset() {
        throw new UnsupportedOperationException();
    }

    @Override
    public void close() {
        // nothing to release, pages are fetched on demand
    }

    private static List<ColumnDescriptor> getProjectColumns(int[] projects, List<ColumnDescriptor> columns) {
        if (projects == null) {
            return columns;
        }
        List<ColumnDescriptor> projected = new ArrayList<>(projects.length);
        for (int project : projects) {
            projected.add(columns.get(project));
        }
        return projected;
    }
}
