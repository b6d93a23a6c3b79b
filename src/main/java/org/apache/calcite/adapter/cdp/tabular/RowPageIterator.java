package org.apache.calcite.adapter.cdp.tabular;

/**
 * Fetches the next batch of records of a table scan.
 */
public interface RowPageIterator {

    /**
     * @return next page; a page may be empty and still link to further pages
     */
    RowPage getMore();
}
