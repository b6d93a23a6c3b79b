package org.apache.calcite.adapter.cdp.model;

import lombok.Getter;

/**
 * Kind of a dataset, decided once when the dataset metadata is parsed.
 *
 * <p>A connector describes its datasets either through a {@code tabular} block,
 * a {@code blob} block, or neither. Downstream code switches on the concrete
 * subclass instead of probing response fields again.</p>
 */
@Getter
public abstract class DatasetKind {

    /** Where the dataset list comes from, e.g. "mru" or "singleton" */
    private final String source;
    private final String displayName;
    /** "single" or "double" */
    private final String urlEncoding;

    DatasetKind(String source, String displayName, String urlEncoding) {
        this.source = source;
        this.displayName = displayName;
        this.urlEncoding = urlEncoding;
    }

    /**
     * @return true when dataset names must be encoded twice in request paths
     */
    public boolean isDoubleEncoding() {
        return "double".equalsIgnoreCase(urlEncoding);
    }

    public abstract boolean isTabular();

    /** Dataset exposing tables. */
    @Getter
    public static final class Tabular extends DatasetKind {

        private final String tableDisplayName;
        private final String tablePluralName;

        public Tabular(String source, String displayName, String urlEncoding, String tableDisplayName, String tablePluralName) {
            super(source, displayName, urlEncoding);
            this.tableDisplayName = tableDisplayName;
            this.tablePluralName = tablePluralName;
        }

        @Override
        public boolean isTabular() {
            return true;
        }
    }

    /** Dataset exposing files. */
    public static final class Blob extends DatasetKind {

        public Blob(String source, String displayName, String urlEncoding) {
            super(source, displayName, urlEncoding);
        }

        @Override
        public boolean isTabular() {
            return false;
        }
    }

    /** Neither block was present. */
    public static final class Unknown extends DatasetKind {

        public static final Unknown INSTANCE = new Unknown();

        private Unknown() {
            super(null, null, null);
        }

        @Override
        public boolean isTabular() {
            return false;
        }
    }
}
