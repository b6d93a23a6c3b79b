package org.apache.calcite.adapter.cdp.tabular.service;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

/**
 * Encodings of names embedded in connector paths.
 */
public final class CdpEncoding {

    private static final Escaper FORM = UrlEscapers.urlFormParameterEscaper();
    private static final Escaper PATH_SEGMENT = UrlEscapers.urlPathSegmentEscaper();

    private CdpEncoding() {
    }

    /** Form encoding, space becomes '+'. */
    public static String singleEncode(String value) {
        return FORM.escape(value);
    }

    /** Form encoding applied twice, e.g. "a,b" becomes "a%252Cb". */
    public static String doubleEncode(String value) {
        return FORM.escape(FORM.escape(value));
    }

    /** Percent encoding of a path segment, space becomes "%20". */
    public static String escapePathSegment(String value) {
        return PATH_SEGMENT.escape(value);
    }

    public static String encodeDataset(String datasetName, boolean doubleEncoding) {
        return doubleEncoding ? doubleEncode(datasetName) : singleEncode(datasetName);
    }
}
