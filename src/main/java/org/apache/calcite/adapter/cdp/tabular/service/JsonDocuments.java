package org.apache.calcite.adapter.cdp.tabular.service;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import org.apache.calcite.adapter.cdp.tabular.exception.CdpException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JsonPath access to connector responses.
 * <p>
 * Backed by Jackson, so objects come back as insertion-ordered maps and column order
 * in schema documents is preserved.
 * </p>
 */
public final class JsonDocuments {

    private static final Configuration CONFIGURATION = Configuration.builder()
            .jsonProvider(new JacksonJsonProvider())
            .mappingProvider(new JacksonMappingProvider())
            .build();

    private JsonDocuments() {
    }

    /**
     * @throws CdpException if the text is not JSON
     */
    public static DocumentContext parse(String json, String what) {
        try {
            return JsonPath.using(CONFIGURATION).parse(json);
        } catch (InvalidJsonException e) {
            throw CdpException.buildCdpException("Invalid JSON in " + what + " response", e);
        }
    }

    /**
     * @return value at {@code path}, or null when the path is absent
     */
    public static <T> T read(DocumentContext document, String path) {
        try {
            return document.read(path);
        } catch (PathNotFoundException e) {
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Object value) {
        return value instanceof List ? (List<Object>) value : Collections.emptyList();
    }

    public static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    public static boolean bool(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString());
    }
}
