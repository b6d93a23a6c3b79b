package org.apache.calcite.adapter.cdp.tabular.transport;

import com.google.common.base.Joiner;
import org.apache.calcite.adapter.cdp.model.ConnectorSettings;
import org.apache.calcite.adapter.cdp.tabular.exception.TransportException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link CdpTransport} over Apache HttpClient 5.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Resolve relative connector paths against the configured base addresses</li>
 *   <li>Fail over to the next address when a request cannot be completed</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Turn non-2xx answers into {@link TransportException} with the status code</li>
 * </ul>
 *
 * <p><b>Note:</b> A backend answer with an error status is final and is not retried
 * against the other addresses.</p>
 */
public class HttpClientTransport implements CdpTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);

    /** Shared client, pooled connections across data sources. */
    private static final CloseableHttpClient SHARED_HTTP_CLIENT = HttpClientBuilder.create().build();

    private final ConnectorSettings settings;

    public HttpClientTransport(ConnectorSettings settings) {
        if (settings.getAddresses() == null || settings.getAddresses().isBlank()) {
            throw new IllegalArgumentException("No connector address configured");
        }
        this.settings = settings;
    }

    @Override
    public CdpResponse send(CdpRequest request) {
        List<String> errors = new ArrayList<>();
        IOException last = null;
        for (String address : settings.getAddresses().split(",")) {
            try {
                return execute(buildRequest(address.trim(), request));
            } catch (IOException e) {
                errors.add(e.getMessage());
                last = e;
                logger.warn("Request to {} failed: {}", address.trim(), e.getMessage());
            }
        }
        throw TransportException.buildIoException(request.getMethod(), request.getPath(),
                new IOException("All request attempts failed: " + Joiner.on(", \n").join(errors), last));
    }

    private HttpUriRequestBase buildRequest(String address, CdpRequest request) {
        // OData values keep literal spaces (e.g. "$orderby=score desc")
        String uri = address + request.getPath().replace(" ", "%20");

        HttpUriRequestBase httpRequest;
        if ("POST".equalsIgnoreCase(request.getMethod())) {
            httpRequest = new HttpPost(uri);
        } else {
            httpRequest = new HttpGet(uri);
        }
        if (request.getBody() != null) {
            httpRequest.setEntity(new StringEntity(request.getBody(), ContentType.APPLICATION_JSON));
        }

        httpRequest.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(settings.getConnectionTimeout(), TimeUnit.SECONDS)
                .setResponseTimeout(settings.getResponseTimeout(), TimeUnit.SECONDS)
                .build());

        for (Map.Entry<String, String> header : settings.getHeaders().entrySet()) {
            httpRequest.setHeader(header.getKey(), header.getValue());
        }
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            httpRequest.setHeader(header.getKey(), header.getValue());
        }
        return httpRequest;
    }

    private CdpResponse execute(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return SHARED_HTTP_CLIENT.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            String body = readBody(response.getEntity());
            if (!isSuccessfulResponse(statusCode)) {
                throw TransportException.buildStatusException(request.getMethod(), request.getRequestUri(), statusCode, body);
            }
            return new CdpResponse(statusCode, body);
        });
    }

    private String readBody(HttpEntity entity) throws IOException {
        if (entity == null) {
            return "";
        }
        try (InputStream is = entity.getContent()) {
            String responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            if (logger.isDebugEnabled()) {
                logger.debug("Response Body:");
                logger.debug("{}", responseBody);
            }
            return responseBody;
        }
    }

    private boolean isSuccessfulResponse(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        logger.debug("Headers:");
        for (var header : request.getHeaders()) {
            // authorization values stay out of the log
            String value = "Authorization".equalsIgnoreCase(header.getName()) ? "***" : header.getValue();
            logger.debug("  {}: {}", header.getName(), value);
        }
    }

    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (var header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
