package me.golemcore.costmodel.adapter.outbound.prometheus;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.costmodel.domain.exception.QueryTransportException;
import me.golemcore.costmodel.infrastructure.config.CostModelProperties;
import me.golemcore.costmodel.port.outbound.MetricsTransportPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Prometheus adapter: runs PromQL over the Prometheus HTTP API.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /api/v1/query - instant query
 * <li>GET /api/v1/query_range - range query ({@code start}, {@code end} and
 * {@code step} in seconds)
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code costmodel.prometheus.url} - Prometheus base URL
 * <li>{@code costmodel.prometheus.bearer-token} - optional bearer token
 * <li>{@code costmodel.http.*} - timeouts of the shared OkHttp client
 * </ul>
 *
 * <p>
 * The response body is returned as-is; parsing happens in the domain. A
 * non-2xx answer is reported with Prometheus' own {@code errorType} and
 * {@code error} text when the body carries them.
 *
 * @see me.golemcore.costmodel.port.outbound.MetricsTransportPort
 */
@Component
@Slf4j
public class PrometheusHttpAdapter implements MetricsTransportPort {

    private static final String QUERY_PATH = "api/v1/query";
    private static final String QUERY_RANGE_PATH = "api/v1/query_range";

    private final CostModelProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PrometheusHttpAdapter(CostModelProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String query(String query) {
        HttpUrl url = baseUrl().newBuilder()
                .addPathSegments(QUERY_PATH)
                .addQueryParameter("query", query)
                .build();
        return execute(url);
    }

    @Override
    public String queryRange(String query, Instant start, Instant end, Duration step) {
        HttpUrl url = baseUrl().newBuilder()
                .addPathSegments(QUERY_RANGE_PATH)
                .addQueryParameter("query", query)
                .addQueryParameter("start", formatSeconds(start.toEpochMilli()))
                .addQueryParameter("end", formatSeconds(end.toEpochMilli()))
                .addQueryParameter("step", formatSeconds(step.toMillis()))
                .build();
        return execute(url);
    }

    private String execute(HttpUrl url) {
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        addBearerHeader(requestBuilder);

        log.debug("[Prometheus] GET {}", url.encodedPath());
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                String reason = extractError(body);
                log.warn("[Prometheus] Query failed: HTTP {} {}", response.code(), reason);
                throw new QueryTransportException(
                        String.format("Prometheus returned HTTP %d: %s", response.code(), reason));
            }
            return body;
        } catch (IOException e) {
            log.warn("[Prometheus] Request error: {}", e.getMessage());
            throw new QueryTransportException("Prometheus unreachable at " + url.host() + ": " + e.getMessage(), e);
        }
    }

    private HttpUrl baseUrl() {
        String url = properties.getPrometheus().getUrl();
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            throw new QueryTransportException("Invalid Prometheus URL: " + url);
        }
        return parsed;
    }

    private void addBearerHeader(Request.Builder builder) {
        String token = properties.getPrometheus().getBearerToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
    }

    private String extractError(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            // Prometheus returns {"status":"error","errorType":"...","error":"..."}
            if (node.has("error")) {
                String errorType = node.path("errorType").asText("");
                String error = node.get("error").asText("");
                return errorType.isEmpty() ? error : errorType + ": " + error;
            }
        } catch (JsonProcessingException e) {
            log.debug("[Prometheus] Error body is not JSON, using raw text");
        }
        return body.trim();
    }

    // Whole seconds stay integral, sub-second values keep millisecond precision
    private static String formatSeconds(long millis) {
        if (millis % 1000 == 0) {
            return Long.toString(millis / 1000);
        }
        return String.format(Locale.ROOT, "%.3f", millis / 1000.0);
    }
}
