package me.golemcore.costmodel.domain.service;

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

import me.golemcore.costmodel.domain.exception.QueryParseException;
import me.golemcore.costmodel.domain.model.QueryResult;
import me.golemcore.costmodel.domain.model.QueryValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses Prometheus HTTP API responses into {@link QueryResult} lists.
 *
 * <p>
 * Supported result types:
 * <ul>
 * <li>{@code vector} - one value per series ({@code "value": [ts, "v"]})</li>
 * <li>{@code matrix} - a value sequence per series ({@code "values"})</li>
 * <li>{@code scalar} - a single unlabeled value</li>
 * </ul>
 *
 * <p>
 * Sample values arrive as strings. {@code NaN} is read as 0 so that sums over
 * series stay finite; {@code +Inf}/{@code -Inf} are kept as infinities.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryResultParser {

    private final ObjectMapper objectMapper;

    /**
     * @param raw
     *            raw JSON response body
     * @return parsed series, empty when the query matched nothing
     * @throws QueryParseException
     *             if the payload is not a successful Prometheus response
     */
    public List<QueryResult> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new QueryParseException("Empty response from metrics backend");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new QueryParseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        String status = root.path("status").asText("");
        if (!"success".equals(status)) {
            String error = root.path("error").asText("");
            throw new QueryParseException("Query status '" + status + "'" + (error.isEmpty() ? "" : ": " + error));
        }

        JsonNode data = root.path("data");
        JsonNode result = data.path("result");
        if (data.isMissingNode() || result.isMissingNode() || result.isNull()) {
            throw new QueryParseException("Response is missing data.result");
        }

        String resultType = data.path("resultType").asText("");
        return switch (resultType) {
        case "vector" -> parseSeries(result, false);
        case "matrix" -> parseSeries(result, true);
        case "scalar" -> List.of(new QueryResult(Map.of(), List.of(parseSample(result))));
        default -> throw new QueryParseException("Unsupported result type '" + resultType + "'");
        };
    }

    private List<QueryResult> parseSeries(JsonNode result, boolean matrix) {
        if (!result.isArray()) {
            throw new QueryParseException("data.result is not an array");
        }

        List<QueryResult> series = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            Map<String, String> labels = parseLabels(node.path("metric"));
            List<QueryValue> values = new ArrayList<>();
            if (matrix) {
                JsonNode samples = node.path("values");
                if (!samples.isArray()) {
                    throw new QueryParseException("Matrix series is missing 'values'");
                }
                for (JsonNode sample : samples) {
                    values.add(parseSample(sample));
                }
            } else {
                JsonNode sample = node.path("value");
                if (!sample.isMissingNode() && !sample.isNull()) {
                    values.add(parseSample(sample));
                }
            }
            series.add(new QueryResult(labels, values));
        }
        return series;
    }

    private Map<String, String> parseLabels(JsonNode metric) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (metric.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = metric.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                labels.put(field.getKey(), field.getValue().asText(""));
            }
        }
        return labels;
    }

    private QueryValue parseSample(JsonNode sample) {
        if (!sample.isArray() || sample.size() != 2) {
            throw new QueryParseException("Sample is not a [timestamp, value] pair: " + sample);
        }
        JsonNode timestamp = sample.get(0);
        if (!timestamp.isNumber()) {
            throw new QueryParseException("Sample timestamp is not a number: " + timestamp);
        }
        return new QueryValue(timestamp.asDouble(), parseValue(sample.get(1).asText()));
    }

    private double parseValue(String text) {
        switch (text) {
        case "NaN":
            log.debug("[Query] NaN sample value read as 0");
            return 0.0;
        case "+Inf":
        case "Inf":
            return Double.POSITIVE_INFINITY;
        case "-Inf":
            return Double.NEGATIVE_INFINITY;
        default:
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new QueryParseException("Sample value is not a number: '" + text + "'", e);
            }
        }
    }
}
